/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.flowchart.graph;

import static java.util.Objects.requireNonNull;

/**
 * A step of the flowchart.
 *
 * @param id Unique id, assigned in creation order.
 * @param label Source snippet or synthetic caption shown inside the shape.
 * @param shape Visual category.
 */
public record FlowNode(String id, String label, Shape shape) {
  public FlowNode {
    requireNonNull(id, "id");
    requireNonNull(label, "label");
    requireNonNull(shape, "shape");
  }
}
