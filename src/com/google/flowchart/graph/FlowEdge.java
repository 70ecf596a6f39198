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

import com.google.common.base.Strings;
import org.jspecify.annotations.Nullable;

/**
 * A transition between two flowchart nodes.
 *
 * @param source Id of the node the transition leaves.
 * @param target Id of the node the transition enters.
 * @param label Branch or control tag such as "Yes", "Loop" or "break"; empty when unlabeled.
 */
public record FlowEdge(@Nullable String source, @Nullable String target, String label) {
  public static final String YES = "Yes";
  public static final String NO = "No";
  public static final String LOOP = "Loop";
  public static final String END_LOOP = "End Loop";
  public static final String BREAK = "break";
  public static final String CONTINUE = "continue";

  public FlowEdge {
    label = Strings.nullToEmpty(label);
  }

  public FlowEdge(@Nullable String source, @Nullable String target) {
    this(source, target, "");
  }

  public boolean hasLabel() {
    return !label.isEmpty();
  }

  /** Whether both endpoints are present. Edges failing this are never rendered. */
  public boolean isWellFormed() {
    return !Strings.isNullOrEmpty(source) && !Strings.isNullOrEmpty(target);
  }
}
