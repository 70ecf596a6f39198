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

package com.google.flowchart;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.Collection;

/** Options for building flowcharts. */
public class FlowchartOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Calls to these names are drawn as input/output steps. They can be extended, not removed. */
  public static final ImmutableSet<String> DEFAULT_IO_FUNCTION_NAMES =
      ImmutableSet.of("input", "print");

  public static final int DEFAULT_MAX_INLINE_DEPTH = 32;

  private ImmutableSet<String> ioFunctionNames = DEFAULT_IO_FUNCTION_NAMES;

  /** How many inlined call sites may be nested inside each other. */
  private int maxInlineDepth = DEFAULT_MAX_INLINE_DEPTH;

  /** How {@code break} and {@code continue} outside of any loop are reported. */
  private CheckLevel orphanJumpLevel = CheckLevel.WARNING;

  public FlowchartOptions() {}

  /**
   * Sets additional names whose calls are drawn as input/output steps. The defaults ({@code
   * input} and {@code print}) always stay in the set.
   */
  public void setIoFunctionNames(Collection<String> names) {
    this.ioFunctionNames =
        ImmutableSet.<String>builder().addAll(DEFAULT_IO_FUNCTION_NAMES).addAll(names).build();
  }

  public void addIoFunctionName(String name) {
    checkArgument(!name.isEmpty(), "Empty function name");
    this.ioFunctionNames =
        ImmutableSet.<String>builder().addAll(ioFunctionNames).add(name).build();
  }

  public ImmutableSet<String> getIoFunctionNames() {
    return ioFunctionNames;
  }

  public boolean isIoFunction(String name) {
    return ioFunctionNames.contains(name);
  }

  public void setMaxInlineDepth(int maxInlineDepth) {
    checkArgument(maxInlineDepth > 0, "Inline depth must be positive: %s", maxInlineDepth);
    this.maxInlineDepth = maxInlineDepth;
  }

  public int getMaxInlineDepth() {
    return maxInlineDepth;
  }

  public void setOrphanJumpLevel(CheckLevel level) {
    this.orphanJumpLevel = checkNotNull(level);
  }

  public CheckLevel getOrphanJumpLevel() {
    return orphanJumpLevel;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ioFunctionNames", ioFunctionNames)
        .add("maxInlineDepth", maxInlineDepth)
        .add("orphanJumpLevel", orphanJumpLevel)
        .toString();
  }
}
