// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Receives the intermediate steps of a {@link UseDefAnalysis}, for debugging. */
public interface UseDefTracer<U extends Expression, D extends Expression> {

  @SuppressWarnings("unchecked")
  static <U extends Expression, D extends Expression> UseDefTracer<U, D> empty() {
    return (UseDefTracer<U, D>) EmptyUseDefTracer.INSTANCE;
  }

  default boolean isEmpty() {
    return false;
  }

  /** Called before the uses of {@code block} are resolved. */
  void traceBlock(BasicBlock<U, D> block);

  /**
   * Called when the uses of {@code lane} that are not defined inside {@code block} start flowing
   * to the predecessors of the block.
   */
  void traceFlowJob(BasicBlock<U, D> block, int lane, List<U> pendingUses, int iteration);

  /** Called once with the final result. */
  void traceUseDefinitions(
      Map<U, Set<ReachingDefinition<D>>> useDefinitions, int numberOfLocations);
}
