// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import java.util.List;

/**
 * Compact view of a {@link BasicBlock} used while flowing uses to their definitions.
 *
 * <pre>
 * Design notes:
 * - The last definitions are stored in parallel arrays rather than a map. Blocks usually define
 *   few lanes, so a linear scan is faster than hashing.
 * - lastTraversedIteration is compared against the iteration number of the current flow job, to
 *   find out whether this block has already been seen in that job without having to reset any
 *   state between jobs.
 * </pre>
 */
class FlowBlock<U extends Expression, D extends Expression> {

  static final int NULL_ITERATION = -1;

  final int index;
  final List<Action<U, D>> actions;
  final int[] predecessors;
  private final int[] lastDefinitionLanes;
  private final DefinitionSite<D>[] lastDefinitions;

  int lastTraversedIteration = NULL_ITERATION;

  @SuppressWarnings("unchecked")
  FlowBlock(BasicBlock<U, D> block) {
    this.index = block.getIndex();
    this.actions = block.getActions();
    this.predecessors = block.getPredecessors().toIntArray();
    Int2ReferenceMap<DefinitionSite<D>> blockLastDefinitions = block.getLastDefinitions();
    this.lastDefinitionLanes = new int[blockLastDefinitions.size()];
    this.lastDefinitions = new DefinitionSite[blockLastDefinitions.size()];
    int i = 0;
    for (Int2ReferenceMap.Entry<DefinitionSite<D>> entry :
        blockLastDefinitions.int2ReferenceEntrySet()) {
      lastDefinitionLanes[i] = entry.getIntKey();
      lastDefinitions[i] = entry.getValue();
      i++;
    }
  }

  boolean hasPredecessors() {
    return predecessors.length > 0;
  }

  /** Returns the last definition of {@code lane} in this block, or null if there is none. */
  DefinitionSite<D> getLastDefinition(int lane) {
    for (int i = 0; i < lastDefinitionLanes.length; i++) {
      if (lastDefinitionLanes[i] == lane) {
        return lastDefinitions[i];
      }
    }
    return null;
  }
}
