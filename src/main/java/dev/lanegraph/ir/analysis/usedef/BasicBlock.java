// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMaps;
import it.unimi.dsi.fastutil.ints.Int2ReferenceOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line sequence of uses and definitions, without control transfer in between.
 *
 * <p>Blocks are owned by their {@link ControlFlowGraph}; predecessors and successors are indices
 * into {@link ControlFlowGraph#getBlocks()}.
 */
public class BasicBlock<U extends Expression, D extends Expression> {

  private final int index;
  private final List<Action<U, D>> actions = new ArrayList<>();
  private final IntList predecessors = new IntArrayList();
  private final IntList successors = new IntArrayList();
  // For each lane, the last definition of it in this block.
  private final Int2ReferenceMap<DefinitionSite<D>> lastDefinitions =
      new Int2ReferenceOpenHashMap<>();

  BasicBlock(int index) {
    this.index = index;
  }

  public int getIndex() {
    return index;
  }

  public List<Action<U, D>> getActions() {
    return Collections.unmodifiableList(actions);
  }

  public IntList getPredecessors() {
    return IntLists.unmodifiable(predecessors);
  }

  public boolean hasPredecessors() {
    return !predecessors.isEmpty();
  }

  public IntList getSuccessors() {
    return IntLists.unmodifiable(successors);
  }

  public Int2ReferenceMap<DefinitionSite<D>> getLastDefinitions() {
    return Int2ReferenceMaps.unmodifiable(lastDefinitions);
  }

  /** Returns the last definition of {@code lane} in this block, or null if there is none. */
  public DefinitionSite<D> getLastDefinition(int lane) {
    return lastDefinitions.get(lane);
  }

  void addUse(U use, int lane) {
    actions.add(Action.use(use, lane));
  }

  void addDef(DefinitionSite<D> definitionSite) {
    actions.add(Action.def(definitionSite));
    lastDefinitions.put(definitionSite.getLane(), definitionSite);
  }

  void link(BasicBlock<U, D> successor) {
    if (!successors.contains(successor.index)) {
      successors.add(successor.index);
      successor.predecessors.add(index);
    }
  }

  @Override
  public String toString() {
    return "block #" + index;
  }
}
