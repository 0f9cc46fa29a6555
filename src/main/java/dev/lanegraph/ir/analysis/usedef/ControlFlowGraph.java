// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import com.google.common.collect.ImmutableList;
import dev.lanegraph.errors.InternalCompilerError;
import dev.lanegraph.ir.code.Expression;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The basic blocks of one function, with the location of every use and definition they contain.
 *
 * <p>Every block is reachable from the entry block, and the entry block is the only block without
 * predecessors.
 */
public class ControlFlowGraph<U extends Expression, D extends Expression> {

  private final ImmutableList<BasicBlock<U, D>> blocks;
  private final BasicBlock<U, D> entryBlock;
  private final Map<Expression, ExpressionLocation> locations;

  ControlFlowGraph(
      List<BasicBlock<U, D>> blocks,
      BasicBlock<U, D> entryBlock,
      Map<Expression, ExpressionLocation> locations) {
    this.blocks = ImmutableList.copyOf(blocks);
    this.entryBlock = entryBlock;
    this.locations = locations;
    verifyEntryBlock();
  }

  private void verifyEntryBlock() {
    if (entryBlock == null || blocks.get(entryBlock.getIndex()) != entryBlock) {
      throw new InternalCompilerError("Control flow graph has no entry block");
    }
    if (entryBlock.hasPredecessors()) {
      throw new InternalCompilerError("Entry block " + entryBlock + " has predecessors");
    }
    for (BasicBlock<U, D> block : blocks) {
      if (block != entryBlock && !block.hasPredecessors()) {
        throw new InternalCompilerError(
            "Found " + block + " without predecessors in addition to the entry block");
      }
    }
  }

  public List<BasicBlock<U, D>> getBlocks() {
    return blocks;
  }

  public BasicBlock<U, D> getBlock(int index) {
    return blocks.get(index);
  }

  public int getNumberOfBlocks() {
    return blocks.size();
  }

  public BasicBlock<U, D> getEntryBlock() {
    return entryBlock;
  }

  public boolean isEntryBlock(BasicBlock<U, D> block) {
    return block == entryBlock;
  }

  /** Returns the location of every use and definition in reachable code, in program order. */
  public Map<Expression, ExpressionLocation> getLocations() {
    return Collections.unmodifiableMap(locations);
  }
}
