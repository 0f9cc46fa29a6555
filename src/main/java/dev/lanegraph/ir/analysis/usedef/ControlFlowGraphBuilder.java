// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.errors.InternalCompilerError;
import dev.lanegraph.errors.Unreachable;
import dev.lanegraph.ir.code.Block;
import dev.lanegraph.ir.code.Break;
import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.ir.code.Function;
import dev.lanegraph.ir.code.If;
import dev.lanegraph.ir.code.Loop;
import dev.lanegraph.ir.code.Switch;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Reference2ObjectLinkedOpenHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Partitions a function body into basic blocks.
 *
 * <p>The body is walked in evaluation order, so the operands of an expression are visited before
 * the expression itself. Code that follows an unconditional control transfer is walked, but does
 * not contribute to any block or to the location table.
 */
public class ControlFlowGraphBuilder<U extends Expression, D extends Expression> {

  private final Function function;
  private final UseDefClassifier<U, D> classifier;
  private final int numberOfLanes;

  private final List<BasicBlock<U, D>> blocks = new ArrayList<>();
  private final Map<Expression, ExpressionLocation> locations =
      new Reference2ObjectLinkedOpenHashMap<>();
  private final Deque<BreakTarget<U, D>> breakTargets = new ArrayDeque<>();

  // Null while walking unreachable code.
  private BasicBlock<U, D> currentBlock;

  public ControlFlowGraphBuilder(Function function, UseDefClassifier<U, D> classifier) {
    this.function = function;
    this.classifier = classifier;
    this.numberOfLanes = classifier.getNumberOfLanes();
  }

  public ControlFlowGraph<U, D> build() {
    assert blocks.isEmpty() : "ControlFlowGraphBuilder cannot be reused";
    BasicBlock<U, D> entryBlock = createBlock();
    currentBlock = entryBlock;
    visit(function.getBody(), ExpressionLocation.body(function));
    assert breakTargets.isEmpty();
    return new ControlFlowGraph<>(blocks, entryBlock, locations);
  }

  private void visit(Expression expression, ExpressionLocation location) {
    switch (expression.getKind()) {
      case BLOCK:
        visitBlock(expression.asBlock());
        break;
      case BREAK:
        visitBreak(expression.asBreak());
        break;
      case IF:
        visitIf(expression.asIf());
        break;
      case LOOP:
        visitLoop(expression.asLoop());
        break;
      case SWITCH:
        visitSwitch(expression.asSwitch());
        break;
      case BINARY:
      case CALL:
      case CONST:
      case DROP:
      case GLOBAL_GET:
      case GLOBAL_SET:
      case LOCAL_GET:
      case LOCAL_SET:
      case NOP:
      case RETURN:
      case TRAP:
        visitOperands(expression);
        break;
      default:
        throw new Unreachable("Unexpected expression kind " + expression.getKind());
    }
    record(expression, location);
    if (expression.getKind().isUnconditionalTransfer()) {
      currentBlock = null;
    }
  }

  private void visitOperands(Expression expression) {
    for (int i = 0; i < expression.getNumberOfOperands(); i++) {
      visitOperand(expression, i);
    }
  }

  private void visitOperand(Expression parent, int index) {
    visit(parent.getOperand(index), ExpressionLocation.operand(function, parent, index));
  }

  private void visitBlock(Block block) {
    BreakTarget<U, D> target = null;
    if (block.hasLabel()) {
      target = BreakTarget.forBlock(block.getLabel());
      breakTargets.push(target);
    }
    visitOperands(block);
    if (target != null) {
      BreakTarget<U, D> popped = breakTargets.pop();
      assert popped == target;
      if (!target.branchOrigins.isEmpty()) {
        // The code after the block is reached by falling through and by every break to it.
        IntSet incoming = new IntLinkedOpenHashSet();
        if (currentBlock != null) {
          incoming.add(currentBlock.getIndex());
        }
        incoming.addAll(target.branchOrigins);
        startJoinBlock(incoming);
      }
    }
  }

  private void visitIf(If theIf) {
    visitOperand(theIf, 0);
    BasicBlock<U, D> conditionBlock = currentBlock;
    currentBlock = startBlockFrom(conditionBlock);
    visitOperand(theIf, 1);
    BasicBlock<U, D> ifTrueEnd = currentBlock;
    BasicBlock<U, D> ifFalseEnd;
    if (theIf.hasIfFalse()) {
      currentBlock = startBlockFrom(conditionBlock);
      visitOperand(theIf, 2);
      ifFalseEnd = currentBlock;
    } else {
      ifFalseEnd = conditionBlock;
    }
    IntSet incoming = new IntLinkedOpenHashSet();
    if (ifTrueEnd != null) {
      incoming.add(ifTrueEnd.getIndex());
    }
    if (ifFalseEnd != null) {
      incoming.add(ifFalseEnd.getIndex());
    }
    startJoinBlock(incoming);
  }

  private void visitLoop(Loop loop) {
    BasicBlock<U, D> header = startBlockFrom(currentBlock);
    currentBlock = header;
    BreakTarget<U, D> target = BreakTarget.forLoop(loop.getLabel(), header);
    breakTargets.push(target);
    visitOperand(loop, 0);
    BreakTarget<U, D> popped = breakTargets.pop();
    assert popped == target;
  }

  private void visitBreak(Break theBreak) {
    visitOperands(theBreak);
    BreakTarget<U, D> target = findBreakTarget(theBreak.getLabel());
    if (currentBlock == null) {
      return;
    }
    branchTo(target, currentBlock);
    currentBlock = theBreak.isConditional() ? startBlockFrom(currentBlock) : null;
  }

  private void visitSwitch(Switch theSwitch) {
    visitOperands(theSwitch);
    List<BreakTarget<U, D>> targets = new ArrayList<>();
    for (String label : theSwitch.getTargets()) {
      targets.add(findBreakTarget(label));
    }
    targets.add(findBreakTarget(theSwitch.getDefaultTarget()));
    if (currentBlock == null) {
      return;
    }
    for (BreakTarget<U, D> target : targets) {
      branchTo(target, currentBlock);
    }
  }

  private void record(Expression expression, ExpressionLocation location) {
    if (currentBlock == null) {
      return;
    }
    U use = classifier.asUseOrNull(expression);
    D def = classifier.asDefOrNull(expression);
    if (use != null) {
      if (def != null) {
        throw new InternalCompilerError(
            "Expression " + expression + " is classified as both a use and a definition");
      }
      currentBlock.addUse(use, checkLane(classifier.getUseLane(use), expression));
      locations.put(expression, location);
    } else if (def != null) {
      int lane = checkLane(classifier.getDefLane(def), expression);
      currentBlock.addDef(new DefinitionSite<>(def, lane));
      locations.put(expression, location);
    }
  }

  private int checkLane(int lane, Expression expression) {
    if (lane < 0 || lane >= numberOfLanes) {
      throw new InternalCompilerError(
          "Lane " + lane + " of " + expression + " is not in [0, " + numberOfLanes + ")");
    }
    return lane;
  }

  private BreakTarget<U, D> findBreakTarget(String label) {
    Iterator<BreakTarget<U, D>> iterator = breakTargets.iterator();
    while (iterator.hasNext()) {
      BreakTarget<U, D> target = iterator.next();
      if (target.label.equals(label)) {
        return target;
      }
    }
    throw new InternalCompilerError(
        "Break target '" + label + "' is not in scope in " + function);
  }

  private void branchTo(BreakTarget<U, D> target, BasicBlock<U, D> origin) {
    if (target.isLoop()) {
      // A loop that is entered from unreachable code has no header, and neither has any origin
      // inside of it.
      assert target.loopHeader != null;
      origin.link(target.loopHeader);
    } else {
      target.branchOrigins.add(origin.getIndex());
    }
  }

  private BasicBlock<U, D> createBlock() {
    BasicBlock<U, D> block = new BasicBlock<>(blocks.size());
    blocks.add(block);
    return block;
  }

  private BasicBlock<U, D> startBlockFrom(BasicBlock<U, D> predecessor) {
    if (predecessor == null) {
      return null;
    }
    BasicBlock<U, D> block = createBlock();
    predecessor.link(block);
    return block;
  }

  private void startJoinBlock(IntSet incoming) {
    if (incoming.isEmpty()) {
      currentBlock = null;
      return;
    }
    BasicBlock<U, D> block = createBlock();
    for (int predecessor : incoming) {
      blocks.get(predecessor).link(block);
    }
    currentBlock = block;
  }

  private static class BreakTarget<U extends Expression, D extends Expression> {

    private final String label;
    private final boolean isLoop;
    // Null for blocks, and for loops in unreachable code.
    private final BasicBlock<U, D> loopHeader;
    private final IntSet branchOrigins = new IntLinkedOpenHashSet();

    private BreakTarget(String label, boolean isLoop, BasicBlock<U, D> loopHeader) {
      this.label = label;
      this.isLoop = isLoop;
      this.loopHeader = loopHeader;
    }

    static <U extends Expression, D extends Expression> BreakTarget<U, D> forBlock(String label) {
      return new BreakTarget<>(label, false, null);
    }

    static <U extends Expression, D extends Expression> BreakTarget<U, D> forLoop(
        String label, BasicBlock<U, D> loopHeader) {
      return new BreakTarget<>(label, true, loopHeader);
    }

    boolean isLoop() {
      return isLoop;
    }
  }
}
