// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.errors.InternalCompilerError;
import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.Reference2ObjectLinkedOpenHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes, for every use in a {@link ControlFlowGraph}, the set of definitions that may reach it.
 *
 * <p>Each block is first resolved locally by scanning its actions backwards: a use is reached by
 * the closest preceding definition of its lane in the same block. The uses that remain are flowed
 * backwards through the predecessors, one job per (block, lane), until a definition of the lane or
 * the entry block is found on every path.
 */
class ReachingDefinitionsFlow<U extends Expression, D extends Expression> {

  private final ControlFlowGraph<U, D> graph;
  private final UseDefTracer<U, D> tracer;

  private final List<FlowBlock<U, D>> flowBlocks;
  // For each lane, the uses in the current block that are not yet resolved.
  private final List<List<U>> pendingUses;
  // The lanes that had pending uses added while scanning the current block. May contain
  // duplicates, and lanes whose pending uses have since been resolved.
  private final IntList lanesWithPendingUses = new IntArrayList();

  private final Map<U, Set<ReachingDefinition<D>>> useDefinitions =
      new Reference2ObjectLinkedOpenHashMap<>();

  private int currentIteration = 0;

  private ReachingDefinitionsFlow(
      ControlFlowGraph<U, D> graph, int numberOfLanes, UseDefTracer<U, D> tracer) {
    this.graph = graph;
    this.tracer = tracer;
    this.flowBlocks = new ArrayList<>(graph.getNumberOfBlocks());
    for (BasicBlock<U, D> block : graph.getBlocks()) {
      flowBlocks.add(new FlowBlock<>(block));
    }
    this.pendingUses = new ArrayList<>(numberOfLanes);
    for (int lane = 0; lane < numberOfLanes; lane++) {
      pendingUses.add(new ArrayList<>());
    }
  }

  /**
   * Returns a map from each use to the definitions that reach it. The map and its sets iterate in
   * a deterministic order.
   */
  static <U extends Expression, D extends Expression> Map<U, Set<ReachingDefinition<D>>> run(
      ControlFlowGraph<U, D> graph, int numberOfLanes, UseDefTracer<U, D> tracer) {
    return new ReachingDefinitionsFlow<>(graph, numberOfLanes, tracer).run();
  }

  private Map<U, Set<ReachingDefinition<D>>> run() {
    for (FlowBlock<U, D> block : flowBlocks) {
      if (!tracer.isEmpty()) {
        tracer.traceBlock(graph.getBlock(block.index));
      }
      resolveLocally(block);
      for (int lane : lanesWithPendingUses) {
        List<U> uses = pendingUses.get(lane);
        if (uses.isEmpty()) {
          continue;
        }
        if (!tracer.isEmpty()) {
          tracer.traceFlowJob(graph.getBlock(block.index), lane, uses, currentIteration);
        }
        flowToPredecessors(block, lane, uses);
        uses.clear();
        currentIteration++;
      }
      lanesWithPendingUses.clear();
    }
    return useDefinitions;
  }

  private void resolveLocally(FlowBlock<U, D> block) {
    List<Action<U, D>> actions = block.actions;
    for (int i = actions.size() - 1; i >= 0; i--) {
      Action<U, D> action = actions.get(i);
      List<U> uses = pendingUses.get(action.getLane());
      if (action.isUse()) {
        if (uses.isEmpty()) {
          lanesWithPendingUses.add(action.getLane());
        }
        uses.add(action.asUse().getUse());
      } else {
        // This definition is the only definition for all the pending uses of its lane. Earlier
        // definitions in the block cannot reach them.
        DefinitionSite<D> definition = action.asDef().getDefinitionSite();
        for (U use : uses) {
          addDefinition(use, definition);
        }
        uses.clear();
      }
    }
  }

  private void flowToPredecessors(FlowBlock<U, D> block, int lane, List<U> uses) {
    // The initial block is not marked as seen: in a loop its own last definition of the lane may
    // reach the uses through the back edge.
    Deque<FlowBlock<U, D>> worklist = new ArrayDeque<>();
    worklist.push(block);
    while (!worklist.isEmpty()) {
      FlowBlock<U, D> current = worklist.pop();
      if (!current.hasPredecessors()) {
        if (current.index != graph.getEntryBlock().getIndex()) {
          throw new InternalCompilerError(
              "Reached block #" + current.index + " without predecessors that is not the entry");
        }
        for (U use : uses) {
          addDefinition(use, EntryValue.get());
        }
        continue;
      }
      for (int predecessorIndex : current.predecessors) {
        FlowBlock<U, D> predecessor = flowBlocks.get(predecessorIndex);
        if (predecessor.lastTraversedIteration == currentIteration) {
          continue;
        }
        predecessor.lastTraversedIteration = currentIteration;
        DefinitionSite<D> lastDefinition = predecessor.getLastDefinition(lane);
        if (lastDefinition != null) {
          // Stop the flow along this path.
          for (U use : uses) {
            addDefinition(use, lastDefinition);
          }
        } else {
          worklist.push(predecessor);
        }
      }
    }
  }

  private void addDefinition(U use, ReachingDefinition<D> definition) {
    useDefinitions
        .computeIfAbsent(use, ignore -> new ObjectLinkedOpenHashSet<>())
        .add(definition);
  }
}
