// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import com.google.common.collect.ImmutableSet;
import dev.lanegraph.errors.InternalCompilerError;
import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.ir.code.Function;
import dev.lanegraph.utils.AnalysisOptions;
import dev.lanegraph.utils.timing.Timing;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * A reaching definitions analysis of one function.
 *
 * <p>For every use in reachable code this computes the set of definitions whose value the use may
 * observe. If the use may observe the value its lane had on function entry, the set contains
 * {@link EntryValue}. The set is never empty for a use in reachable code.
 *
 * <p>Which expressions are uses and definitions, and which lane they access, is decided by a
 * {@link UseDefClassifier}. The analysis does not modify the function. The derived {@link
 * InfluenceIndex} and the SSA lanes are computed on first request.
 *
 * <p>Consider the following example, where {@code x} is a local.
 *
 * <pre>
 *   x = 1;       // def1
 *   if (c) {
 *     x = 2;     // def2
 *   }
 *   use(x);      // use
 * </pre>
 *
 * <p>The reaching definitions of {@code use} are {def1, def2}, and {@code x} is not an SSA lane.
 */
public class UseDefAnalysis<U extends Expression, D extends Expression> {

  protected final Function function;
  protected final UseDefClassifier<U, D> classifier;

  private final ControlFlowGraph<U, D> graph;
  private final Map<U, Set<ReachingDefinition<D>>> useDefinitions;

  private InfluenceIndex<U, D> influenceIndex;
  private IntSet ssaLanes;

  public UseDefAnalysis(Function function, UseDefClassifier<U, D> classifier) {
    this(function, classifier, AnalysisOptions.defaults());
  }

  public UseDefAnalysis(
      Function function, UseDefClassifier<U, D> classifier, AnalysisOptions options) {
    this.function = function;
    this.classifier = classifier;
    Timing timing = options.createTiming("Use-def analysis of " + function.getName());
    UseDefTracer<U, D> tracer = options.createUseDefTracer();
    ControlFlowGraph<U, D> graph =
        timing.time(
            "Build control flow graph",
            () -> new ControlFlowGraphBuilder<>(function, classifier).build());
    Map<U, Set<ReachingDefinition<D>>> useDefinitions =
        timing.time(
            "Compute reaching definitions",
            () -> ReachingDefinitionsFlow.run(graph, classifier.getNumberOfLanes(), tracer));
    if (options.verifyUseDefCoverage) {
      verifyUseDefCoverage(graph, useDefinitions);
    }
    if (!tracer.isEmpty()) {
      tracer.traceUseDefinitions(
          Collections.unmodifiableMap(useDefinitions), graph.getLocations().size());
    }
    timing.end();
    timing.report();
    this.graph = graph;
    this.useDefinitions = useDefinitions;
  }

  private static <U extends Expression, D extends Expression> void verifyUseDefCoverage(
      ControlFlowGraph<U, D> graph, Map<U, Set<ReachingDefinition<D>>> useDefinitions) {
    for (BasicBlock<U, D> block : graph.getBlocks()) {
      for (Action<U, D> action : block.getActions()) {
        if (action.isUse() && !useDefinitions.containsKey(action.asUse().getUse())) {
          throw new InternalCompilerError(
              "No reaching definition found for " + action.getExpression() + " in " + block);
        }
      }
    }
  }

  public Function getFunction() {
    return function;
  }

  public ControlFlowGraph<U, D> getControlFlowGraph() {
    return graph;
  }

  public int getNumberOfLanes() {
    return classifier.getNumberOfLanes();
  }

  /** Returns the uses in reachable code, in the order in which they were resolved. */
  public Set<U> getUses() {
    return Collections.unmodifiableSet(useDefinitions.keySet());
  }

  /**
   * Returns the definitions that may reach {@code use}, or the empty set if {@code use} is not a
   * use in reachable code of this function.
   */
  public Set<ReachingDefinition<D>> getReachingDefinitions(U use) {
    Set<ReachingDefinition<D>> definitions = useDefinitions.get(use);
    return definitions != null ? Collections.unmodifiableSet(definitions) : Collections.emptySet();
  }

  /** Returns the explicit definitions that may reach {@code use}, leaving out the entry value. */
  public Set<D> getDefinitions(U use) {
    ImmutableSet.Builder<D> builder = ImmutableSet.builder();
    for (ReachingDefinition<D> definition : getReachingDefinitions(use)) {
      if (definition.isDefinitionSite()) {
        builder.add(definition.asDefinitionSite().getDefinition());
      }
    }
    return builder.build();
  }

  /** Returns true if {@code use} may observe the value its lane had on function entry. */
  public boolean isReachedByEntryValue(U use) {
    return getReachingDefinitions(use).contains(EntryValue.get());
  }

  /** Returns the location of every use and definition in reachable code, in program order. */
  public Map<Expression, ExpressionLocation> getLocations() {
    return graph.getLocations();
  }

  /** Returns the location of {@code expression}, or null if it is not a recorded use or def. */
  public ExpressionLocation getLocation(Expression expression) {
    return graph.getLocations().get(expression);
  }

  public InfluenceIndex<U, D> getInfluenceIndex() {
    if (influenceIndex == null) {
      influenceIndex = InfluenceIndex.compute(classifier, graph.getLocations(), useDefinitions);
    }
    return influenceIndex;
  }

  /** Returns the uses nested inside the value written by {@code def}. */
  public Set<U> getNestedUses(D def) {
    return getInfluenceIndex().getNestedUses(def);
  }

  /** Returns the definitions whose written value contains {@code use}. */
  public Set<D> getEnclosingDefinitions(U use) {
    return getInfluenceIndex().getEnclosingDefinitions(use);
  }

  /** Returns the uses that {@code def} may reach. */
  public Set<U> getReachedUses(D def) {
    return getInfluenceIndex().getReachedUses(def);
  }

  public IntSet getSSALanes() {
    if (ssaLanes == null) {
      ssaLanes = SSALaneClassifier.compute(classifier, graph.getLocations(), useDefinitions);
    }
    return ssaLanes;
  }

  public boolean isSSA(int lane) {
    if (lane < 0 || lane >= getNumberOfLanes()) {
      throw new InternalCompilerError(
          "Lane " + lane + " is not in [0, " + getNumberOfLanes() + ")");
    }
    return getSSALanes().contains(lane);
  }
}
