// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.ir.code.Function;
import dev.lanegraph.ir.code.LocalGet;
import dev.lanegraph.ir.code.LocalSet;
import dev.lanegraph.utils.AnalysisOptions;
import java.util.Set;

/**
 * Reaching definitions of the locals of a function: the lanes are the local indices, the uses are
 * {@link LocalGet}s and the definitions are {@link LocalSet}s (including tees).
 */
public class LocalGraph extends UseDefAnalysis<LocalGet, LocalSet> {

  public LocalGraph(Function function) {
    this(function, AnalysisOptions.defaults());
  }

  public LocalGraph(Function function, AnalysisOptions options) {
    super(function, new LocalClassifier(function.getNumberOfLocals()), options);
  }

  public Set<ReachingDefinition<LocalSet>> getSets(LocalGet get) {
    return getReachingDefinitions(get);
  }

  /** Returns the gets that read the value written by {@code set}. */
  public Set<LocalGet> getSetInfluences(LocalSet set) {
    return getReachedUses(set);
  }

  /** Returns the sets whose value contains {@code get}. */
  public Set<LocalSet> getGetInfluences(LocalGet get) {
    return getEnclosingDefinitions(get);
  }

  /** Returns true if the two gets are known to read the same value. */
  public boolean equivalent(LocalGet a, LocalGet b) {
    Set<ReachingDefinition<LocalSet>> aSets = getSets(a);
    Set<ReachingDefinition<LocalSet>> bSets = getSets(b);
    // A single reaching definition dominates the get: otherwise there would be another one, if
    // nothing else the entry value.
    if (aSets.size() != 1 || bSets.size() != 1) {
      return false;
    }
    ReachingDefinition<LocalSet> aSet = aSets.iterator().next();
    ReachingDefinition<LocalSet> bSet = bSets.iterator().next();
    if (aSet.isDefinitionSite() || bSet.isDefinitionSite()) {
      return aSet.equals(bSet);
    }
    // Both read an entry value.
    if (function.isParam(a.getIndex()) || function.isParam(b.getIndex())) {
      return a.getIndex() == b.getIndex();
    }
    // Both are variables, and hold the zero value of their type.
    return function.getLocalType(a.getIndex()) == function.getLocalType(b.getIndex());
  }

  static class LocalClassifier implements UseDefClassifier<LocalGet, LocalSet> {

    private final int numberOfLocals;

    LocalClassifier(int numberOfLocals) {
      this.numberOfLocals = numberOfLocals;
    }

    @Override
    public LocalGet asUseOrNull(Expression expression) {
      return expression.asLocalGet();
    }

    @Override
    public LocalSet asDefOrNull(Expression expression) {
      return expression.asLocalSet();
    }

    @Override
    public int getUseLane(LocalGet use) {
      return use.getIndex();
    }

    @Override
    public int getDefLane(LocalSet def) {
      return def.getIndex();
    }

    @Override
    public Expression getDefValue(LocalSet def) {
      return def.getValue();
    }

    @Override
    public int getNumberOfLanes() {
      return numberOfLocals;
    }
  }
}
