// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

/** Prints the steps of a use-def analysis in a line-oriented, human readable format. */
public class PrintingUseDefTracer<U extends Expression, D extends Expression>
    implements UseDefTracer<U, D> {

  private final PrintStream output;

  public PrintingUseDefTracer(PrintStream output) {
    this.output = output;
  }

  @Override
  public void traceBlock(BasicBlock<U, D> block) {
    output.println("basic block #" + block.getIndex() + " :");
    output.println("  predecessors: " + block.getPredecessors());
    for (Action<U, D> action : block.getActions()) {
      output.println("  action: " + action);
    }
    for (Int2ReferenceMap.Entry<DefinitionSite<D>> entry :
        block.getLastDefinitions().int2ReferenceEntrySet()) {
      output.println("  last def of lane " + entry.getIntKey() + ": " + entry.getValue());
    }
  }

  @Override
  public void traceFlowJob(BasicBlock<U, D> block, int lane, List<U> pendingUses, int iteration) {
    output.println(
        "  flowing "
            + pendingUses.size()
            + " use(s) of lane "
            + lane
            + " out of block #"
            + block.getIndex()
            + " (iteration "
            + iteration
            + ")");
  }

  @Override
  public void traceUseDefinitions(
      Map<U, Set<ReachingDefinition<D>>> useDefinitions, int numberOfLocations) {
    output.println("use-def dump:");
    for (Entry<U, Set<ReachingDefinition<D>>> entry : useDefinitions.entrySet()) {
      output.println("USE " + entry.getKey() + " is influenced by");
      for (ReachingDefinition<D> definition : entry.getValue()) {
        output.println("  " + definition);
      }
    }
    output.println("total locations: " + numberOfLocations);
  }
}
