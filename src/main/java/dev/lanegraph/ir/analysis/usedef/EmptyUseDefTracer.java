// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import java.util.List;
import java.util.Map;
import java.util.Set;

class EmptyUseDefTracer implements UseDefTracer<Expression, Expression> {

  static final EmptyUseDefTracer INSTANCE = new EmptyUseDefTracer();

  private EmptyUseDefTracer() {}

  @Override
  public boolean isEmpty() {
    return true;
  }

  @Override
  public void traceBlock(BasicBlock<Expression, Expression> block) {}

  @Override
  public void traceFlowJob(
      BasicBlock<Expression, Expression> block,
      int lane,
      List<Expression> pendingUses,
      int iteration) {}

  @Override
  public void traceUseDefinitions(
      Map<Expression, Set<ReachingDefinition<Expression>>> useDefinitions,
      int numberOfLocations) {}
}
