// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;

/**
 * Defines which expressions a {@link UseDefAnalysis} considers reads (uses) and writes
 * (definitions), and which storage slot ("lane") each of them accesses.
 *
 * <p>This lets the same flow algorithm serve different kinds of slots, for example locals or
 * globals. An expression must not be both a use and a definition.
 */
public interface UseDefClassifier<U extends Expression, D extends Expression> {

  /** Returns the expression as a use, or null if it is not a use. */
  U asUseOrNull(Expression expression);

  /** Returns the expression as a definition, or null if it is not a definition. */
  D asDefOrNull(Expression expression);

  int getUseLane(U use);

  int getDefLane(D def);

  /** Returns the expression that computes the value written by {@code def}. */
  Expression getDefValue(D def);

  int getNumberOfLanes();

  default boolean isUse(Expression expression) {
    return asUseOrNull(expression) != null;
  }

  default boolean isDef(Expression expression) {
    return asDefOrNull(expression) != null;
  }
}
