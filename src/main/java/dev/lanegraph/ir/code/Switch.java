// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Transfers control to {@code targets[condition]}, or to {@code defaultTarget} when the condition
 * is out of range. Control never falls through a switch.
 */
public class Switch extends Expression {

  private final List<String> targets;
  private final String defaultTarget;
  private Expression condition;

  public Switch(List<String> targets, String defaultTarget, Expression condition) {
    this.targets = ImmutableList.copyOf(targets);
    this.defaultTarget = Objects.requireNonNull(defaultTarget);
    this.condition = Objects.requireNonNull(condition);
  }

  public List<String> getTargets() {
    return targets;
  }

  public String getDefaultTarget() {
    return defaultTarget;
  }

  public Expression getCondition() {
    return condition;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.SWITCH;
  }

  @Override
  public int getNumberOfOperands() {
    return 1;
  }

  @Override
  public Expression getOperand(int index) {
    return index == 0 ? condition : super.getOperand(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    if (index != 0) {
      super.setOperand(index, operand);
      return;
    }
    condition = Objects.requireNonNull(operand);
  }

  @Override
  public boolean isSwitch() {
    return true;
  }

  @Override
  public Switch asSwitch() {
    return this;
  }

  @Override
  public String toString() {
    return "br_table " + targets + " $" + defaultTarget;
  }
}
