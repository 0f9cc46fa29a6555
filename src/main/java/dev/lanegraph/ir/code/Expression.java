// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * A node of a structured function body.
 *
 * <p>Operands are numbered in evaluation order. Expressions use identity equality: two structurally
 * equal nodes at different program points are different expressions.
 */
public abstract class Expression {

  public abstract ExpressionKind getKind();

  public int getNumberOfOperands() {
    return 0;
  }

  public Expression getOperand(int index) {
    throw new IndexOutOfBoundsException("Operand index " + index + " out of bounds for " + this);
  }

  public void setOperand(int index, Expression operand) {
    throw new IndexOutOfBoundsException("Operand index " + index + " out of bounds for " + this);
  }

  /**
   * Calls {@code consumer} for this expression and every expression nested inside it, parents
   * before children.
   */
  public void forEachNested(Consumer<Expression> consumer) {
    Deque<Expression> worklist = new ArrayDeque<>();
    worklist.push(this);
    while (!worklist.isEmpty()) {
      Expression current = worklist.pop();
      consumer.accept(current);
      // Push in reverse so that operands are reported in evaluation order.
      for (int i = current.getNumberOfOperands() - 1; i >= 0; i--) {
        worklist.push(current.getOperand(i));
      }
    }
  }

  public boolean isBinary() {
    return false;
  }

  public Binary asBinary() {
    return null;
  }

  public boolean isBlock() {
    return false;
  }

  public Block asBlock() {
    return null;
  }

  public boolean isBreak() {
    return false;
  }

  public Break asBreak() {
    return null;
  }

  public boolean isCall() {
    return false;
  }

  public Call asCall() {
    return null;
  }

  public boolean isConst() {
    return false;
  }

  public Const asConst() {
    return null;
  }

  public boolean isGlobalGet() {
    return false;
  }

  public GlobalGet asGlobalGet() {
    return null;
  }

  public boolean isGlobalSet() {
    return false;
  }

  public GlobalSet asGlobalSet() {
    return null;
  }

  public boolean isIf() {
    return false;
  }

  public If asIf() {
    return null;
  }

  public boolean isLocalGet() {
    return false;
  }

  public LocalGet asLocalGet() {
    return null;
  }

  public boolean isLocalSet() {
    return false;
  }

  public LocalSet asLocalSet() {
    return null;
  }

  public boolean isLoop() {
    return false;
  }

  public Loop asLoop() {
    return null;
  }

  public boolean isReturn() {
    return false;
  }

  public Return asReturn() {
    return null;
  }

  public boolean isSwitch() {
    return false;
  }

  public Switch asSwitch() {
    return null;
  }
}
