// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.ir.code.Function;

/**
 * The position of an expression in a function body: an operand slot of its parent, or the body
 * slot of the function. Lets code that consumes an analysis replace the expression in place.
 */
public class ExpressionLocation {

  private final Function function;
  // Null if the expression is the function body.
  private final Expression parent;
  private final int operandIndex;

  private ExpressionLocation(Function function, Expression parent, int operandIndex) {
    this.function = function;
    this.parent = parent;
    this.operandIndex = operandIndex;
  }

  public static ExpressionLocation body(Function function) {
    return new ExpressionLocation(function, null, -1);
  }

  public static ExpressionLocation operand(Function function, Expression parent, int index) {
    assert index >= 0 && index < parent.getNumberOfOperands();
    return new ExpressionLocation(function, parent, index);
  }

  public boolean isBody() {
    return parent == null;
  }

  public Expression getParent() {
    return parent;
  }

  public int getOperandIndex() {
    return operandIndex;
  }

  /** Returns the expression currently stored at this location. */
  public Expression get() {
    return isBody() ? function.getBody() : parent.getOperand(operandIndex);
  }

  public void replace(Expression replacement) {
    if (isBody()) {
      function.setBody(replacement);
    } else {
      parent.setOperand(operandIndex, replacement);
    }
  }

  @Override
  public String toString() {
    return isBody() ? function + " body" : parent + " operand " + operandIndex;
  }
}
