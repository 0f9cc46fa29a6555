// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** Factory methods for function body trees. */
public class ExpressionBuilder {

  private ExpressionBuilder() {}

  public static Block makeBlock(Expression... children) {
    return new Block(null, Arrays.asList(children));
  }

  public static Block makeBlock(String label, Expression... children) {
    return new Block(label, Arrays.asList(children));
  }

  public static Block makeBlock(String label, List<Expression> children) {
    return new Block(label, children);
  }

  public static If makeIf(Expression condition, Expression ifTrue) {
    return new If(condition, ifTrue, null);
  }

  public static If makeIf(Expression condition, Expression ifTrue, Expression ifFalse) {
    return new If(condition, ifTrue, ifFalse);
  }

  public static Loop makeLoop(String label, Expression body) {
    return new Loop(label, body);
  }

  public static Break makeBreak(String label) {
    return new Break(label, null);
  }

  public static Break makeBreakIf(String label, Expression condition) {
    return new Break(label, condition);
  }

  public static Switch makeSwitch(
      List<String> targets, String defaultTarget, Expression condition) {
    return new Switch(targets, defaultTarget, condition);
  }

  public static Return makeReturn() {
    return new Return(null);
  }

  public static Return makeReturn(Expression value) {
    return new Return(value);
  }

  public static Trap makeTrap() {
    return new Trap();
  }

  public static Nop makeNop() {
    return new Nop();
  }

  public static Const makeConst(ValueType type, long value) {
    return new Const(type, value);
  }

  public static Const makeI32(int value) {
    return new Const(ValueType.I32, value);
  }

  public static Binary makeBinary(BinaryOp op, Expression left, Expression right) {
    return new Binary(op, left, right);
  }

  public static Drop makeDrop(Expression value) {
    return new Drop(value);
  }

  public static Call makeCall(String target, Expression... operands) {
    return new Call(target, ImmutableList.copyOf(operands));
  }

  public static LocalGet makeLocalGet(int index) {
    return new LocalGet(index);
  }

  public static LocalSet makeLocalSet(int index, Expression value) {
    return new LocalSet(index, value, false);
  }

  public static LocalSet makeLocalTee(int index, Expression value) {
    return new LocalSet(index, value, true);
  }

  public static GlobalGet makeGlobalGet(int index) {
    return new GlobalGet(index);
  }

  public static GlobalSet makeGlobalSet(int index, Expression value) {
    return new GlobalSet(index, value);
  }
}
