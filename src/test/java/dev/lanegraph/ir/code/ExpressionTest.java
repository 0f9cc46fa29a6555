// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import static dev.lanegraph.ir.code.ExpressionBuilder.makeBinary;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeBlock;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeBreak;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeBreakIf;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeDrop;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeI32;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeIf;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLocalGet;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLocalSet;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLocalTee;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeReturn;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class ExpressionTest {

  @Test
  public void testForEachNestedVisitsParentsFirstInEvaluationOrder() {
    LocalGet condition = makeLocalGet(0);
    LocalGet left = makeLocalGet(1);
    Const right = makeI32(2);
    Binary add = makeBinary(BinaryOp.ADD, left, right);
    LocalSet set = makeLocalSet(1, add);
    Return ret = makeReturn();
    If theIf = makeIf(condition, set, ret);

    List<Expression> visited = new ArrayList<>();
    theIf.forEachNested(visited::add);

    assertEquals(
        ImmutableList.of(theIf, condition, set, add, left, right, ret), visited);
  }

  @Test
  public void testSetOperand() {
    LocalGet get = makeLocalGet(0);
    Drop drop = makeDrop(get);
    Const replacement = makeI32(7);
    drop.setOperand(0, replacement);
    assertSame(replacement, drop.getValue());
    assertThrows(IndexOutOfBoundsException.class, () -> drop.setOperand(1, get));

    If theIf = makeIf(get, makeI32(1));
    assertEquals(2, theIf.getNumberOfOperands());
    assertThrows(IndexOutOfBoundsException.class, () -> theIf.getOperand(2));
  }

  @Test
  public void testBreakOperands() {
    Break unconditional = makeBreak("L");
    assertFalse(unconditional.isConditional());
    assertEquals(0, unconditional.getNumberOfOperands());
    Break conditional = makeBreakIf("L", makeLocalGet(0));
    assertTrue(conditional.isConditional());
    assertEquals(1, conditional.getNumberOfOperands());
  }

  @Test
  public void testCastsAndKinds() {
    Expression tee = makeLocalTee(0, makeI32(1));
    assertTrue(tee.isLocalSet());
    assertTrue(tee.asLocalSet().isTee());
    assertFalse(tee.isLocalGet());
    assertNull(tee.asLocalGet());
    assertEquals(ExpressionKind.LOCAL_SET, tee.getKind());
    assertTrue(makeReturn().getKind().isUnconditionalTransfer());
    assertFalse(makeBreak("L").getKind().isUnconditionalTransfer());
  }

  @Test
  public void testFunctionLocals() {
    Function function =
        Function.builder("f")
            .addParams(ValueType.I32, ValueType.F32)
            .addVars(ValueType.I64)
            .setBody(makeBlock())
            .build();
    assertEquals(3, function.getNumberOfLocals());
    assertTrue(function.isParam(1));
    assertTrue(function.isVar(2));
    assertEquals(ValueType.F32, function.getLocalType(1));
    assertEquals(ValueType.I64, function.getLocalType(2));
  }

  @Test
  public void testFunctionWithoutBodyHasNop() {
    Function function = Function.builder("empty").build();
    assertTrue(function.getBody() instanceof Nop);
    assertEquals(0, function.getNumberOfLocals());
  }
}
