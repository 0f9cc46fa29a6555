// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import static dev.lanegraph.ir.code.ExpressionBuilder.makeBlock;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeDrop;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeI32;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeIf;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLocalGet;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLocalSet;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeReturn;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import dev.lanegraph.ir.code.Function;
import dev.lanegraph.ir.code.LocalGet;
import dev.lanegraph.ir.code.ValueType;
import org.junit.Test;

public class LocalGraphEquivalenceTest extends UseDefTestBase {

  @Test
  public void testGetsOfSameSetAreEquivalent() {
    LocalGet a = makeLocalGet(Y);
    LocalGet b = makeLocalGet(Y);
    LocalGet other = makeLocalGet(Z);
    Function function =
        functionWithParamAndVars(
            2,
            makeBlock(
                makeLocalSet(Y, makeLocalGet(X)),
                makeLocalSet(Z, makeLocalGet(X)),
                makeDrop(a),
                makeDrop(b),
                makeDrop(other)));

    LocalGraph graph = computeLocalGraph(function);

    assertTrue(graph.equivalent(a, b));
    assertTrue(graph.equivalent(a, a));
    // Same value, but written by a different set.
    assertFalse(graph.equivalent(a, other));
  }

  @Test
  public void testGetsOfSameParamAreEquivalent() {
    LocalGet a = makeLocalGet(X);
    LocalGet b = makeLocalGet(X);
    Function function = functionWithParamAndVars(0, makeBlock(makeDrop(a), makeDrop(b)));

    assertTrue(computeLocalGraph(function).equivalent(a, b));
  }

  @Test
  public void testGetsOfDifferentParamsAreNotEquivalent() {
    LocalGet a = makeLocalGet(X);
    LocalGet b = makeLocalGet(Y);
    Function function =
        Function.builder("test")
            .addParams(ValueType.I32, ValueType.I32)
            .setBody(makeBlock(makeDrop(a), makeDrop(b)))
            .build();

    assertFalse(computeLocalGraph(function).equivalent(a, b));
  }

  @Test
  public void testParamAndVarAreNotEquivalent() {
    LocalGet param = makeLocalGet(X);
    LocalGet var = makeLocalGet(Y);
    Function function = functionWithParamAndVars(1, makeBlock(makeDrop(param), makeDrop(var)));

    assertFalse(computeLocalGraph(function).equivalent(param, var));
  }

  @Test
  public void testZeroInitializedVarsOfSameTypeAreEquivalent() {
    LocalGet a = makeLocalGet(X);
    LocalGet b = makeLocalGet(Y);
    LocalGet c = makeLocalGet(Z);
    Function function =
        Function.builder("test")
            .addVars(ValueType.I32, ValueType.I32, ValueType.F64)
            .setBody(makeBlock(makeDrop(a), makeDrop(b), makeDrop(c)))
            .build();

    LocalGraph graph = computeLocalGraph(function);

    assertTrue(graph.equivalent(a, b));
    assertFalse(graph.equivalent(a, c));
  }

  @Test
  public void testEntryValueAndSetAreNotEquivalent() {
    LocalGet entry = makeLocalGet(Y);
    LocalGet written = makeLocalGet(Z);
    Function function =
        functionWithParamAndVars(
            2, makeBlock(makeDrop(entry), makeLocalSet(Z, makeI32(0)), makeDrop(written)));

    assertFalse(computeLocalGraph(function).equivalent(entry, written));
  }

  @Test
  public void testGetsWithSeveralDefinitionsAreNotEquivalent() {
    LocalGet a = makeLocalGet(Y);
    LocalGet b = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                makeIf(makeLocalGet(X), makeLocalSet(Y, makeI32(1))),
                makeDrop(a),
                makeDrop(b)));

    LocalGraph graph = computeLocalGraph(function);

    // Both may read the same merged value, but that is not known from the sets alone.
    assertFalse(graph.equivalent(a, b));
  }

  @Test
  public void testUnreachableGetIsNotEquivalent() {
    LocalGet reachable = makeLocalGet(X);
    LocalGet unreachable = makeLocalGet(X);
    Function function =
        functionWithParamAndVars(
            0, makeBlock(makeDrop(reachable), makeReturn(), makeDrop(unreachable)));

    assertFalse(computeLocalGraph(function).equivalent(reachable, unreachable));
  }
}
