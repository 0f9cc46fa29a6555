// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

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
import static dev.lanegraph.ir.code.ExpressionBuilder.makeLoop;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeReturn;
import static dev.lanegraph.ir.code.ExpressionBuilder.makeSwitch;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.lanegraph.ir.code.BinaryOp;
import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.ir.code.Function;
import dev.lanegraph.ir.code.LocalGet;
import dev.lanegraph.ir.code.LocalSet;
import dev.lanegraph.utils.AnalysisOptions;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ReachingDefinitionsTest extends UseDefTestBase {

  private final boolean trace;
  private final ByteArrayOutputStream traceOutput = new ByteArrayOutputStream();

  @Parameters(name = "trace: {0}")
  public static List<Object[]> data() {
    return ImmutableList.of(new Object[] {false}, new Object[] {true});
  }

  public ReachingDefinitionsTest(boolean trace) {
    this.trace = trace;
  }

  @Override
  AnalysisOptions createOptions() {
    AnalysisOptions options = super.createOptions();
    options.traceUseDef = trace;
    options.setOutput(new PrintStream(traceOutput, true));
    return options;
  }

  private String getTraceOutput() {
    return new String(traceOutput.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testStraightLine() {
    LocalSet set1 = makeLocalSet(X, makeI32(1));
    LocalGet get1 = makeLocalGet(X);
    LocalSet set2 = makeLocalSet(X, makeI32(2));
    LocalGet get2 = makeLocalGet(X);
    Function function =
        functionWithVars(1, makeBlock(set1, makeDrop(get1), set2, makeDrop(get2)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get1, set1);
    assertReachedBy(graph, get2, set2);
    assertEquals(ImmutableSet.of(get1, get2), graph.getUses());
  }

  @Test
  public void testGetBeforeAnySetReadsEntryValue() {
    LocalGet param = makeLocalGet(X);
    LocalGet var = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(1, makeBlock(makeDrop(param), makeDrop(var)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedByEntryValueOnly(graph, param);
    assertReachedByEntryValueOnly(graph, var);
    assertTrue(graph.getDefinitions(param).isEmpty());
  }

  @Test
  public void testMergeOfTwoPaths() {
    LocalSet set1 = makeLocalSet(Y, makeI32(1));
    LocalSet set2 = makeLocalSet(Y, makeI32(2));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1, makeBlock(set1, makeIf(makeLocalGet(X), set2), makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, set1, set2);
    // The definitions are listed in a deterministic order.
    assertEquals(ImmutableList.of(set2, set1), ImmutableList.copyOf(graph.getDefinitions(get)));
  }

  @Test
  public void testMergeWithEntryValue() {
    LocalSet set = makeLocalSet(Y, makeI32(1));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(1, makeBlock(makeIf(makeLocalGet(X), set), makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedByEntryValueAnd(graph, get, set);
  }

  @Test
  public void testIfElse() {
    LocalSet ifTrueSet = makeLocalSet(Y, makeI32(1));
    LocalSet ifFalseSet = makeLocalSet(Y, makeI32(2));
    LocalGet ifTrueGet = makeLocalGet(Y);
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                makeIf(makeLocalGet(X), makeBlock(ifTrueSet, makeDrop(ifTrueGet)), ifFalseSet),
                makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, ifTrueGet, ifTrueSet);
    assertReachedBy(graph, get, ifTrueSet, ifFalseSet);
  }

  @Test
  public void testLoopCarriedDefinition() {
    // y = 0; loop L { drop(y); y = y + 1; br_if L (x) }; drop(y)
    LocalSet init = makeLocalSet(Y, makeI32(0));
    LocalGet headerGet = makeLocalGet(Y);
    LocalGet incrementGet = makeLocalGet(Y);
    LocalSet increment =
        makeLocalSet(Y, makeBinary(BinaryOp.ADD, incrementGet, makeI32(1)));
    LocalGet exitGet = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                init,
                makeLoop(
                    "L",
                    makeBlock(
                        makeDrop(headerGet), increment, makeBreakIf("L", makeLocalGet(X)))),
                makeDrop(exitGet)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, headerGet, init, increment);
    assertReachedBy(graph, incrementGet, init, increment);
    assertReachedBy(graph, exitGet, increment);
  }

  @Test
  public void testLoopReadsOnlyDefinitionBeforeLoop() {
    LocalSet init = makeLocalSet(Y, makeI32(5));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                init,
                makeLoop(
                    "L",
                    makeBlock(
                        makeIf(makeLocalGet(X), makeDrop(get)),
                        makeBreakIf("L", makeLocalGet(X))))));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, init);
    assertTrue(graph.isSSA(Y));
  }

  @Test
  public void testLoopWithoutDefinitionReadsEntryValue() {
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeLoop("L", makeBlock(makeDrop(get), makeBreakIf("L", makeLocalGet(X)))));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedByEntryValueOnly(graph, get);
  }

  @Test
  public void testAnalysisIsDeterministic() {
    Supplier<Function> functionFactory =
        () ->
            functionWithParamAndVars(
                2,
                makeBlock(
                    makeLocalSet(Y, makeI32(0)),
                    makeLoop(
                        "L",
                        makeBlock(
                            makeIf(
                                makeLocalGet(X),
                                makeLocalSet(Y, makeI32(1)),
                                makeLocalSet(Z, makeLocalGet(Y))),
                            makeDrop(makeLocalGet(Z)),
                            makeBreakIf("L", makeLocalGet(Y)))),
                    makeDrop(makeLocalGet(Y))));
    Function function = functionFactory.get();
    LocalGraph first = computeLocalGraph(function);
    LocalGraph second = computeLocalGraph(function);

    List<LocalGet> firstUses = ImmutableList.copyOf(first.getUses());
    assertEquals(firstUses, ImmutableList.copyOf(second.getUses()));
    for (LocalGet get : firstUses) {
      assertEquals(
          ImmutableList.copyOf(first.getReachingDefinitions(get)),
          ImmutableList.copyOf(second.getReachingDefinitions(get)));
    }
    assertEquals(first.getUses().size(), computeLocalGraph(functionFactory.get()).getUses().size());
  }

  @Test
  public void testRerunGivesEqualReachingDefinitions() {
    LocalSet set = makeLocalSet(Y, makeI32(1));
    LocalGet get = makeLocalGet(Y);
    LocalGet loopGet = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                set,
                makeDrop(get),
                makeLoop(
                    "L",
                    makeBreakIf(
                        "L",
                        makeLocalTee(Y, makeBinary(BinaryOp.ADD, loopGet, makeI32(1)))))));

    LocalGraph first = computeLocalGraph(function);
    LocalGraph second = computeLocalGraph(function);

    assertEquals(first.getReachingDefinitions(get), second.getReachingDefinitions(get));
    assertEquals(first.getReachingDefinitions(loopGet), second.getReachingDefinitions(loopGet));
    assertEquals(first.getSets(get), second.getSets(get));
    assertEquals(first.getSSALanes(), second.getSSALanes());
    assertEquals(
        first.getReachingDefinitions(get).iterator().next(),
        second.getReachingDefinitions(get).iterator().next());
  }

  @Test
  public void testTeeIsDefinition() {
    LocalGet valueGet = makeLocalGet(Y);
    LocalSet tee = makeLocalTee(Y, makeI32(3));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1, makeBlock(makeDrop(valueGet), makeDrop(tee), makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedByEntryValueOnly(graph, valueGet);
    assertReachedBy(graph, get, tee);
  }

  @Test
  public void testReadInOwnValueSeesPreviousDefinition() {
    LocalSet init = makeLocalSet(Y, makeI32(1));
    LocalGet get = makeLocalGet(Y);
    LocalSet increment = makeLocalSet(Y, makeBinary(BinaryOp.ADD, get, makeI32(1)));
    Function function = functionWithParamAndVars(1, makeBlock(init, increment));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, init);
  }

  @Test
  public void testBreakIfOutOfBlock() {
    LocalSet set1 = makeLocalSet(Y, makeI32(1));
    LocalSet set2 = makeLocalSet(Y, makeI32(2));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                makeBlock("B", set1, makeBreakIf("B", makeLocalGet(X)), set2),
                makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, set1, set2);
  }

  @Test
  public void testUnconditionalBreakSkipsDefinition() {
    LocalSet set1 = makeLocalSet(Y, makeI32(1));
    LocalSet skipped = makeLocalSet(Y, makeI32(2));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1, makeBlock(makeBlock("B", set1, makeBreak("B"), skipped), makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, set1);
    assertNull(graph.getLocation(skipped));
  }

  @Test
  public void testSwitch() {
    // block A { block B { y = 1; switch [A, B] default A (x) }; y = 2 }; drop(y)
    LocalSet set1 = makeLocalSet(Y, makeI32(1));
    LocalSet set2 = makeLocalSet(Y, makeI32(2));
    LocalGet get = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(
            1,
            makeBlock(
                makeBlock(
                    "A",
                    makeBlock(
                        "B", set1, makeSwitch(ImmutableList.of("A", "B"), "A", makeLocalGet(X))),
                    set2),
                makeDrop(get)));

    LocalGraph graph = computeLocalGraph(function);

    assertReachedBy(graph, get, set1, set2);
  }

  @Test
  public void testUnreachableGetHasNoDefinitions() {
    LocalGet unreachable = makeLocalGet(Y);
    Function function =
        functionWithParamAndVars(1, makeBlock(makeReturn(), makeDrop(unreachable)));

    LocalGraph graph = computeLocalGraph(function);

    assertTrue(graph.getReachingDefinitions(unreachable).isEmpty());
    assertFalse(graph.getUses().contains(unreachable));
  }

  @Test
  public void testEveryReachableGetHasDefinitions() {
    List<LocalGet> gets = new ArrayList<>();
    Function function =
        functionWithParamAndVars(
            2,
            makeBlock(
                makeLocalSet(Y, makeI32(0)),
                makeLoop(
                    "L",
                    makeBlock(
                        makeIf(makeLocalGet(X), makeLocalSet(Z, makeLocalGet(Y))),
                        makeLocalSet(Y, makeLocalGet(Z)),
                        makeBreakIf("L", makeLocalGet(Y)))),
                makeReturn(makeLocalGet(Z))));
    function.getBody().forEachNested(
        expression -> {
          if (expression.isLocalGet()) {
            gets.add(expression.asLocalGet());
          }
        });

    LocalGraph graph = computeLocalGraph(function);

    assertEquals(ImmutableSet.copyOf(gets), graph.getUses());
    for (LocalGet get : gets) {
      Set<ReachingDefinition<LocalSet>> definitions = graph.getReachingDefinitions(get);
      assertFalse(definitions.isEmpty());
      for (ReachingDefinition<LocalSet> definition : definitions) {
        if (definition.isDefinitionSite()) {
          assertEquals(get.getIndex(), definition.asDefinitionSite().getLane());
        }
      }
    }
  }

  @Test
  public void testTraceOutput() {
    Expression body = makeBlock(makeLocalSet(Y, makeI32(1)), makeDrop(makeLocalGet(Y)));
    computeLocalGraph(functionWithParamAndVars(1, body));
    String output = getTraceOutput();
    if (trace) {
      assertThat(output, containsString("basic block #0 :"));
      assertThat(output, containsString("use-def dump:"));
      assertThat(output, containsString("total locations: 2"));
    } else {
      assertEquals("", output);
    }
  }
}
