// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils;

import dev.lanegraph.ir.analysis.usedef.PrintingUseDefTracer;
import dev.lanegraph.ir.analysis.usedef.UseDefTracer;
import dev.lanegraph.ir.code.Expression;
import dev.lanegraph.utils.timing.Timing;
import java.io.PrintStream;

/**
 * Options that control diagnostics and self-checking of the analyses.
 *
 * <p>The defaults are read from system properties, so that tracing can be enabled on an existing
 * build, for example with {@code -Ddev.lanegraph.usedef.trace=true}.
 */
public class AnalysisOptions {

  public static final String PRINT_TIMES_PROPERTY = "dev.lanegraph.printtimes";
  public static final String TRACE_USE_DEF_PROPERTY = "dev.lanegraph.usedef.trace";

  public boolean printTimes =
      SystemPropertyUtils.parseSystemPropertyOrDefault(PRINT_TIMES_PROPERTY, false);

  public boolean traceUseDef =
      SystemPropertyUtils.parseSystemPropertyOrDefault(TRACE_USE_DEF_PROPERTY, false);

  // Checks that every recorded use has at least one reaching definition after the flow.
  public boolean verifyUseDefCoverage = areAssertionsEnabled();

  private PrintStream output = System.out;

  public static AnalysisOptions defaults() {
    return new AnalysisOptions();
  }

  public PrintStream getOutput() {
    return output;
  }

  public AnalysisOptions setOutput(PrintStream output) {
    this.output = output;
    return this;
  }

  public Timing createTiming(String title) {
    return Timing.create(title, this);
  }

  public <U extends Expression, D extends Expression> UseDefTracer<U, D> createUseDefTracer() {
    if (traceUseDef) {
      return new PrintingUseDefTracer<>(output);
    }
    return UseDefTracer.empty();
  }

  @SuppressWarnings("AssertWithSideEffects")
  private static boolean areAssertionsEnabled() {
    boolean enabled = false;
    assert enabled = true;
    return enabled;
  }
}
