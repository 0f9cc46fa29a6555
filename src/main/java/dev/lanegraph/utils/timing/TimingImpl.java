// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils.timing;

import dev.lanegraph.utils.SystemPropertyUtils;
import dev.lanegraph.utils.ThrowingAction;
import dev.lanegraph.utils.ThrowingSupplier;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records the wall-clock time of nested phases and prints them as an indented tree. A phase that
 * is begun again under the same parent accumulates into the existing node.
 */
public class TimingImpl extends Timing {

  // Phases shorter than this are left out of the report.
  private static final int MINIMUM_REPORT_MS =
      SystemPropertyUtils.parseSystemPropertyOrDefault("dev.lanegraph.printtimes.minvalue_ms", 0);

  private final Phase top;
  private final Deque<Phase> stack = new ArrayDeque<>();
  private final PrintStream output;

  TimingImpl(String title, PrintStream output) {
    this.output = output;
    top = new Phase(title);
    stack.push(top);
  }

  private static class Phase {

    private final String title;
    private final Map<String, Phase> children = new LinkedHashMap<>();
    private long duration = 0;
    private long startTime;
    private int runs = 1;

    Phase(String title) {
      this.title = title;
      this.startTime = System.nanoTime();
    }

    void restart() {
      assert startTime == -1;
      startTime = System.nanoTime();
      runs++;
    }

    void end() {
      duration += System.nanoTime() - startTime;
      startTime = -1;
      assert duration >= 0;
    }

    String describe(Phase top) {
      StringBuilder builder = new StringBuilder();
      if (this != top) {
        builder.append('(').append(percentage(duration, top.duration)).append("%) ");
      }
      builder.append(title).append(": ").append(durationInMs(duration)).append("ms");
      if (runs > 1) {
        builder.append(" [").append(runs).append(" runs]");
      }
      return builder.toString();
    }
  }

  private void report(Phase phase, int depth) {
    if (durationInMs(phase.duration) < MINIMUM_REPORT_MS) {
      return;
    }
    if (depth > 0) {
      output.print("  ".repeat(depth));
      output.print("- ");
    }
    output.println(phase.describe(top));
    for (Phase child : phase.children.values()) {
      report(child, depth + 1);
    }
  }

  private static long durationInMs(long nanos) {
    return nanos / 1_000_000;
  }

  private static long percentage(long part, long total) {
    return total == 0 ? 100 : part * 100 / total;
  }

  @Override
  public Timing begin(String title) {
    Phase parent = stack.peek();
    Phase child;
    if (parent.children.containsKey(title)) {
      child = parent.children.get(title);
      child.restart();
    } else {
      child = new Phase(title);
      parent.children.put(title, child);
    }
    stack.push(child);
    return this;
  }

  @Override
  public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
    begin(title);
    try {
      action.execute();
    } finally {
      end();
    }
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    begin(title);
    try {
      return supplier.get();
    } finally {
      end();
    }
  }

  @Override
  public Timing end() {
    stack.peek().end();
    stack.pop();
    return this;
  }

  @Override
  public void report() {
    assert stack.isEmpty() : "Expected all timing nodes to have ended before report";
    report(top, 0);
  }

  // Visible for testing.
  Collection<String> getChildTitles() {
    return top.children.keySet();
  }
}
