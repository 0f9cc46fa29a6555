// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.errors;

/**
 * Exception thrown when an internal invariant of an analysis is violated.
 *
 * <p>This signals a bug in the code that constructed the analyzed input (or in the analysis
 * itself), not a data condition that callers are expected to recover from.
 */
public class InternalCompilerError extends IllegalStateException {

  public InternalCompilerError() {}

  public InternalCompilerError(String message) {
    super(message);
  }

  public InternalCompilerError(String message, Throwable cause) {
    super(message, cause);
  }

  public InternalCompilerError(Throwable cause) {
    super(cause);
  }
}
