// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import com.android.tools.hatchet.Diagnostic;
import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.HatchetFailedException;

/**
 * Forwards diagnostics to a client {@link DiagnosticsHandler} while keeping track of reported
 * errors, so that the analysis can be aborted once an error has been reported.
 */
public class Reporter implements DiagnosticsHandler {

  private final DiagnosticsHandler clientHandler;
  private int errorCount = 0;
  private Diagnostic lastError;

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  @Override
  public synchronized void info(Diagnostic info) {
    clientHandler.info(info);
  }

  @Override
  public synchronized void warning(Diagnostic warning) {
    clientHandler.warning(warning);
  }

  @Override
  public synchronized void error(Diagnostic error) {
    clientHandler.error(error);
    lastError = error;
    errorCount++;
  }

  public synchronized boolean hasErrors() {
    return errorCount > 0;
  }

  /** @throws HatchetFailedException if any error was reported. */
  public synchronized void failIfPendingErrors() throws HatchetFailedException {
    if (errorCount > 0) {
      throw new HatchetFailedException(
          errorCount == 1
              ? lastError.getDiagnosticMessage()
              : errorCount + " errors reported, last: " + lastError.getDiagnosticMessage());
    }
  }
}
