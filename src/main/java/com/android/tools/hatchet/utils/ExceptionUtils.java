// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import com.android.tools.hatchet.HatchetFailedException;
import com.android.tools.hatchet.catalog.CatalogException;

public class ExceptionUtils {

  /**
   * Runs the action, reporting catalog failures as errors, and fails if any error was reported
   * during the run.
   */
  public static void withHatchetHandler(Reporter reporter, Runnable action)
      throws HatchetFailedException {
    try {
      action.run();
    } catch (CatalogException e) {
      reporter.error(new ExceptionDiagnostic(e, e.getOrigin()));
    }
    reporter.failIfPendingErrors();
  }
}
