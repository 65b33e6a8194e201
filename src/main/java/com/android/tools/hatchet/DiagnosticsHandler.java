// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.position.Position;
import java.io.PrintStream;

/**
 * A DiagnosticsHandler can be provided to customize handling of diagnostics information.
 *
 * <p>During the analysis, warnings are reported for code units that cannot be read, infos are
 * reported for audit information such as dropped type names, and errors are reported for failures
 * that prevent producing rejections.
 */
public interface DiagnosticsHandler {

  /**
   * Handle error diagnostics.
   *
   * @param error Diagnostic containing error information.
   */
  default void error(Diagnostic error) {
    print(System.err, "Error", error);
  }

  /**
   * Handle warning diagnostics.
   *
   * @param warning Diagnostic containing warning information.
   */
  default void warning(Diagnostic warning) {
    print(System.err, "Warning", warning);
  }

  /**
   * Handle info diagnostics.
   *
   * @param info Diagnostic containing the information.
   */
  default void info(Diagnostic info) {
    print(System.out, "Info", info);
  }

  private static void print(PrintStream stream, String kind, Diagnostic diagnostic) {
    if (diagnostic.getOrigin() != Origin.unknown()) {
      stream.print(kind + " in " + diagnostic.getOrigin());
      if (diagnostic.getPosition() != Position.UNKNOWN) {
        stream.print(" at " + diagnostic.getPosition().getDescription());
      }
      stream.println(":");
    } else {
      stream.print(kind + ": ");
    }
    stream.println(diagnostic.getDiagnosticMessage());
  }
}
