// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.diagnostic;

import com.android.tools.hatchet.Diagnostic;
import com.android.tools.hatchet.origin.Origin;

/** Reported when a code unit of the application is skipped because it could not be read. */
public class UnreadableCodeUnitDiagnostic implements Diagnostic {

  private final Origin origin;
  private final String reason;

  public UnreadableCodeUnitDiagnostic(Origin origin, String reason) {
    this.origin = origin;
    this.reason = reason;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Skipping unreadable code unit: " + reason;
  }
}
