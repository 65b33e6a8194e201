// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import com.android.tools.hatchet.Diagnostic;
import com.android.tools.hatchet.origin.Origin;

public class ExceptionDiagnostic implements Diagnostic {

  private final Throwable cause;
  private final Origin origin;

  public ExceptionDiagnostic(Throwable cause, Origin origin) {
    assert cause != null;
    this.cause = cause;
    this.origin = origin;
  }

  public ExceptionDiagnostic(Throwable cause) {
    this(cause, Origin.unknown());
  }

  public Throwable getCause() {
    return cause;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public String getDiagnosticMessage() {
    String message = cause.getMessage();
    return message != null ? message : cause.toString();
  }
}
