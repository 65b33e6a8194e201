// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.Diagnostic;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.position.Position;

public class KeepPolicyParseException extends Exception implements Diagnostic {

  private final String snippet;
  private final Origin origin;
  private final Position position;

  public KeepPolicyParseException(
      String message, String snippet, Origin origin, Position position) {
    super(message);
    this.snippet = snippet;
    this.origin = origin;
    this.position = position;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public Position getPosition() {
    return position;
  }

  public String getSnippet() {
    return snippet;
  }

  @Override
  public String getDiagnosticMessage() {
    return getMessage() + " at \"" + snippet + "\"";
  }
}
