// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.diagnostic;

import com.android.tools.hatchet.Diagnostic;
import com.android.tools.hatchet.origin.Origin;

/** Reported when a type name found in the catalog does not resolve to any catalog type. */
public class UnresolvedTypeNameDiagnostic implements Diagnostic {

  private final String typeName;
  private final String context;

  public UnresolvedTypeNameDiagnostic(String typeName, String context) {
    this.typeName = typeName;
    this.context = context;
  }

  public String getTypeName() {
    return typeName;
  }

  @Override
  public Origin getOrigin() {
    return Origin.unknown();
  }

  @Override
  public String getDiagnosticMessage() {
    return "Ignoring unresolved type name '" + typeName + "' (" + context + ")";
  }
}
