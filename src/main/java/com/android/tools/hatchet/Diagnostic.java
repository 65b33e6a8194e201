// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.position.Position;

/** Interface for all diagnostic messages reported while computing rejections. */
public interface Diagnostic {

  /** Origin of the resource that caused the diagnostic, or {@link Origin#unknown()}. */
  Origin getOrigin();

  /** Position within the origin, or {@link Position#UNKNOWN}. */
  default Position getPosition() {
    return Position.UNKNOWN;
  }

  /** User friendly description of the problem. */
  String getDiagnosticMessage();
}
