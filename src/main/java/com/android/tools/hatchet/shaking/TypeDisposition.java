// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

/** The outcome of the analysis for one catalog type. */
public enum TypeDisposition {
  /** Kept by the keep policy. Its members are still subject to pruning. */
  ALWAYS_KEEP,
  /** Reachable from the application. */
  USEFUL,
  REJECTED;

  public boolean isRejected() {
    return this == REJECTED;
  }
}
