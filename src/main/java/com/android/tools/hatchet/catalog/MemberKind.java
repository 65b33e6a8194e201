// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

/** Whether a binding member is a field or a callable. */
public enum MemberKind {
  FIELD,
  FUNCTION,
  /** The catalog cannot tell; consumers must treat the member as possibly either. */
  UNKNOWN;

  public static MemberKind merge(MemberKind kind, MemberKind other) {
    if (kind == other || other == UNKNOWN) {
      return kind;
    }
    if (kind == UNKNOWN) {
      return other;
    }
    return UNKNOWN;
  }
}
