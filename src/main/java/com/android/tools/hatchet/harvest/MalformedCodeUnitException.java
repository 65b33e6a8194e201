// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.Origin;

/** Thrown by a {@link CodeUnitReader} when the content of a code unit cannot be understood. */
public class MalformedCodeUnitException extends Exception {

  private final Origin origin;

  public MalformedCodeUnitException(Origin origin, String message) {
    super(message);
    this.origin = origin;
  }

  public MalformedCodeUnitException(Origin origin, String message, Throwable cause) {
    super(message, cause);
    this.origin = origin;
  }

  public Origin getOrigin() {
    return origin;
  }
}
