// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

/** Exception thrown when the rejection analysis could not complete. */
public class HatchetFailedException extends Exception {

  public HatchetFailedException(String message) {
    super(message);
  }

  public HatchetFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
