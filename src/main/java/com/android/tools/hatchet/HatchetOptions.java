// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.utils.Reporter;

/** Internal options of one analysis run. */
public class HatchetOptions {

  public static final String TRACE_USEFUL_TYPES_PROPERTY =
      "com.android.tools.hatchet.traceUsefulTypes";

  public final Reporter reporter;

  // Report every type marked useful, and why, as an info diagnostic.
  public boolean traceUsefulTypes = System.getProperty(TRACE_USEFUL_TYPES_PROPERTY) != null;

  public HatchetOptions() {
    this(new Reporter());
  }

  public HatchetOptions(Reporter reporter) {
    this.reporter = reporter;
  }
}
