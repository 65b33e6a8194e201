// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.Origin;

/** Reads code units of one host code representation. */
public interface CodeUnitReader {

  /** Returns true if files or archive entries with the given name are read by this reader. */
  boolean accepts(String fileName);

  CodeUnit read(Origin origin, byte[] bytes) throws MalformedCodeUnitException;
}
