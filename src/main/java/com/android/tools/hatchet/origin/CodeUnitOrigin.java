// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.origin;

/** Origin of a code unit nested in another code unit, such as a method in a class file. */
public class CodeUnitOrigin extends Origin {

  private final String name;

  public CodeUnitOrigin(String name, Origin parent) {
    super(parent);
    this.name = name;
  }

  @Override
  public String part() {
    return name;
  }
}
