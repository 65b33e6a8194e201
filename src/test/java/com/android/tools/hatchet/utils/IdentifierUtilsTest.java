// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class IdentifierUtilsTest {

  @Test
  public void testIdentifiers() {
    assertTrue(IdentifierUtils.isIdentifier("QWidget"));
    assertTrue(IdentifierUtils.isIdentifier("_private"));
    assertTrue(IdentifierUtils.isIdentifier("setText2"));
    assertTrue(IdentifierUtils.isIdentifier("été"));
  }

  @Test
  public void testNonIdentifiers() {
    assertFalse(IdentifierUtils.isIdentifier(null));
    assertFalse(IdentifierUtils.isIdentifier(""));
    assertFalse(IdentifierUtils.isIdentifier("2d"));
    assertFalse(IdentifierUtils.isIdentifier("set-text"));
    assertFalse(IdentifierUtils.isIdentifier("java/lang/Object"));
  }
}
