// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

public class IdentifierUtils {

  public static boolean isIdentifierStart(int cp) {
    return cp == '_' || Character.isLetter(cp);
  }

  public static boolean isIdentifierPart(int cp) {
    return cp == '_' || Character.isLetterOrDigit(cp);
  }

  /**
   * Returns true if the string is lexically a name, i.e., a letter or underscore followed by
   * letters, digits or underscores.
   */
  public static boolean isIdentifier(String string) {
    if (string == null || string.isEmpty()) {
      return false;
    }
    int cp = string.codePointAt(0);
    if (!isIdentifierStart(cp)) {
      return false;
    }
    for (int i = Character.charCount(cp); i < string.length(); i += Character.charCount(cp)) {
      cp = string.codePointAt(i);
      if (!isIdentifierPart(cp)) {
        return false;
      }
    }
    return true;
  }
}
