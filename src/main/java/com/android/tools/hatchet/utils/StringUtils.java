// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

public class StringUtils {

  /** Lines separated by '\n', including a trailing line terminator. */
  public static String lines(String... lines) {
    return lines(Arrays.asList(lines));
  }

  public static String lines(Collection<String> lines) {
    StringBuilder builder = new StringBuilder();
    for (String line : lines) {
      builder.append(line).append('\n');
    }
    return builder.toString();
  }

  /** Splits on '\n', '\r\n' and '\r'. */
  public static List<String> splitLines(String string) {
    return Arrays.asList(string.split("\\r\\n|\\r|\\n", -1));
  }

  public static boolean isAlphanumeric(String string) {
    if (string.isEmpty()) {
      return false;
    }
    for (int i = 0; i < string.length(); i++) {
      if (!Character.isLetterOrDigit(string.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  public static String toLowerCase(String string) {
    return string.toLowerCase(Locale.ROOT);
  }

  public static String stripSuffix(String string, String suffix) {
    assert string.endsWith(suffix);
    return string.substring(0, string.length() - suffix.length());
  }
}
