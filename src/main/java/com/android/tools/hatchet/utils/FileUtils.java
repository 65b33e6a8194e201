// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import java.nio.file.Path;

public class FileUtils {

  public static final String CLASS_EXTENSION = ".class";
  public static final String JAR_EXTENSION = ".jar";
  public static final String ZIP_EXTENSION = ".zip";

  public static boolean isClassFile(String name) {
    name = StringUtils.toLowerCase(name);
    // Skip module and package descriptors, they do not contain code.
    return name.endsWith(CLASS_EXTENSION)
        && !name.endsWith("module-info.class")
        && !name.endsWith("package-info.class");
  }

  public static boolean isArchive(Path path) {
    return isArchive(path.getFileName().toString());
  }

  public static boolean isArchive(String name) {
    name = StringUtils.toLowerCase(name);
    return name.endsWith(JAR_EXTENSION) || name.endsWith(ZIP_EXTENSION);
  }
}
