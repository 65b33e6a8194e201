// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.origin.Origin;
import java.io.IOException;

/** Provides the pages of a toolkit's reference documentation by their relative names. */
public interface DocumentationSource {

  /**
   * Reads a page.
   *
   * @param name relative name of the page, e.g., {@code qwidget-members.html}.
   * @return the content of the page, or null if the documentation has no such page.
   * @throws IOException if the page exists but cannot be read.
   */
  String readPage(String name) throws IOException;

  Origin getOrigin(String name);
}
