// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.origin;

/** Origin of an entry in an archive. */
public class ArchiveEntryOrigin extends Origin {

  private final String entryName;

  public ArchiveEntryOrigin(String entryName, Origin parent) {
    super(parent);
    this.entryName = entryName;
  }

  @Override
  public String part() {
    return entryName;
  }

  public String getEntryName() {
    return entryName;
  }
}
