// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.origin;

import java.util.ArrayList;
import java.util.List;

/**
 * Origin description of a resource.
 *
 * <p>An origin is a list of parts that describe where a resource originates from. The first part is
 * the most outer part and the last part is the most inner part. For example, a class file in an
 * archive has the archive path as its parent and the entry name as its own part.
 */
public abstract class Origin implements Comparable<Origin> {

  private static final Origin UNKNOWN =
      new Origin(null) {
        @Override
        public String part() {
          return "<unknown>";
        }
      };

  public static Origin unknown() {
    return UNKNOWN;
  }

  private final Origin parent;

  protected Origin(Origin parent) {
    this.parent = parent;
  }

  public abstract String part();

  public Origin parent() {
    return parent;
  }

  public List<String> parts() {
    List<String> parts = new ArrayList<>();
    buildParts(parts);
    return parts;
  }

  private void buildParts(List<String> parts) {
    if (parent != null) {
      parent.buildParts(parts);
    }
    parts.add(part());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Origin other = (Origin) obj;
    return part().equals(other.part())
        && (parent == null ? other.parent == null : parent.equals(other.parent));
  }

  @Override
  public int hashCode() {
    return 31 * (parent == null ? 0 : parent.hashCode()) + part().hashCode();
  }

  @Override
  public int compareTo(Origin other) {
    return toString().compareTo(other.toString());
  }

  @Override
  public String toString() {
    return String.join(":", parts());
  }
}
