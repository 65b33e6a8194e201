// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import java.util.Comparator;
import java.util.Objects;

/** A member name qualified by the type that declares it. */
public final class MemberReference implements Comparable<MemberReference> {

  private static final Comparator<MemberReference> COMPARATOR =
      Comparator.comparing(MemberReference::getTypeName)
          .thenComparing(MemberReference::getMemberName);

  private final String typeName;
  private final String memberName;

  public MemberReference(String typeName, String memberName) {
    this.typeName = Objects.requireNonNull(typeName);
    this.memberName = Objects.requireNonNull(memberName);
  }

  public String getTypeName() {
    return typeName;
  }

  public String getMemberName() {
    return memberName;
  }

  @Override
  public int compareTo(MemberReference other) {
    return COMPARATOR.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MemberReference)) {
      return false;
    }
    MemberReference other = (MemberReference) o;
    return typeName.equals(other.typeName) && memberName.equals(other.memberName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, memberName);
  }

  @Override
  public String toString() {
    return typeName + "." + memberName;
  }
}
