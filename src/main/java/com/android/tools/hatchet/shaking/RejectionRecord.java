// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.catalog.MemberKind;
import java.util.Objects;

/** A type or member of the binding layer that can be left out of the build. */
public abstract class RejectionRecord {

  private final String type;

  RejectionRecord(String type) {
    this.type = type;
  }

  public String getType() {
    return type;
  }

  public boolean isTypeRejection() {
    return false;
  }

  public TypeRejection asTypeRejection() {
    return null;
  }

  public boolean isMemberRejection() {
    return false;
  }

  public MemberRejection asMemberRejection() {
    return null;
  }

  public static class TypeRejection extends RejectionRecord {

    public TypeRejection(String type) {
      super(type);
    }

    @Override
    public boolean isTypeRejection() {
      return true;
    }

    @Override
    public TypeRejection asTypeRejection() {
      return this;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof TypeRejection && getType().equals(((TypeRejection) obj).getType());
    }

    @Override
    public int hashCode() {
      return getType().hashCode();
    }

    @Override
    public String toString() {
      return "TypeRejection(" + getType() + ")";
    }
  }

  public static class MemberRejection extends RejectionRecord {

    private final String member;
    private final MemberKind kind;

    public MemberRejection(String type, String member, MemberKind kind) {
      super(type);
      this.member = member;
      this.kind = kind;
    }

    public String getMember() {
      return member;
    }

    public MemberKind getKind() {
      return kind;
    }

    @Override
    public boolean isMemberRejection() {
      return true;
    }

    @Override
    public MemberRejection asMemberRejection() {
      return this;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof MemberRejection)) {
        return false;
      }
      MemberRejection other = (MemberRejection) obj;
      return getType().equals(other.getType())
          && member.equals(other.member)
          && kind == other.kind;
    }

    @Override
    public int hashCode() {
      return Objects.hash(getType(), member, kind);
    }

    @Override
    public String toString() {
      return "MemberRejection(" + getType() + "." + member + ", " + kind + ")";
    }
  }
}
