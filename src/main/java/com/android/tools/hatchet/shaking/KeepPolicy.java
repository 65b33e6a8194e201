// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.catalog.TypeCatalog;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.Set;

/**
 * Static rules that force the retention of types and members the identifier scan cannot see, e.g.,
 * because they are only used from native code or reached through names created at runtime.
 *
 * <p>Besides the explicit tables, a member is always kept if its name equals the name of its type
 * (a constructor) or if it is pure virtual on the type or one of its ancestors, since dropping it
 * would leave subclasses abstract.
 */
public class KeepPolicy {

  /** Matches any type as owner, or any member of a type. */
  public static final String WILDCARD = "*";

  private static final KeepPolicy EMPTY = builder().build();

  private static final KeepPolicy DEFAULT =
      builder()
          .addAlwaysKeepType("QApplication")
          .addAlwaysKeepType("QWidget")
          .addAlwaysKeepType("QFlag")
          .addAlwaysKeepType("QFlags")
          .addAlwaysKeepType("QBuffer")
          .addAlwaysKeepMember(WILDCARD, "metaObject")
          .addAlwaysKeepMember(WILDCARD, "devType")
          .addAlwaysKeepMember(WILDCARD, "metric")
          .addAlwaysKeepMember("QBitArray", "setBit")
          .addAlwaysKeepMember("QByteArray", "insert")
          .addAlwaysKeepMember("QPixmap", WILDCARD)
          .addAlwaysKeepMember("QImage", WILDCARD)
          .addAlwaysKeepMember("QPicture", WILDCARD)
          .addAlwaysKeepMember("QX11Info", WILDCARD)
          .build();

  private final ImmutableSet<String> alwaysKeepTypes;
  private final ImmutableSetMultimap<String, String> alwaysKeepMembers;

  private KeepPolicy(
      ImmutableSet<String> alwaysKeepTypes,
      ImmutableSetMultimap<String, String> alwaysKeepMembers) {
    this.alwaysKeepTypes = alwaysKeepTypes;
    this.alwaysKeepMembers = alwaysKeepMembers;
  }

  public static KeepPolicy empty() {
    return EMPTY;
  }

  /** The rules needed by the toolkit's own runtime. */
  public static KeepPolicy defaultPolicy() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> getAlwaysKeepTypes() {
    return alwaysKeepTypes;
  }

  public boolean isAlwaysKeepType(String type) {
    return alwaysKeepTypes.contains(type);
  }

  /** Returns true if every member of the type is kept. */
  public boolean hasWildcardMembers(String type) {
    return alwaysKeepMembers.containsEntry(type, WILDCARD);
  }

  /** Returns true if a keep table names the member, either on the type or on any type. */
  public boolean isAlwaysKeepMember(String type, String member) {
    return alwaysKeepMembers.containsEntry(WILDCARD, member)
        || alwaysKeepMembers.containsEntry(type, member)
        || hasWildcardMembers(type);
  }

  /**
   * Returns true if the member must be kept regardless of whether the application uses it.
   *
   * @param catalog used to find pure virtual declarations on the ancestors of the type.
   */
  public boolean isForcedMember(String type, String member, TypeCatalog catalog) {
    if (isAlwaysKeepMember(type, member) || member.equals(type)) {
      return true;
    }
    for (String ancestor : catalog.ancestors(type)) {
      if (catalog.isPureVirtual(ancestor, member)) {
        return true;
      }
    }
    return false;
  }

  /** The members declared on the type that must be kept regardless of application usage. */
  public Set<String> forcedMembers(String type, TypeCatalog catalog) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String member : catalog.members(type)) {
      if (isForcedMember(type, member, catalog)) {
        builder.add(member);
      }
    }
    return builder.build();
  }

  public boolean isEmpty() {
    return alwaysKeepTypes.isEmpty() && alwaysKeepMembers.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    alwaysKeepTypes.forEach(type -> builder.append("-keeptype ").append(type).append('\n'));
    alwaysKeepMembers.forEach(
        (type, member) ->
            builder.append("-keepmember ").append(type).append(' ').append(member).append('\n'));
    return builder.toString();
  }

  public static class Builder {

    private final ImmutableSet.Builder<String> alwaysKeepTypes = ImmutableSet.builder();
    private final ImmutableSetMultimap.Builder<String, String> alwaysKeepMembers =
        ImmutableSetMultimap.builder();

    private Builder() {}

    public Builder addAlwaysKeepType(String type) {
      alwaysKeepTypes.add(type);
      return this;
    }

    /**
     * @param type owning type, or {@link #WILDCARD} for members of any type.
     * @param member member name, or {@link #WILDCARD} for all members of the type.
     */
    public Builder addAlwaysKeepMember(String type, String member) {
      alwaysKeepMembers.put(type, member);
      return this;
    }

    public Builder addAll(KeepPolicy policy) {
      alwaysKeepTypes.addAll(policy.alwaysKeepTypes);
      alwaysKeepMembers.putAll(policy.alwaysKeepMembers);
      return this;
    }

    public KeepPolicy build() {
      return new KeepPolicy(alwaysKeepTypes.build(), alwaysKeepMembers.build());
    }
  }
}
