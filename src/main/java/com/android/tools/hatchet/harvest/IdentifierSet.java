// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;

/**
 * The names harvested from the application's code. The set is an over-approximation of the names
 * the application may use to reach binding types and members.
 */
public class IdentifierSet {

  private static final IdentifierSet EMPTY = new IdentifierSet(ImmutableSet.of());

  private final ImmutableSet<String> identifiers;

  private IdentifierSet(ImmutableSet<String> identifiers) {
    this.identifiers = identifiers;
  }

  public static IdentifierSet empty() {
    return EMPTY;
  }

  public static IdentifierSet of(String... identifiers) {
    return new IdentifierSet(ImmutableSet.copyOf(identifiers));
  }

  public static IdentifierSet of(Collection<String> identifiers) {
    return new IdentifierSet(ImmutableSet.copyOf(identifiers));
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean contains(String identifier) {
    return identifiers.contains(identifier);
  }

  public int size() {
    return identifiers.size();
  }

  public boolean isEmpty() {
    return identifiers.isEmpty();
  }

  public ImmutableSortedSet<String> toSortedSet() {
    return ImmutableSortedSet.copyOf(identifiers);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof IdentifierSet)) {
      return false;
    }
    return identifiers.equals(((IdentifierSet) obj).identifiers);
  }

  @Override
  public int hashCode() {
    return identifiers.hashCode();
  }

  @Override
  public String toString() {
    return toSortedSet().toString();
  }

  public static class Builder {

    private final ImmutableSet.Builder<String> identifiers = ImmutableSet.builder();

    private Builder() {}

    public Builder add(String identifier) {
      identifiers.add(identifier);
      return this;
    }

    public Builder addAll(Iterable<String> identifiers) {
      this.identifiers.addAll(identifiers);
      return this;
    }

    public IdentifierSet build() {
      return new IdentifierSet(identifiers.build());
    }
  }
}
