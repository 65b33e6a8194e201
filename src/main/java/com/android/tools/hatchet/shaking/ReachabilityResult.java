// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.harvest.IdentifierSet;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** The fixpoint computed by the {@link Enqueuer}. */
public class ReachabilityResult {

  private final ImmutableSet<String> usefulTypes;
  private final ImmutableMap<String, ImmutableSet<String>> keptMembers;
  private final IdentifierSet identifiers;
  private final KeepPolicy policy;

  ReachabilityResult(
      ImmutableSet<String> usefulTypes,
      ImmutableMap<String, ImmutableSet<String>> keptMembers,
      IdentifierSet identifiers,
      KeepPolicy policy) {
    this.usefulTypes = usefulTypes;
    this.keptMembers = keptMembers;
    this.identifiers = identifiers;
    this.policy = policy;
  }

  /** The useful types in the order they were found. */
  public Set<String> getUsefulTypes() {
    return usefulTypes;
  }

  public boolean isUseful(String type) {
    return usefulTypes.contains(type);
  }

  /** The kept members of a useful type. Empty for types that are not useful. */
  public Set<String> getKeptMembers(String type) {
    return keptMembers.getOrDefault(type, ImmutableSet.of());
  }

  public boolean isKeptMember(String type, String member) {
    return identifiers.contains(member) || getKeptMembers(type).contains(member);
  }

  public TypeDisposition getDisposition(String type) {
    if (policy.isAlwaysKeepType(type)) {
      return TypeDisposition.ALWAYS_KEEP;
    }
    return isUseful(type) ? TypeDisposition.USEFUL : TypeDisposition.REJECTED;
  }

  public KeepPolicy getPolicy() {
    return policy;
  }
}
