// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.HatchetOptions;
import com.android.tools.hatchet.catalog.TypeCatalog;
import com.android.tools.hatchet.harvest.IdentifierSet;
import com.android.tools.hatchet.utils.StringDiagnostic;
import com.android.tools.hatchet.utils.WorkList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Computes the types of the binding layer that are useful to the application, and the members
 * that must be kept on them.
 *
 * <p>The roots are the catalog types whose names are harvested from the application and the types
 * kept by the policy. A useful type makes its ancestors useful. The kept members of a useful type
 * are the members the application names and the members forced by the policy, and every type
 * related to a kept member is useful as well. The computation is a worklist fixpoint: the useful
 * set only grows and every type is processed at most once.
 *
 * <p>An instance computes one result and must not be reused.
 */
public class Enqueuer {

  private final TypeCatalog catalog;
  private final KeepPolicy policy;
  private final IdentifierSet identifiers;
  private final HatchetOptions options;
  private final EnqueuerObserver observer;

  // The seen set of the work list is the useful set.
  private final WorkList<String> worklist = WorkList.newEqualityWorkList();
  private final Map<String, ImmutableSet<String>> keptMembers = new LinkedHashMap<>();

  public Enqueuer(
      TypeCatalog catalog, KeepPolicy policy, IdentifierSet identifiers, HatchetOptions options) {
    this(catalog, policy, identifiers, options, EnqueuerObserver.EMPTY);
  }

  public Enqueuer(
      TypeCatalog catalog,
      KeepPolicy policy,
      IdentifierSet identifiers,
      HatchetOptions options,
      EnqueuerObserver observer) {
    this.catalog = catalog;
    this.policy = policy;
    this.identifiers = identifiers;
    this.options = options;
    this.observer = observer;
  }

  public ReachabilityResult traceApplication() {
    for (String type : catalog.allTypes()) {
      if (identifiers.contains(type)) {
        markTypeUseful(type, "referenced by the application");
      }
    }
    for (String type : policy.getAlwaysKeepTypes()) {
      markTypeUseful(type, "kept by policy");
    }
    worklist.process(this::processType);
    return new ReachabilityResult(
        ImmutableSet.copyOf(worklist.getSeenSet()),
        ImmutableMap.copyOf(keptMembers),
        identifiers,
        policy);
  }

  private void markTypeUseful(String type, String reason) {
    for (String ancestor : catalog.ancestors(type)) {
      String ancestorReason = ancestor.equals(type) ? reason : "ancestor of " + type;
      if (worklist.addIfNotSeen(ancestor)) {
        observer.onTypeMarkedUseful(ancestor, ancestorReason);
        if (options.traceUsefulTypes) {
          options.reporter.info(
              new StringDiagnostic("Useful type " + ancestor + ": " + ancestorReason));
        }
      }
    }
  }

  private void processType(String type) {
    Set<String> kept = getKeptMembers(type);
    observer.onTypeProcessed(type, kept);
    for (String member : kept) {
      for (String related : catalog.relatedTypes(type, member)) {
        if (!worklist.isSeen(related)) {
          markTypeUseful(related, "related to " + type + "." + member);
        }
      }
    }
  }

  private Set<String> getKeptMembers(String type) {
    ImmutableSet<String> kept = keptMembers.get(type);
    if (kept == null) {
      Set<String> forced = policy.forcedMembers(type, catalog);
      ImmutableSet.Builder<String> builder = ImmutableSet.builder();
      for (String member : catalog.members(type)) {
        if (identifiers.contains(member) || forced.contains(member)) {
          builder.add(member);
        }
      }
      kept = builder.build();
      keptMembers.put(type, kept);
    }
    return kept;
  }
}
