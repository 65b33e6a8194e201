// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.diagnostic.UnresolvedTypeNameDiagnostic;
import com.android.tools.hatchet.utils.WorkList;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Adapts a {@link TypeCatalogSource} to {@link TypeCatalog}.
 *
 * <p>Every answer is cached for the lifetime of this instance, which should be one analysis run.
 * Ancestor and descendant chains are computed by an iterative traversal over the cached direct
 * edges, so diamonds and cycles in the hierarchy do not cause repeated or unbounded work.
 *
 * <p>Names that do not resolve to a catalog type are dropped and each is reported once as an info
 * diagnostic.
 *
 * <p>Not thread safe.
 */
public class CachingTypeCatalog implements TypeCatalog {

  private final TypeCatalogSource source;
  private final DiagnosticsHandler diagnostics;

  private List<String> allTypes;
  private final Map<String, Boolean> isType = new HashMap<>();
  private final Map<String, List<String>> resolvedNames = new HashMap<>();
  private final Map<String, List<String>> directSupertypes = new HashMap<>();
  private final Map<String, List<String>> directSubtypes = new HashMap<>();
  private final Map<String, List<String>> ancestors = new HashMap<>();
  private final Map<String, List<String>> descendants = new HashMap<>();
  private final Map<String, List<String>> members = new HashMap<>();
  private final Map<MemberReference, Set<String>> relatedTypes = new HashMap<>();
  private final Map<MemberReference, Boolean> pureVirtual = new HashMap<>();
  private final Map<MemberReference, MemberKind> memberKinds = new HashMap<>();
  private final Set<String> reportedUnresolvedNames = new HashSet<>();

  public CachingTypeCatalog(TypeCatalogSource source, DiagnosticsHandler diagnostics) {
    this.source = source;
    this.diagnostics = diagnostics;
  }

  @Override
  public List<String> allTypes() {
    if (allTypes == null) {
      allTypes = ImmutableList.copyOf(new LinkedHashSet<>(source.allTypes()));
    }
    return allTypes;
  }

  @Override
  public boolean isType(String name) {
    return isType.computeIfAbsent(name, source::isType);
  }

  @Override
  public List<String> ancestors(String type) {
    return computeChainIfAbsent(ancestors, type, this::getDirectSupertypes);
  }

  @Override
  public List<String> descendants(String type) {
    return computeChainIfAbsent(descendants, type, this::getDirectSubtypes);
  }

  private List<String> computeChainIfAbsent(
      Map<String, List<String>> cache, String type, Function<String, List<String>> edges) {
    List<String> cached = cache.get(type);
    if (cached != null) {
      return cached;
    }
    List<String> chain;
    if (isType(type)) {
      WorkList<String> worklist = WorkList.newEqualityWorkList();
      worklist.addIfNotSeen(type);
      while (worklist.hasNext()) {
        worklist.addIfNotSeen(edges.apply(worklist.next()));
      }
      chain = ImmutableList.copyOf(worklist.getSeenSet());
    } else {
      chain = ImmutableList.of();
    }
    cache.put(type, chain);
    return chain;
  }

  private List<String> getDirectSupertypes(String type) {
    return directSupertypes.computeIfAbsent(
        type, t -> resolveAll(source.directSupertypeNames(t), "supertype of " + t));
  }

  private List<String> getDirectSubtypes(String type) {
    return directSubtypes.computeIfAbsent(
        type, t -> resolveAll(source.directSubtypeNames(t), "subtype of " + t));
  }

  @Override
  public List<String> members(String type) {
    return members.computeIfAbsent(
        type,
        t ->
            isType(t)
                ? ImmutableList.copyOf(new LinkedHashSet<>(source.members(t)))
                : ImmutableList.of());
  }

  @Override
  public Set<String> relatedTypes(String type, String member) {
    return relatedTypes.computeIfAbsent(
        new MemberReference(type, member),
        reference -> {
          if (!isType(type)) {
            return ImmutableSet.of();
          }
          return ImmutableSet.copyOf(
              resolveAll(
                  source.relatedTypeNames(type, member), "related to " + reference));
        });
  }

  @Override
  public boolean isPureVirtual(String type, String member) {
    return pureVirtual.computeIfAbsent(
        new MemberReference(type, member),
        reference -> isType(type) && source.isPureVirtual(type, member));
  }

  @Override
  public MemberKind memberKind(String type, String member) {
    return memberKinds.computeIfAbsent(
        new MemberReference(type, member),
        reference -> isType(type) ? source.memberKind(type, member) : MemberKind.UNKNOWN);
  }

  private List<String> resolveAll(Collection<String> names, String context) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    for (String name : names) {
      List<String> resolved = resolve(name);
      if (resolved.isEmpty()) {
        if (reportedUnresolvedNames.add(name)) {
          diagnostics.info(new UnresolvedTypeNameDiagnostic(name, context));
        }
        continue;
      }
      for (String type : resolved) {
        if (seen.add(type)) {
          builder.add(type);
        }
      }
    }
    return builder.build();
  }

  private List<String> resolve(String name) {
    List<String> resolved = resolvedNames.get(name);
    if (resolved == null) {
      ImmutableList.Builder<String> builder = ImmutableList.builder();
      for (String candidate : source.resolveTypeName(name)) {
        if (isType(candidate)) {
          builder.add(candidate);
        }
      }
      resolved = builder.build();
      resolvedNames.put(name, resolved);
    }
    return resolved;
  }
}
