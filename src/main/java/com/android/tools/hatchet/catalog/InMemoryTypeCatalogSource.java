// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A {@link TypeCatalogSource} whose facts are all known up front. */
public class InMemoryTypeCatalogSource implements TypeCatalogSource {

  private final ImmutableMap<String, TypeEntry> types;
  private final ImmutableMap<String, List<String>> aliases;
  private final ImmutableMap<String, List<String>> subtypes;

  private InMemoryTypeCatalogSource(
      ImmutableMap<String, TypeEntry> types, ImmutableMap<String, List<String>> aliases) {
    this.types = types;
    this.aliases = aliases;
    this.subtypes = computeSubtypes();
  }

  public static Builder builder() {
    return new Builder();
  }

  private ImmutableMap<String, List<String>> computeSubtypes() {
    Map<String, Set<String>> result = new LinkedHashMap<>();
    types.forEach(
        (name, entry) -> {
          for (String supertypeName : entry.supertypes) {
            for (String supertype : resolveTypeName(supertypeName)) {
              result.computeIfAbsent(supertype, ignore -> new LinkedHashSet<>()).add(name);
            }
          }
        });
    ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
    result.forEach((name, names) -> builder.put(name, ImmutableList.copyOf(names)));
    return builder.build();
  }

  @Override
  public Collection<String> allTypes() {
    return types.keySet();
  }

  @Override
  public boolean isType(String name) {
    return types.containsKey(name);
  }

  @Override
  public Collection<String> directSupertypeNames(String type) {
    TypeEntry entry = types.get(type);
    return entry != null ? entry.supertypes : Collections.emptyList();
  }

  @Override
  public Collection<String> directSubtypeNames(String type) {
    return subtypes.getOrDefault(type, Collections.emptyList());
  }

  @Override
  public Collection<String> members(String type) {
    TypeEntry entry = types.get(type);
    return entry != null ? entry.members.keySet() : Collections.emptyList();
  }

  @Override
  public Collection<String> relatedTypeNames(String type, String member) {
    MemberEntry entry = getMember(type, member);
    return entry != null ? entry.relatedTypeNames : Collections.emptyList();
  }

  @Override
  public boolean isPureVirtual(String type, String member) {
    MemberEntry entry = getMember(type, member);
    return entry != null && entry.pureVirtual;
  }

  @Override
  public MemberKind memberKind(String type, String member) {
    MemberEntry entry = getMember(type, member);
    return entry != null ? entry.kind : MemberKind.UNKNOWN;
  }

  @Override
  public Collection<String> resolveTypeName(String name) {
    if (isType(name)) {
      return Collections.singletonList(name);
    }
    return aliases.getOrDefault(name, Collections.emptyList());
  }

  private MemberEntry getMember(String type, String member) {
    TypeEntry entry = types.get(type);
    return entry != null ? entry.members.get(member) : null;
  }

  private static class TypeEntry {

    private final List<String> supertypes = new ArrayList<>();
    private final Map<String, MemberEntry> members = new LinkedHashMap<>();
  }

  private static class MemberEntry {

    private MemberKind kind;
    private boolean pureVirtual;
    private final Set<String> relatedTypeNames = new LinkedHashSet<>();

    MemberEntry(MemberKind kind) {
      this.kind = kind;
    }
  }

  public static class Builder {

    private final Map<String, TypeEntry> types = new LinkedHashMap<>();
    private final Map<String, List<String>> aliases = new LinkedHashMap<>();

    private Builder() {}

    /** Adds a type, or adds supertypes to an existing type. */
    public Builder addType(String name, String... supertypes) {
      return addType(name, Arrays.asList(supertypes));
    }

    public Builder addType(String name, Collection<String> supertypes) {
      TypeEntry entry = getOrCreateType(name);
      for (String supertype : supertypes) {
        if (!entry.supertypes.contains(supertype)) {
          entry.supertypes.add(supertype);
        }
      }
      return this;
    }

    public Builder addFunction(String type, String name, String... relatedTypeNames) {
      return addMember(type, name, MemberKind.FUNCTION, false, Arrays.asList(relatedTypeNames));
    }

    public Builder addPureVirtualFunction(String type, String name, String... relatedTypeNames) {
      return addMember(type, name, MemberKind.FUNCTION, true, Arrays.asList(relatedTypeNames));
    }

    public Builder addField(String type, String name, String... relatedTypeNames) {
      return addMember(type, name, MemberKind.FIELD, false, Arrays.asList(relatedTypeNames));
    }

    /**
     * Adds a member to a type, creating the type if needed. Adding a member with the same name
     * again, e.g., an overload, merges the facts of both declarations.
     */
    public Builder addMember(
        String type,
        String name,
        MemberKind kind,
        boolean pureVirtual,
        Collection<String> relatedTypeNames) {
      TypeEntry entry = getOrCreateType(type);
      MemberEntry member = entry.members.get(name);
      if (member == null) {
        member = new MemberEntry(kind);
        entry.members.put(name, member);
      } else {
        member.kind = MemberKind.merge(member.kind, kind);
      }
      member.pureVirtual |= pureVirtual;
      member.relatedTypeNames.addAll(relatedTypeNames);
      return this;
    }

    /** Declares that {@code alias} denotes the given canonical types. */
    public Builder addAlias(String alias, String... canonicalNames) {
      return addAlias(alias, Arrays.asList(canonicalNames));
    }

    public Builder addAlias(String alias, Collection<String> canonicalNames) {
      aliases.computeIfAbsent(alias, ignore -> new ArrayList<>()).addAll(canonicalNames);
      return this;
    }

    private TypeEntry getOrCreateType(String name) {
      return types.computeIfAbsent(name, ignore -> new TypeEntry());
    }

    public InMemoryTypeCatalogSource build() {
      ImmutableMap.Builder<String, List<String>> aliasesBuilder = ImmutableMap.builder();
      aliases.forEach((alias, names) -> aliasesBuilder.put(alias, ImmutableList.copyOf(names)));
      return new InMemoryTypeCatalogSource(ImmutableMap.copyOf(types), aliasesBuilder.build());
    }
  }
}
