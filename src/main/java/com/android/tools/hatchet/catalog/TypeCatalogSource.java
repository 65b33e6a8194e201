// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import java.util.Collection;
import java.util.Collections;

/**
 * Backend providing the direct facts of a type catalog. Names of supertypes, subtypes and related
 * types are reported as they appear in the backend and are resolved by {@link #resolveTypeName}.
 *
 * <p>Queries may be expensive. {@link CachingTypeCatalog} adapts a source to {@link TypeCatalog}
 * and asks each question at most once.
 */
public interface TypeCatalogSource {

  Collection<String> allTypes();

  boolean isType(String name);

  Collection<String> directSupertypeNames(String type);

  Collection<String> directSubtypeNames(String type);

  Collection<String> members(String type);

  Collection<String> relatedTypeNames(String type, String member);

  boolean isPureVirtual(String type, String member);

  default MemberKind memberKind(String type, String member) {
    return MemberKind.UNKNOWN;
  }

  /**
   * Maps a name to the canonical catalog types it denotes. An alias of an instantiated generic
   * type, such as a list of Foo, denotes both the generic type and Foo. Returns an empty
   * collection for names that cannot be resolved.
   */
  default Collection<String> resolveTypeName(String name) {
    return isType(name) ? Collections.singletonList(name) : Collections.emptyList();
  }
}
