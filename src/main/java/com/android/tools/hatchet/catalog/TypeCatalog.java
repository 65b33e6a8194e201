// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import java.util.List;
import java.util.Set;

/**
 * Structural information about the API surface of a binding layer.
 *
 * <p>Queries for names that are not types of the catalog give negative answers: empty collections
 * or false. Backend failures are reported by throwing {@link CatalogException}.
 */
public interface TypeCatalog {

  /** All types the binding layer could expose. */
  List<String> allTypes();

  boolean isType(String name);

  /**
   * The type itself followed by all its ancestors, nearest first. Alias and instantiated names in
   * the hierarchy are resolved to their canonical types.
   */
  List<String> ancestors(String type);

  /** The type itself followed by all its descendants, nearest first. */
  List<String> descendants(String type);

  /** The members declared directly on the type. Inherited members are not included. */
  List<String> members(String type);

  /**
   * Types that may flow through the parameters or the return value of the member. This is an
   * approximation, names that do not resolve to a type of the catalog are dropped.
   */
  Set<String> relatedTypes(String type, String member);

  boolean isPureVirtual(String type, String member);

  MemberKind memberKind(String type, String member);
}
