// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.origin.Origin;

/**
 * Thrown when a type catalog backend fails to answer a query, e.g., because its data cannot be
 * read. Lookups of names that are not types are not failures and never throw.
 */
public class CatalogException extends RuntimeException {

  private final Origin origin;

  public CatalogException(String message, Origin origin) {
    super(message);
    this.origin = origin;
  }

  public CatalogException(String message, Origin origin, Throwable cause) {
    super(message, cause);
    this.origin = origin;
  }

  public Origin getOrigin() {
    return origin;
  }
}
