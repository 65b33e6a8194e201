// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.Origin;
import java.util.Collection;
import java.util.Collections;

/**
 * A unit of application code as seen by the identifier harvester.
 *
 * <p>Each host code representation (script sources, class files, ...) provides its own
 * implementation through a {@link CodeUnitReader}.
 */
public interface CodeUnit {

  Origin getOrigin();

  /** Names referenced directly by this unit, excluding the names of nested units. */
  Collection<String> getReferencedNames();

  /** String constants used by this unit. These may be names looked up reflectively. */
  Collection<String> getStringConstants();

  /** Units nested in this unit, such as method bodies, inner functions or class bodies. */
  default Collection<? extends CodeUnit> getNestedUnits() {
    return Collections.emptyList();
  }
}
