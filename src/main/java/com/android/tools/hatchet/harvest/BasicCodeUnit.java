// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.Origin;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;

/** Immutable {@link CodeUnit} produced by the readers in this package. */
public class BasicCodeUnit implements CodeUnit {

  private final Origin origin;
  private final ImmutableSet<String> referencedNames;
  private final ImmutableSet<String> stringConstants;
  private final ImmutableList<CodeUnit> nestedUnits;

  private BasicCodeUnit(
      Origin origin,
      ImmutableSet<String> referencedNames,
      ImmutableSet<String> stringConstants,
      ImmutableList<CodeUnit> nestedUnits) {
    this.origin = origin;
    this.referencedNames = referencedNames;
    this.stringConstants = stringConstants;
    this.nestedUnits = nestedUnits;
  }

  public static Builder builder(Origin origin) {
    return new Builder(origin);
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public Collection<String> getReferencedNames() {
    return referencedNames;
  }

  @Override
  public Collection<String> getStringConstants() {
    return stringConstants;
  }

  @Override
  public Collection<CodeUnit> getNestedUnits() {
    return nestedUnits;
  }

  public static class Builder {

    private final Origin origin;
    private final ImmutableSet.Builder<String> referencedNames = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> stringConstants = ImmutableSet.builder();
    private final ImmutableList.Builder<CodeUnit> nestedUnits = ImmutableList.builder();

    private Builder(Origin origin) {
      this.origin = origin;
    }

    public Origin getOrigin() {
      return origin;
    }

    public Builder addReferencedName(String name) {
      referencedNames.add(name);
      return this;
    }

    public Builder addStringConstant(String constant) {
      stringConstants.add(constant);
      return this;
    }

    public Builder addNestedUnit(CodeUnit unit) {
      nestedUnits.add(unit);
      return this;
    }

    public BasicCodeUnit build() {
      return new BasicCodeUnit(
          origin, referencedNames.build(), stringConstants.build(), nestedUnits.build());
    }
  }
}
