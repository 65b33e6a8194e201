// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.position;

/** Represents a position in a resource, used when reporting diagnostics. */
public interface Position {

  Position UNKNOWN =
      new Position() {
        @Override
        public String getDescription() {
          return "--unknown--";
        }

        @Override
        public String toString() {
          return "--unknown--";
        }
      };

  /** A user friendly description of the position. */
  String getDescription();
}
