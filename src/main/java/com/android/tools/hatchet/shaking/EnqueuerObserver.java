// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import java.util.Set;

/** Receives the events of an {@link Enqueuer} run in the order they happen. */
public interface EnqueuerObserver {

  EnqueuerObserver EMPTY = new EnqueuerObserver() {};

  /**
   * Called once for each type when it is added to the useful set.
   *
   * @param reason human readable description of why the type is useful.
   */
  default void onTypeMarkedUseful(String type, String reason) {}

  /** Called once for each useful type with the members kept on it. */
  default void onTypeProcessed(String type, Set<String> keptMembers) {}
}
