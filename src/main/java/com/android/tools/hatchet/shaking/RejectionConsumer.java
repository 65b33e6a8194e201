// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.DiagnosticsHandler;

/** Receives the rejections of an analysis in their canonical order. */
public interface RejectionConsumer {

  void accept(RejectionRecord record, DiagnosticsHandler handler);

  /** Called once after the last rejection. */
  default void finished(DiagnosticsHandler handler) {}
}
