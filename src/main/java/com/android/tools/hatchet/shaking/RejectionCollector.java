// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

public class RejectionCollector implements RejectionConsumer {

  private final List<RejectionRecord> records = new ArrayList<>();
  private final RejectionConsumer next;

  public RejectionCollector() {
    this(null);
  }

  /** @param next consumer to forward to, may be null. */
  public RejectionCollector(RejectionConsumer next) {
    this.next = next;
  }

  @Override
  public void accept(RejectionRecord record, DiagnosticsHandler handler) {
    records.add(record);
    if (next != null) {
      next.accept(record, handler);
    }
  }

  @Override
  public void finished(DiagnosticsHandler handler) {
    if (next != null) {
      next.finished(handler);
    }
  }

  public List<RejectionRecord> getRecords() {
    return ImmutableList.copyOf(records);
  }

  public int getTypeRejectionCount() {
    return (int) records.stream().filter(RejectionRecord::isTypeRejection).count();
  }

  public int getMemberRejectionCount() {
    return (int) records.stream().filter(RejectionRecord::isMemberRejection).count();
  }
}
