// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.catalog.TypeCatalog;
import com.android.tools.hatchet.shaking.RejectionRecord.MemberRejection;
import com.android.tools.hatchet.shaking.RejectionRecord.TypeRejection;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;

/**
 * Turns a {@link ReachabilityResult} into rejections, ordered by type name and then member name.
 *
 * <p>A type is rejected if it is neither useful nor kept by policy. On a type that is not
 * rejected, every member that is neither named by the application nor kept is rejected, unless
 * the policy keeps all members of the type.
 */
public class RejectionEmitter {

  private final TypeCatalog catalog;
  private final ReachabilityResult result;

  public RejectionEmitter(TypeCatalog catalog, ReachabilityResult result) {
    this.catalog = catalog;
    this.result = result;
  }

  public void emit(RejectionConsumer consumer, DiagnosticsHandler handler) {
    for (String type : ImmutableSortedSet.copyOf(catalog.allTypes())) {
      if (result.getDisposition(type).isRejected()) {
        consumer.accept(new TypeRejection(type), handler);
        continue;
      }
      if (result.getPolicy().hasWildcardMembers(type)) {
        continue;
      }
      for (String member : ImmutableSortedSet.copyOf(catalog.members(type))) {
        if (!result.isKeptMember(type, member)) {
          consumer.accept(
              new MemberRejection(type, member, catalog.memberKind(type, member)), handler);
        }
      }
    }
    consumer.finished(handler);
  }

  public List<RejectionRecord> emit(DiagnosticsHandler handler) {
    RejectionCollector collector = new RejectionCollector();
    emit(collector, handler);
    return collector.getRecords();
  }
}
