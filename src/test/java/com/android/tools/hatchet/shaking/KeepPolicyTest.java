// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.hatchet.DiagnosticsCollector;
import com.android.tools.hatchet.catalog.CachingTypeCatalog;
import com.android.tools.hatchet.catalog.InMemoryTypeCatalogSource;
import com.android.tools.hatchet.catalog.TypeCatalog;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

public class KeepPolicyTest {

  @Test
  public void testDefaultPolicy() {
    KeepPolicy policy = KeepPolicy.defaultPolicy();
    for (String type : new String[] {"QApplication", "QWidget", "QFlag", "QFlags", "QBuffer"}) {
      assertTrue(type, policy.isAlwaysKeepType(type));
    }
    assertFalse(policy.isAlwaysKeepType("QLabel"));
    assertTrue(policy.isAlwaysKeepMember("QLabel", "metaObject"));
    assertTrue(policy.isAlwaysKeepMember("QLabel", "devType"));
    assertTrue(policy.isAlwaysKeepMember("QLabel", "metric"));
    assertTrue(policy.isAlwaysKeepMember("QBitArray", "setBit"));
    assertFalse(policy.isAlwaysKeepMember("QLabel", "setBit"));
    assertTrue(policy.isAlwaysKeepMember("QByteArray", "insert"));
    for (String type : new String[] {"QPixmap", "QImage", "QPicture", "QX11Info"}) {
      assertTrue(type, policy.hasWildcardMembers(type));
      assertTrue(type, policy.isAlwaysKeepMember(type, "anything"));
    }
    assertFalse(policy.hasWildcardMembers("QWidget"));
  }

  @Test
  public void testForcedMembers() {
    TypeCatalog catalog =
        new CachingTypeCatalog(
            InMemoryTypeCatalogSource.builder()
                .addPureVirtualFunction("QPaintDevice", "paintEngine")
                .addType("QWidget", "QPaintDevice")
                .addFunction("QWidget", "QWidget")
                .addFunction("QWidget", "paintEngine")
                .addFunction("QWidget", "metaObject")
                .addFunction("QWidget", "setLayout")
                .build(),
            new DiagnosticsCollector());
    KeepPolicy policy = KeepPolicy.defaultPolicy();
    assertEquals(
        ImmutableSet.of("QWidget", "paintEngine", "metaObject"),
        policy.forcedMembers("QWidget", catalog));
    assertTrue(policy.isForcedMember("QPaintDevice", "paintEngine", catalog));
    assertFalse(policy.isForcedMember("QWidget", "setLayout", catalog));
  }

  @Test
  public void testMerge() {
    KeepPolicy custom =
        KeepPolicy.builder()
            .addAlwaysKeepType("QSystemTrayIcon")
            .addAlwaysKeepMember("QLabel", "setText")
            .build();
    KeepPolicy merged =
        KeepPolicy.builder().addAll(KeepPolicy.defaultPolicy()).addAll(custom).build();
    assertTrue(merged.isAlwaysKeepType("QSystemTrayIcon"));
    assertTrue(merged.isAlwaysKeepType("QApplication"));
    assertTrue(merged.isAlwaysKeepMember("QLabel", "setText"));
    assertTrue(merged.isAlwaysKeepMember("QLabel", "metaObject"));
    assertTrue(KeepPolicy.empty().isEmpty());
    assertFalse(merged.isEmpty());
  }
}
