// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.android.tools.hatchet.catalog.CachingTypeCatalog;
import com.android.tools.hatchet.catalog.DirectoryDocumentationSource;
import com.android.tools.hatchet.catalog.InMemoryTypeCatalogSource;
import com.android.tools.hatchet.catalog.MemberKind;
import com.android.tools.hatchet.catalog.QtDocTypeCatalogSource;
import com.android.tools.hatchet.harvest.IdentifierSet;
import com.android.tools.hatchet.harvest.ScriptSourceCodeUnitReader;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.shaking.KeepPolicy;
import com.android.tools.hatchet.shaking.RejectionCollector;
import com.android.tools.hatchet.shaking.RejectionRecord;
import com.android.tools.hatchet.shaking.RejectionRecord.MemberRejection;
import com.android.tools.hatchet.shaking.RejectionRecord.TypeRejection;
import com.android.tools.hatchet.utils.StringUtils;
import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;

public class HatchetTest extends HatchetTestBase {

  private static InMemoryTypeCatalogSource catalogSource() {
    return InMemoryTypeCatalogSource.builder()
        .addType("QObject")
        .addPureVirtualFunction("QPaintDevice", "paintEngine")
        .addType("QWidget", "QObject", "QPaintDevice")
        .addFunction("QWidget", "show")
        .addFunction("QWidget", "hide")
        .addFunction("QWidget", "paintEngine")
        .addType("QLabel", "QWidget")
        .addFunction("QLabel", "setText", "QString")
        .addFunction("QLabel", "setPixmap", "QPixmap")
        .addType("QApplication", "QObject")
        .addFunction("QApplication", "exec")
        .addType("QString")
        .addFunction("QPixmap", "fill")
        .addFunction("QSound", "play")
        .build();
  }

  private Path createApplication() throws Exception {
    Path root = temp.newFolder("app").toPath();
    writeFile(
        root.resolve("main.py"),
        StringUtils.lines(
            "from PySide.QtGui import QApplication, QLabel",
            "app = QApplication([])",
            "label = QLabel('hi')",
            "label.setText('Hello')",
            "label.show()"));
    return root;
  }

  private static final List<RejectionRecord> EXPECTED =
      ImmutableList.of(
          new MemberRejection("QApplication", "exec", MemberKind.FUNCTION),
          new MemberRejection("QLabel", "setPixmap", MemberKind.FUNCTION),
          new TypeRejection("QPixmap"),
          new MemberRejection("QSound", "play", MemberKind.FUNCTION),
          new MemberRejection("QWidget", "hide", MemberKind.FUNCTION));

  @Test
  public void testRun() throws Exception {
    Path rules = writeFile(temp.getRoot().toPath().resolve("keep.txt"), "-keeptype QSound\n");
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    RejectionCollector collector = new RejectionCollector();
    Hatchet.run(
        HatchetCommand.builder(diagnostics)
            .addApplicationRoots(createApplication())
            .setTypeCatalogSource(catalogSource())
            .addKeepPolicyFiles(rules)
            .setRejectionConsumer(collector)
            .setTraceUsefulTypes(false)
            .build());
    diagnostics.assertNoErrors().assertNoWarnings();
    diagnostics.assertInfoMessageThatMatches("Rejecting 1 types and 4 members");
    assertEquals(EXPECTED, collector.getRecords());
  }

  @Test
  public void testRunWithPreparedInputs() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    RejectionCollector collector = new RejectionCollector();
    Hatchet.run(
        HatchetCommand.builder(diagnostics)
            .addApplicationRoots(createApplication())
            .setCodeUnitReaders(ImmutableList.of(new ScriptSourceCodeUnitReader()))
            .setTypeCatalog(new CachingTypeCatalog(catalogSource(), diagnostics))
            .addKeepPolicy(KeepPolicy.builder().addAlwaysKeepType("QSound").build())
            .setRejectionConsumer(collector)
            .build());
    diagnostics.assertNoErrors();
    assertEquals(EXPECTED, collector.getRecords());
  }

  @Test
  public void testTypesystemOutput() throws Exception {
    Path output = temp.getRoot().toPath().resolve("out/typesystem_gui.xml");
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    Hatchet.run(
        HatchetCommand.builder(diagnostics)
            .addApplicationRoots(createApplication())
            .setTypeCatalogSource(catalogSource())
            .addKeepPolicyRules("-keeptype QSound", Origin.unknown())
            .setTypesystemOutputPath(output, "PySide.QtGui")
            .build());
    diagnostics.assertNoErrors();
    assertEquals(
        StringUtils.lines(
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
            "<typesystem package=\"PySide.QtGui\">",
            "  <rejection class=\"QApplication\" function-name=\"exec\"/>",
            "  <rejection class=\"QLabel\" function-name=\"setPixmap\"/>",
            "  <rejection class=\"QPixmap\"/>",
            "  <rejection class=\"QSound\" function-name=\"play\"/>",
            "  <rejection class=\"QWidget\" function-name=\"hide\"/>",
            "</typesystem>"),
        new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
  }

  @Test
  public void testComputeRejections() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet identifiers =
        IdentifierSet.of("QApplication", "QLabel", "app", "label", "setText", "show");
    KeepPolicy policy =
        KeepPolicy.builder()
            .addAll(KeepPolicy.defaultPolicy())
            .addAlwaysKeepType("QSound")
            .build();
    List<RejectionRecord> records =
        Hatchet.computeRejections(
            new CachingTypeCatalog(catalogSource(), diagnostics),
            policy,
            identifiers,
            diagnostics);
    assertEquals(EXPECTED, records);
  }

  @Test
  public void testWithoutDefaultPolicy() throws Exception {
    RejectionCollector collector = new RejectionCollector();
    Hatchet.run(
        HatchetCommand.builder(new DiagnosticsCollector())
            .addApplicationRoots(createApplication())
            .setTypeCatalogSource(catalogSource())
            .setUseDefaultKeepPolicy(false)
            .setRejectionConsumer(collector)
            .build());
    // QWidget is still useful as an ancestor of QLabel.
    assertEquals(
        ImmutableList.of(
            new MemberRejection("QApplication", "exec", MemberKind.FUNCTION),
            new MemberRejection("QLabel", "setPixmap", MemberKind.FUNCTION),
            new TypeRejection("QPixmap"),
            new TypeRejection("QSound"),
            new MemberRejection("QWidget", "hide", MemberKind.FUNCTION)),
        collector.getRecords());
  }

  @Test
  public void testCatalogFailure() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    Path output = temp.getRoot().toPath().resolve("typesystem.xml");
    HatchetCommand command =
        HatchetCommand.builder(diagnostics)
            .addApplicationRoots(createApplication())
            .setTypeCatalogSource(
                new QtDocTypeCatalogSource(
                    new DirectoryDocumentationSource(temp.newFolder("doc").toPath())))
            .setTypesystemOutputPath(output, "PySide.QtGui")
            .build();
    try {
      Hatchet.run(command);
      fail("Expected failure");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("index page");
    }
    assertFalse(Files.exists(output));
  }

  @Test
  public void testMissingApplicationRoot() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    Path output = temp.getRoot().toPath().resolve("typesystem.xml");
    HatchetCommand command =
        HatchetCommand.builder(diagnostics)
            .addApplicationRoots(createApplication(), temp.getRoot().toPath().resolve("ap"))
            .setTypeCatalogSource(catalogSource())
            .setTypesystemOutputPath(output, "PySide.QtGui")
            .build();
    try {
      Hatchet.run(command);
      fail("Expected failure");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("does not exist");
    }
    assertFalse(Files.exists(output));
  }

  @Test
  public void testTraceOptionOverridesDefault() throws Exception {
    HatchetCommand.Builder builder =
        HatchetCommand.builder(new DiagnosticsCollector())
            .setTypeCatalogSource(catalogSource())
            .setRejectionConsumer(new RejectionCollector());
    assertEquals(
        new HatchetOptions().traceUsefulTypes,
        builder.build().getInternalOptions().traceUsefulTypes);
    assertTrue(builder.setTraceUsefulTypes(true).build().getInternalOptions().traceUsefulTypes);
    assertFalse(builder.setTraceUsefulTypes(false).build().getInternalOptions().traceUsefulTypes);
  }

  @Test
  public void testMissingCatalog() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    try {
      HatchetCommand.builder(diagnostics).setRejectionConsumer(new RejectionCollector()).build();
      fail("Expected failure");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("A type catalog is required");
    }
  }

  @Test
  public void testInvalidKeepRules() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    try {
      HatchetCommand.builder(diagnostics)
          .setTypeCatalogSource(catalogSource())
          .setRejectionConsumer(new RejectionCollector())
          .addKeepPolicyRules("-keepclass QSound", Origin.unknown())
          .build();
      fail("Expected failure");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("Unknown option");
    }
  }
}
