// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.hatchet.DiagnosticsCollector;
import com.android.tools.hatchet.HatchetTestBase;
import com.android.tools.hatchet.origin.Origin;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.Test;

public class IdentifierHarvesterTest extends HatchetTestBase {

  private Path createApplication() throws Exception {
    Path root = temp.newFolder("app").toPath();
    writeFile(root.resolve("main.py"), "from gui import MainWindow\nMainWindow().show()\n");
    writeFile(root.resolve("gui/__init__.py"), "");
    writeFile(root.resolve("gui/window.py"), "class MainWindow(QMainWindow):\n  pass\n");
    writeFile(root.resolve("notes.txt"), "QNotUsed");
    writeZip(
        root.resolve("lib/bundle.zip"),
        "util/helpers.py",
        "def helper():\n  return 'QTimer'\n",
        "util/nested.jar",
        nestedJar());
    return root;
  }

  private static byte[] nestedJar() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
      zip.putNextEntry(new ZipEntry("com/example/Sample.class"));
      zip.write(getClassBytes(ClassFileCodeUnitReaderTest.Sample.class));
      zip.closeEntry();
      zip.putNextEntry(new ZipEntry("scripts/deep.py"));
      zip.write("deepName = 1\n".getBytes());
      zip.closeEntry();
    }
    return bytes.toByteArray();
  }

  @Test
  public void testDirectory() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierHarvester harvester = new IdentifierHarvester(diagnostics);
    IdentifierSet identifiers = harvester.addPath(createApplication()).build();
    diagnostics.assertNoErrors().assertNoWarnings();
    assertTrue(identifiers.contains("MainWindow"));
    assertTrue(identifiers.contains("show"));
    assertTrue(identifiers.contains("QMainWindow"));
    assertTrue(identifiers.contains("helper"));
    // String constants that look like names.
    assertTrue(identifiers.contains("QTimer"));
    // Nested archive content.
    assertTrue(identifiers.contains("deepName"));
    assertTrue(identifiers.contains("QPushButton"));
    assertTrue(identifiers.contains("setText"));
    assertFalse(identifiers.contains("QNotUsed"));
    // main.py, __init__.py, window.py, helpers.py, Sample.class and deep.py.
    assertEquals(6, harvester.getCodeUnitCount());
  }

  @Test
  public void testHarvestIsIdempotent() throws Exception {
    Path root = createApplication();
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet first = new IdentifierHarvester(diagnostics).addPath(root).build();
    IdentifierSet second = new IdentifierHarvester(diagnostics).addPath(root).build();
    assertEquals(first, second);
  }

  @Test
  public void testMalformedUnitIsSkipped() throws Exception {
    Path root = temp.newFolder("app").toPath();
    writeFile(root.resolve("good.py"), "goodName = 1\n");
    writeFile(root.resolve("bad.py"), "badName = 'unterminated\n");
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet identifiers = new IdentifierHarvester(diagnostics).addPath(root).build();
    diagnostics
        .assertNoErrors()
        .assertWarningsCount(1)
        .assertWarningMessageThatMatches("Unterminated string literal");
    assertTrue(identifiers.contains("goodName"));
    assertFalse(identifiers.contains("badName"));
  }

  @Test
  public void testInvalidArchive() throws Exception {
    Path archive = writeFile(temp.getRoot().toPath().resolve("broken.zip"), "not a zip");
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet identifiers = new IdentifierHarvester(diagnostics).addPath(archive).build();
    diagnostics.assertNoErrors().assertWarningMessageThatMatches("not a zip archive");
    assertTrue(identifiers.isEmpty());
  }

  @Test
  public void testUnsupportedFile() throws Exception {
    Path file = writeFile(temp.getRoot().toPath().resolve("data.bin"), "QWidget");
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet identifiers = new IdentifierHarvester(diagnostics).addPath(file).build();
    diagnostics.assertWarningMessageThatMatches("Unsupported file type");
    assertTrue(identifiers.isEmpty());
  }

  @Test
  public void testMissingFile() {
    Path file = temp.getRoot().toPath().resolve("missing.py");
    assertFalse(Files.exists(file));
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    IdentifierSet identifiers = new IdentifierHarvester(diagnostics).addPath(file).build();
    diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("does not exist");
    assertTrue(identifiers.isEmpty());
  }

  @Test
  public void testCodeUnitConstants() {
    CodeUnit unit =
        BasicCodeUnit.builder(Origin.unknown())
            .addReferencedName("QLabel")
            .addStringConstant("setText")
            .addStringConstant("not a name")
            .addStringConstant("1abc")
            .addNestedUnit(
                BasicCodeUnit.builder(Origin.unknown()).addReferencedName("inner").build())
            .build();
    IdentifierSet identifiers =
        new IdentifierHarvester(new DiagnosticsCollector()).addCodeUnit(unit).build();
    assertEquals(IdentifierSet.of("QLabel", "setText", "inner"), identifiers);
  }
}
