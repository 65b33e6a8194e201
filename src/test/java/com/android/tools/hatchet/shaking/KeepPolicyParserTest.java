// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.android.tools.hatchet.DiagnosticsCollector;
import com.android.tools.hatchet.HatchetFailedException;
import com.android.tools.hatchet.HatchetTestBase;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.position.TextPosition;
import com.android.tools.hatchet.utils.StringUtils;
import java.nio.file.Path;
import org.junit.Test;

public class KeepPolicyParserTest extends HatchetTestBase {

  @Test
  public void testParse() throws Exception {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    KeepPolicy policy =
        new KeepPolicyParser(diagnostics)
            .parse(
                StringUtils.lines(
                    "# Used from a plugin.",
                    "-keeptype QSystemTrayIcon",
                    "",
                    "  -keepmember * sizeHint   # any type",
                    "-keepmember QLabel setText",
                    "-keepmember QMovie *"),
                Origin.unknown())
            .getPolicy();
    diagnostics.assertNoErrors().assertNoWarnings();
    assertTrue(policy.isAlwaysKeepType("QSystemTrayIcon"));
    assertTrue(policy.isAlwaysKeepMember("QPushButton", "sizeHint"));
    assertTrue(policy.isAlwaysKeepMember("QLabel", "setText"));
    assertFalse(policy.isAlwaysKeepMember("QPushButton", "setText"));
    assertTrue(policy.hasWildcardMembers("QMovie"));
  }

  @Test
  public void testParseFile() throws Exception {
    Path file =
        writeFile(
            temp.getRoot().toPath().resolve("keep.txt"),
            "-keeptype QSound\r\n-keepmember QSound play\r\n");
    KeepPolicy policy = new KeepPolicyParser(new DiagnosticsCollector()).parse(file).getPolicy();
    assertTrue(policy.isAlwaysKeepType("QSound"));
    assertTrue(policy.isAlwaysKeepMember("QSound", "play"));
  }

  @Test
  public void testErrorsAreReportedWithPosition() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    try {
      new KeepPolicyParser(diagnostics)
          .parse(
              StringUtils.lines(
                  "-keeptype QLabel",
                  "-keepclass QLabel",
                  "-keepmember QLabel",
                  "   -keeptype QMovie extra",
                  "-keepmember * *",
                  "keeptype QSound"),
              Origin.unknown());
      fail("Expected parse errors");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(5);
    }
    diagnostics
        .assertErrorMessageThatMatches("Unknown option")
        .assertErrorMessageThatMatches("Missing argument")
        .assertErrorMessageThatMatches("Unexpected argument")
        .assertErrorMessageThatMatches("Wildcard members require a type")
        .assertErrorMessageThatMatches("Expected option");
    assertEquals(new TextPosition(2, 1), diagnostics.getErrors().get(0).getPosition());
    assertEquals(new TextPosition(4, 4), diagnostics.getErrors().get(2).getPosition());
  }

  @Test
  public void testMissingFile() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    try {
      new KeepPolicyParser(diagnostics).parse(temp.getRoot().toPath().resolve("missing.txt"));
      fail("Expected failure");
    } catch (HatchetFailedException e) {
      diagnostics.assertOnlyErrors(1).assertErrorMessageThatMatches("Failed to read file");
    }
  }
}
