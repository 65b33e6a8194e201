// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

/** Collects all diagnostics of a test. */
public class DiagnosticsCollector implements DiagnosticsHandler {

  private final List<Diagnostic> errors = new ArrayList<>();
  private final List<Diagnostic> warnings = new ArrayList<>();
  private final List<Diagnostic> infos = new ArrayList<>();

  @Override
  public void error(Diagnostic error) {
    errors.add(error);
  }

  @Override
  public void warning(Diagnostic warning) {
    warnings.add(warning);
  }

  @Override
  public void info(Diagnostic info) {
    infos.add(info);
  }

  public List<Diagnostic> getErrors() {
    return errors;
  }

  public List<Diagnostic> getWarnings() {
    return warnings;
  }

  public List<Diagnostic> getInfos() {
    return infos;
  }

  public DiagnosticsCollector assertNoErrors() {
    assertEquals(messages(errors), 0, errors.size());
    return this;
  }

  public DiagnosticsCollector assertNoWarnings() {
    assertEquals(messages(warnings), 0, warnings.size());
    return this;
  }

  public DiagnosticsCollector assertOnlyErrors(int count) {
    assertEquals(messages(errors), count, errors.size());
    return assertNoWarnings();
  }

  public DiagnosticsCollector assertWarningsCount(int count) {
    assertEquals(messages(warnings), count, warnings.size());
    return this;
  }

  public DiagnosticsCollector assertErrorMessageThatMatches(String substring) {
    return assertMessageThatMatches(errors, substring);
  }

  public DiagnosticsCollector assertWarningMessageThatMatches(String substring) {
    return assertMessageThatMatches(warnings, substring);
  }

  public DiagnosticsCollector assertInfoMessageThatMatches(String substring) {
    return assertMessageThatMatches(infos, substring);
  }

  private DiagnosticsCollector assertMessageThatMatches(
      List<Diagnostic> diagnostics, String substring) {
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getDiagnosticMessage().contains(substring)) {
        return this;
      }
    }
    fail("Expected a diagnostic containing '" + substring + "' in: " + messages(diagnostics));
    return this;
  }

  public DiagnosticsCollector assertAllWarningsMatch(String substring) {
    for (Diagnostic warning : warnings) {
      assertThat(warning.getDiagnosticMessage(), containsString(substring));
    }
    return this;
  }

  private static String messages(List<Diagnostic> diagnostics) {
    StringBuilder builder = new StringBuilder();
    for (Diagnostic diagnostic : diagnostics) {
      builder.append(diagnostic.getOrigin()).append(": ");
      builder.append(diagnostic.getDiagnosticMessage()).append('\n');
    }
    return builder.toString();
  }
}
