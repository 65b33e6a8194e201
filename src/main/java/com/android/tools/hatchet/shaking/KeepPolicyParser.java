// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.HatchetFailedException;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.origin.PathOrigin;
import com.android.tools.hatchet.position.TextPosition;
import com.android.tools.hatchet.utils.IdentifierUtils;
import com.android.tools.hatchet.utils.Reporter;
import com.android.tools.hatchet.utils.StringDiagnostic;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses keep policy rules.
 *
 * <pre>
 * # Comment until the end of the line.
 * -keeptype QApplication
 * -keepmember * metaObject
 * -keepmember QByteArray insert
 * -keepmember QPixmap *
 * </pre>
 *
 * <p>All errors of all sources are reported before failing.
 */
public class KeepPolicyParser {

  private final KeepPolicy.Builder builder = KeepPolicy.builder();
  private final Reporter reporter;

  public KeepPolicyParser(DiagnosticsHandler diagnostics) {
    this.reporter = new Reporter(diagnostics);
  }

  public KeepPolicy getPolicy() {
    return builder.build();
  }

  public KeepPolicyParser parse(Path path) throws HatchetFailedException {
    Origin origin = new PathOrigin(path);
    try {
      String contents = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
      parseSource(contents, origin);
    } catch (IOException e) {
      reporter.error(new StringDiagnostic("Failed to read file: " + e.getMessage(), origin));
    }
    reporter.failIfPendingErrors();
    return this;
  }

  public KeepPolicyParser parse(String contents, Origin origin) throws HatchetFailedException {
    parseSource(contents, origin);
    reporter.failIfPendingErrors();
    return this;
  }

  private void parseSource(String contents, Origin origin) {
    SourceParser parser = new SourceParser(contents, origin);
    while (!parser.eof()) {
      try {
        parser.parseOption();
      } catch (KeepPolicyParseException e) {
        reporter.error(e);
        parser.skipLine();
      }
    }
  }

  private class SourceParser {

    private final String contents;
    private final Origin origin;
    private int position = 0;
    private int line = 1;
    private int lineStartPosition = 0;

    SourceParser(String contents, Origin origin) {
      this.contents = contents;
      this.origin = origin;
    }

    boolean eof() {
      skipWhitespaceAndComments();
      return position >= contents.length();
    }

    void parseOption() throws KeepPolicyParseException {
      TextPosition optionStart = getPosition();
      int start = position;
      if (peek() != '-') {
        throw parseError("Expected option", start, optionStart);
      }
      position++;
      String option = acceptWord();
      if (option.equals("keeptype")) {
        String type = acceptArgument(optionStart, start);
        if (type.equals(KeepPolicy.WILDCARD) || !IdentifierUtils.isIdentifier(type)) {
          throw parseError("Expected type name", start, optionStart);
        }
        builder.addAlwaysKeepType(type);
      } else if (option.equals("keepmember")) {
        String type = acceptArgument(optionStart, start);
        String member = acceptArgument(optionStart, start);
        if (!isNameOrWildcard(type) || !isNameOrWildcard(member)) {
          throw parseError("Expected type and member names", start, optionStart);
        }
        if (type.equals(KeepPolicy.WILDCARD) && member.equals(KeepPolicy.WILDCARD)) {
          throw parseError("Wildcard members require a type", start, optionStart);
        }
        builder.addAlwaysKeepMember(type, member);
      } else {
        throw parseError("Unknown option", start, optionStart);
      }
      skipBlanks();
      if (position < contents.length() && peek() != '\n' && peek() != '\r' && peek() != '#') {
        throw parseError("Unexpected argument", start, optionStart);
      }
    }

    private boolean isNameOrWildcard(String name) {
      return name.equals(KeepPolicy.WILDCARD) || IdentifierUtils.isIdentifier(name);
    }

    private String acceptArgument(TextPosition optionStart, int start)
        throws KeepPolicyParseException {
      skipBlanks();
      String argument = acceptWord();
      if (argument.isEmpty()) {
        throw parseError("Missing argument", start, optionStart);
      }
      return argument;
    }

    private String acceptWord() {
      int start = position;
      while (position < contents.length()
          && !Character.isWhitespace(peek())
          && peek() != '#') {
        position++;
      }
      return contents.substring(start, position);
    }

    private char peek() {
      return contents.charAt(position);
    }

    private void skipBlanks() {
      while (position < contents.length() && (peek() == ' ' || peek() == '\t')) {
        position++;
      }
    }

    private void skipWhitespaceAndComments() {
      while (position < contents.length()) {
        char c = peek();
        if (c == '#') {
          skipLine();
        } else if (c == '\n') {
          position++;
          line++;
          lineStartPosition = position;
        } else if (Character.isWhitespace(c)) {
          position++;
        } else {
          return;
        }
      }
    }

    void skipLine() {
      while (position < contents.length() && peek() != '\n') {
        position++;
      }
    }

    private TextPosition getPosition() {
      return new TextPosition(line, position - lineStartPosition + 1);
    }

    private KeepPolicyParseException parseError(
        String message, int start, TextPosition optionStart) {
      int end = start;
      while (end < contents.length() && contents.charAt(end) != '\n') {
        end++;
      }
      return new KeepPolicyParseException(
          message, contents.substring(start, end).trim(), origin, optionStart);
    }
  }
}
