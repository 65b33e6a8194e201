// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.utils.IdentifierUtils;
import com.android.tools.hatchet.utils.StringUtils;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads plain script sources by a lexical scan.
 *
 * <p>Without a parser the scan cannot tell attribute accesses from other uses of a name, so every
 * identifier token is reported as referenced. String literals are reported as constants, and the
 * replacement fields of format strings are scanned for names as well.
 */
public class ScriptSourceCodeUnitReader implements CodeUnitReader {

  public static final ImmutableSet<String> DEFAULT_EXTENSIONS = ImmutableSet.of(".py", ".pyw");

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf", "ur");

  private static final Pattern CODING_DECLARATION =
      Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");

  private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(#.*)?$");

  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  // Names the scripting runtime accepts that the JDK does not know.
  private static final ImmutableMap<String, String> CHARSET_ALIASES =
      ImmutableMap.<String, String>builder()
          .put("latin-1", "ISO-8859-1")
          .put("iso-latin-1", "ISO-8859-1")
          .put("l1", "ISO-8859-1")
          .put("utf8", "UTF-8")
          .put("utf-8-sig", "UTF-8")
          .put("cp65001", "UTF-8")
          .build();

  private final ImmutableSet<String> extensions;

  public ScriptSourceCodeUnitReader() {
    this(DEFAULT_EXTENSIONS);
  }

  public ScriptSourceCodeUnitReader(Iterable<String> extensions) {
    this.extensions = ImmutableSet.copyOf(extensions);
  }

  @Override
  public boolean accepts(String fileName) {
    String name = StringUtils.toLowerCase(fileName);
    for (String extension : extensions) {
      if (name.endsWith(extension)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public CodeUnit read(Origin origin, byte[] bytes) throws MalformedCodeUnitException {
    String source = decode(origin, bytes);
    BasicCodeUnit.Builder builder = BasicCodeUnit.builder(origin);
    new Scanner(source, builder).scan();
    return builder.build();
  }

  private static String decode(Origin origin, byte[] bytes) throws MalformedCodeUnitException {
    int start = hasUtf8Bom(bytes) ? UTF8_BOM.length : 0;
    Charset charset = declaredCharset(origin, bytes, start);
    if (start > 0 && charset != null && !charset.equals(StandardCharsets.UTF_8)) {
      throw new MalformedCodeUnitException(
          origin, "Encoding declaration " + charset.name() + " conflicts with a UTF-8 BOM");
    }
    if (charset == null) {
      charset = StandardCharsets.UTF_8;
    }
    try {
      String source =
          charset
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes, start, bytes.length - start))
              .toString();
      if (source.indexOf('\0') >= 0) {
        throw new MalformedCodeUnitException(origin, "Source contains a NUL character");
      }
      return source;
    } catch (CharacterCodingException e) {
      throw new MalformedCodeUnitException(origin, "Source is not valid " + charset.name(), e);
    }
  }

  private static boolean hasUtf8Bom(byte[] bytes) {
    if (bytes.length < UTF8_BOM.length) {
      return false;
    }
    for (int i = 0; i < UTF8_BOM.length; i++) {
      if (bytes[i] != UTF8_BOM[i]) {
        return false;
      }
    }
    return true;
  }

  /** The charset named by an encoding declaration on the first or second line, if any. */
  private static Charset declaredCharset(Origin origin, byte[] bytes, int start)
      throws MalformedCodeUnitException {
    // Declarations are ASCII, so the header can be inspected before the encoding is known.
    String header =
        new String(
            bytes, start, Math.min(bytes.length - start, 1024), StandardCharsets.ISO_8859_1);
    List<String> lines = StringUtils.splitLines(header);
    for (int i = 0; i < Math.min(2, lines.size()); i++) {
      Matcher matcher = CODING_DECLARATION.matcher(lines.get(i));
      if (matcher.find()) {
        return lookupCharset(origin, matcher.group(1));
      }
      if (!BLANK_OR_COMMENT.matcher(lines.get(i)).matches()) {
        // The second line only counts if the first is blank or a comment.
        break;
      }
    }
    return null;
  }

  private static Charset lookupCharset(Origin origin, String name)
      throws MalformedCodeUnitException {
    String normalized = StringUtils.toLowerCase(name).replace('_', '-');
    String alias = CHARSET_ALIASES.get(normalized);
    try {
      return Charset.forName(alias != null ? alias : normalized);
    } catch (IllegalArgumentException e) {
      throw new MalformedCodeUnitException(origin, "Unknown source encoding: " + name, e);
    }
  }

  private static class Scanner {

    private final String source;
    private final BasicCodeUnit.Builder builder;
    private int position = 0;
    private int line = 1;

    Scanner(String source, BasicCodeUnit.Builder builder) {
      this.source = source;
      this.builder = builder;
    }

    void scan() throws MalformedCodeUnitException {
      while (!eof()) {
        char c = peek();
        if (c == '#') {
          skipComment();
        } else if (c == '\'' || c == '"') {
          scanString("");
        } else if (IdentifierUtils.isIdentifierStart(source.codePointAt(position))) {
          String name = acceptIdentifier();
          if (!eof()
              && (peek() == '\'' || peek() == '"')
              && STRING_PREFIXES.contains(StringUtils.toLowerCase(name))) {
            scanString(StringUtils.toLowerCase(name));
          } else {
            builder.addReferencedName(name);
          }
        } else if (Character.isDigit(c)) {
          skipNumber();
        } else {
          if (c == '\n') {
            line++;
          }
          position++;
        }
      }
    }

    private boolean eof() {
      return position >= source.length();
    }

    private char peek() {
      return source.charAt(position);
    }

    private void skipComment() {
      while (!eof() && peek() != '\n') {
        position++;
      }
    }

    // Consumes digits, letters and dots so that literals such as 0x1F or 1e10 are not
    // mistaken for names.
    private void skipNumber() {
      while (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == '.')) {
        position++;
      }
    }

    private String acceptIdentifier() {
      int start = position;
      while (!eof()) {
        int cp = source.codePointAt(position);
        if (!IdentifierUtils.isIdentifierPart(cp)) {
          break;
        }
        position += Character.charCount(cp);
      }
      return source.substring(start, position);
    }

    private void scanString(String prefix) throws MalformedCodeUnitException {
      int startLine = line;
      char quote = peek();
      boolean triple = source.startsWith(String.valueOf(quote).repeat(3), position);
      position += triple ? 3 : 1;
      StringBuilder content = new StringBuilder();
      while (true) {
        if (eof()) {
          throw new MalformedCodeUnitException(
              builder.getOrigin(), "Unterminated string literal starting on line " + startLine);
        }
        char c = peek();
        if (c == '\\') {
          // Raw strings keep the backslash, but it still prevents the next char from closing.
          content.append(c);
          position++;
          if (source.startsWith("\r\n", position)) {
            content.append("\r\n");
            position += 2;
            line++;
          } else if (!eof()) {
            if (peek() == '\n') {
              line++;
            }
            content.append(peek());
            position++;
          }
          continue;
        }
        if (c == quote) {
          if (!triple) {
            position++;
            break;
          }
          if (source.startsWith(String.valueOf(quote).repeat(3), position)) {
            position += 3;
            break;
          }
        }
        if (c == '\n') {
          if (!triple) {
            throw new MalformedCodeUnitException(
                builder.getOrigin(), "Unterminated string literal on line " + startLine);
          }
          line++;
        }
        content.append(c);
        position++;
      }
      String value = content.toString();
      builder.addStringConstant(value);
      if (prefix.contains("f")) {
        scanFormatString(value);
      }
    }

    // Names in replacement fields of a format string are evaluated as code.
    private void scanFormatString(String value) {
      int depth = 0;
      int i = 0;
      while (i < value.length()) {
        int cp = value.codePointAt(i);
        if (cp == '{') {
          if (depth == 0 && value.startsWith("{{", i)) {
            i += 2;
            continue;
          }
          depth++;
        } else if (cp == '}' && depth > 0) {
          depth--;
        } else if (depth > 0 && IdentifierUtils.isIdentifierStart(cp)) {
          int start = i;
          while (i < value.length() && IdentifierUtils.isIdentifierPart(value.codePointAt(i))) {
            i += Character.charCount(value.codePointAt(i));
          }
          builder.addReferencedName(value.substring(start, i));
          continue;
        }
        i += Character.charCount(cp);
      }
    }
  }
}
