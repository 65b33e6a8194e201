// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.origin.CodeUnitOrigin;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.utils.StringUtils;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads precompiled script modules (.pyc and .pyo files).
 *
 * <p>A module is a header followed by a marshalled code object. The code object is one code unit
 * and every code object among its constants, such as a function or class body, is a nested unit.
 * Referenced names are the names used by the bytecode. String constants are the string constants
 * of the code object, including those inside constant tuples and sets.
 */
public class PycCodeUnitReader implements CodeUnitReader {

  private static final int FLAG_REF = 0x80;
  private static final int MAX_DEPTH = 2000;

  // Marker for the end of a dict and for null entries.
  private static final Object NULL = new Object();
  // Marker for values that carry no names, such as numbers and None.
  private static final Object OTHER = new Object();

  @Override
  public boolean accepts(String fileName) {
    String name = StringUtils.toLowerCase(fileName);
    return name.endsWith(".pyc") || name.endsWith(".pyo");
  }

  @Override
  public CodeUnit read(Origin origin, byte[] bytes) throws MalformedCodeUnitException {
    if (bytes.length < 8 || bytes[2] != '\r' || bytes[3] != '\n') {
      throw new MalformedCodeUnitException(origin, "Not a compiled module");
    }
    Format format = Format.fromMagic(origin, (bytes[0] & 0xff) | (bytes[1] & 0xff) << 8);
    if (bytes.length < format.headerSize) {
      throw new MalformedCodeUnitException(origin, "Truncated compiled module header");
    }
    ByteBuffer buffer =
        ByteBuffer.wrap(bytes, format.headerSize, bytes.length - format.headerSize)
            .order(ByteOrder.LITTLE_ENDIAN);
    Object module = new MarshalReader(origin, buffer, format).readObject(0);
    if (!(module instanceof CodeObject)) {
      throw new MalformedCodeUnitException(origin, "Compiled module does not hold a code object");
    }
    return toCodeUnit(origin, (CodeObject) module);
  }

  private static CodeUnit toCodeUnit(Origin origin, CodeObject code) {
    BasicCodeUnit.Builder builder = BasicCodeUnit.builder(origin);
    for (Object name : code.names) {
      if (name instanceof String) {
        builder.addReferencedName((String) name);
      }
    }
    addConstants(builder, code.consts);
    return builder.build();
  }

  private static void addConstants(BasicCodeUnit.Builder builder, List<Object> constants) {
    for (Object constant : constants) {
      if (constant instanceof String) {
        builder.addStringConstant((String) constant);
      } else if (constant instanceof CodeObject) {
        CodeObject nested = (CodeObject) constant;
        builder.addNestedUnit(
            toCodeUnit(new CodeUnitOrigin(nested.name, builder.getOrigin()), nested));
      } else if (constant instanceof List) {
        @SuppressWarnings("unchecked")
        List<Object> elements = (List<Object>) constant;
        addConstants(builder, elements);
      }
    }
  }

  /** Header and code object layout of one family of runtime versions. */
  private static class Format {

    final int headerSize;
    final boolean legacyStrings;
    // Number of integer fields in front of the bytecode of a code object.
    final int codeIntFields;
    // Code objects with a qualified name and an exception table.
    final boolean localsPlusLayout;

    private Format(
        int headerSize, boolean legacyStrings, int codeIntFields, boolean localsPlusLayout) {
      this.headerSize = headerSize;
      this.legacyStrings = legacyStrings;
      this.codeIntFields = codeIntFields;
      this.localsPlusLayout = localsPlusLayout;
    }

    static Format fromMagic(Origin origin, int magic) throws MalformedCodeUnitException {
      if (magic >= 62011 && magic <= 62211) {
        return new Format(8, true, 4, false);
      }
      if (magic >= 3000 && magic < 3190) {
        return new Format(8, false, 5, false);
      }
      if (magic >= 3190 && magic < 3390) {
        return new Format(12, false, 5, false);
      }
      if (magic >= 3390 && magic < 3410) {
        return new Format(16, false, 5, false);
      }
      if (magic >= 3410 && magic < 3450) {
        return new Format(16, false, 6, false);
      }
      if (magic >= 3450 && magic < 4000) {
        return new Format(16, false, 5, true);
      }
      throw new MalformedCodeUnitException(
          origin, "Unsupported compiled module version (magic " + magic + ")");
    }
  }

  private static class CodeObject {

    final String name;
    final List<Object> consts;
    final List<Object> names;

    CodeObject(String name, List<Object> consts, List<Object> names) {
      this.name = name;
      this.consts = consts;
      this.names = names;
    }
  }

  private static class MarshalReader {

    private final Origin origin;
    private final ByteBuffer buffer;
    private final Format format;
    private final List<Object> refs = new ArrayList<>();
    private final List<String> interned = new ArrayList<>();

    MarshalReader(Origin origin, ByteBuffer buffer, Format format) {
      this.origin = origin;
      this.buffer = buffer;
      this.format = format;
    }

    Object readObject(int depth) throws MalformedCodeUnitException {
      if (depth > MAX_DEPTH) {
        throw malformed("Marshal data nested too deeply");
      }
      int code = readByte();
      if ((code & FLAG_REF) == 0) {
        return readValue((char) code, depth);
      }
      int index = refs.size();
      refs.add(null);
      Object value = readValue((char) (code & ~FLAG_REF), depth);
      refs.set(index, value);
      return value;
    }

    private Object readValue(char type, int depth) throws MalformedCodeUnitException {
      switch (type) {
        case '0':
          return NULL;
        case 'N':
        case 'F':
        case 'T':
        case 'S':
        case '.':
          return OTHER;
        case 'i':
          skip(4);
          return OTHER;
        case 'I':
        case 'g':
          skip(8);
          return OTHER;
        case 'y':
          skip(16);
          return OTHER;
        case 'l':
          skip(2 * Math.abs((long) readInt()));
          return OTHER;
        case 'f':
          skip(readByte());
          return OTHER;
        case 'x':
          skip(readByte());
          skip(readByte());
          return OTHER;
        case 's':
          if (format.legacyStrings) {
            return readString(readSize(), StandardCharsets.ISO_8859_1);
          }
          skip(readSize());
          return OTHER;
        case 't':
          if (format.legacyStrings) {
            String string = readString(readSize(), StandardCharsets.ISO_8859_1);
            interned.add(string);
            return string;
          }
          return readString(readSize(), StandardCharsets.UTF_8);
        case 'R':
          return lookup(interned, readInt());
        case 'u':
          return readString(readSize(), StandardCharsets.UTF_8);
        case 'a':
        case 'A':
          return readString(readSize(), StandardCharsets.US_ASCII);
        case 'z':
        case 'Z':
          return readString(readByte(), StandardCharsets.US_ASCII);
        case '(':
        case '[':
        case '<':
        case '>':
          return readSequence(readSize(), depth);
        case ')':
          return readSequence(readByte(), depth);
        case '{':
          return readDict(depth);
        case 'c':
          return readCode(depth);
        case 'r':
          return lookup(refs, readInt());
        default:
          throw malformed("Unknown marshal type 0x" + Integer.toHexString(type));
      }
    }

    private List<Object> readSequence(int size, int depth) throws MalformedCodeUnitException {
      List<Object> elements = new ArrayList<>(Math.min(size, buffer.remaining()));
      for (int i = 0; i < size; i++) {
        elements.add(readObject(depth + 1));
      }
      return elements;
    }

    // Only the values are kept, the keys are names of the dict layout.
    private List<Object> readDict(int depth) throws MalformedCodeUnitException {
      List<Object> values = new ArrayList<>();
      while (readObject(depth + 1) != NULL) {
        values.add(readObject(depth + 1));
      }
      return values;
    }

    private CodeObject readCode(int depth) throws MalformedCodeUnitException {
      skip(4L * format.codeIntFields);
      readObject(depth + 1); // bytecode
      Object consts = readObject(depth + 1);
      Object names = readObject(depth + 1);
      if (format.localsPlusLayout) {
        readObject(depth + 1); // local names
        readObject(depth + 1); // local kinds
      } else {
        readObject(depth + 1); // varnames
        readObject(depth + 1); // freevars
        readObject(depth + 1); // cellvars
      }
      readObject(depth + 1); // filename
      Object name = readObject(depth + 1);
      if (format.localsPlusLayout) {
        readObject(depth + 1); // qualified name
      }
      skip(4); // first line number
      readObject(depth + 1); // line table
      if (format.localsPlusLayout) {
        readObject(depth + 1); // exception table
      }
      if (!(consts instanceof List) || !(names instanceof List)) {
        throw malformed("Invalid code object");
      }
      @SuppressWarnings("unchecked")
      CodeObject result =
          new CodeObject(
              name instanceof String ? (String) name : "<code>",
              (List<Object>) consts,
              (List<Object>) names);
      return result;
    }

    private <T> T lookup(List<T> list, int index) throws MalformedCodeUnitException {
      if (index < 0 || index >= list.size()) {
        throw malformed("Invalid marshal back reference " + index);
      }
      return list.get(index);
    }

    private String readString(int size, Charset charset) throws MalformedCodeUnitException {
      require(size);
      ByteBuffer slice = buffer.slice();
      slice.limit(size);
      buffer.position(buffer.position() + size);
      try {
        return charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(slice)
            .toString();
      } catch (CharacterCodingException e) {
        throw new MalformedCodeUnitException(origin, "Invalid " + charset.name() + " string", e);
      }
    }

    private int readByte() throws MalformedCodeUnitException {
      require(1);
      return buffer.get() & 0xff;
    }

    private int readInt() throws MalformedCodeUnitException {
      require(4);
      return buffer.getInt();
    }

    private int readSize() throws MalformedCodeUnitException {
      int size = readInt();
      if (size < 0) {
        throw malformed("Negative marshal size " + size);
      }
      return size;
    }

    private void skip(long size) throws MalformedCodeUnitException {
      require(size);
      buffer.position(buffer.position() + (int) size);
    }

    private void require(long size) throws MalformedCodeUnitException {
      if (size > buffer.remaining()) {
        throw malformed("Truncated marshal data");
      }
    }

    private MalformedCodeUnitException malformed(String message) {
      return new MalformedCodeUnitException(origin, message);
    }
  }
}
