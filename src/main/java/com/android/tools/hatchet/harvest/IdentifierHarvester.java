// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.diagnostic.UnreadableCodeUnitDiagnostic;
import com.android.tools.hatchet.origin.ArchiveEntryOrigin;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.origin.PathOrigin;
import com.android.tools.hatchet.utils.FileUtils;
import com.android.tools.hatchet.utils.IdentifierUtils;
import com.android.tools.hatchet.utils.StringDiagnostic;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Collects the identifiers used by an application.
 *
 * <p>This is a deliberately wide net: all names referenced by the application's code units and all
 * string constants that look like names end up in the result. Names created at runtime are not
 * seen; the keep policy compensates for the known cases.
 *
 * <p>Code units that cannot be read are reported as warnings and skipped.
 */
public class IdentifierHarvester {

  private final List<CodeUnitReader> readers;
  private final DiagnosticsHandler diagnostics;
  private final IdentifierSet.Builder identifiers = IdentifierSet.builder();
  private int codeUnitCount = 0;

  public IdentifierHarvester(DiagnosticsHandler diagnostics) {
    this(defaultReaders(), diagnostics);
  }

  public IdentifierHarvester(List<CodeUnitReader> readers, DiagnosticsHandler diagnostics) {
    this.readers = ImmutableList.copyOf(readers);
    this.diagnostics = diagnostics;
  }

  public static List<CodeUnitReader> defaultReaders() {
    return ImmutableList.of(
        new ScriptSourceCodeUnitReader(), new PycCodeUnitReader(), new ClassFileCodeUnitReader());
  }

  /** Number of top-level code units harvested so far. */
  public int getCodeUnitCount() {
    return codeUnitCount;
  }

  /**
   * Adds a directory, an archive or a single code unit file.
   *
   * <p>Directories are walked recursively in a sorted order. Archives found in directories are
   * added as well. A path that does not exist is reported as an error.
   */
  public IdentifierHarvester addPath(Path path) {
    if (!Files.exists(path)) {
      diagnostics.error(
          new StringDiagnostic("Application root does not exist", new PathOrigin(path)));
    } else if (Files.isDirectory(path)) {
      addDirectory(path);
    } else if (FileUtils.isArchive(path)) {
      addArchive(path);
    } else {
      addFile(path);
    }
    return this;
  }

  private void addDirectory(Path directory) {
    List<Path> files;
    try (Stream<Path> paths = Files.walk(directory)) {
      files = paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      diagnostics.warning(
          new UnreadableCodeUnitDiagnostic(new PathOrigin(directory), e.toString()));
      return;
    }
    for (Path file : files) {
      if (FileUtils.isArchive(file)) {
        addArchive(file);
      } else if (getReader(file.getFileName().toString()) != null) {
        addFile(file);
      }
    }
  }

  private void addFile(Path file) {
    Origin origin = new PathOrigin(file);
    CodeUnitReader reader = getReader(file.getFileName().toString());
    if (reader == null) {
      diagnostics.warning(new UnreadableCodeUnitDiagnostic(origin, "Unsupported file type"));
      return;
    }
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      diagnostics.warning(new UnreadableCodeUnitDiagnostic(origin, e.toString()));
      return;
    }
    addCodeUnit(reader, origin, bytes);
  }

  /** Adds all code units of a zip or jar archive, including those of nested archives. */
  public IdentifierHarvester addArchive(Path archive) {
    Origin origin = new PathOrigin(archive);
    try (InputStream stream = Files.newInputStream(archive)) {
      addArchive(origin, stream);
    } catch (IOException e) {
      diagnostics.warning(new UnreadableCodeUnitDiagnostic(origin, e.toString()));
    }
    return this;
  }

  private void addArchive(Origin origin, InputStream stream) throws IOException {
    ZipInputStream zipStream = new ZipInputStream(stream);
    ZipEntry entry;
    int entryCount = 0;
    while ((entry = zipStream.getNextEntry()) != null) {
      entryCount++;
      String name = entry.getName();
      if (entry.isDirectory()) {
        continue;
      }
      Origin entryOrigin = new ArchiveEntryOrigin(name, origin);
      if (FileUtils.isArchive(name)) {
        byte[] nested = ByteStreams.toByteArray(zipStream);
        try {
          addArchive(entryOrigin, new ByteArrayInputStream(nested));
        } catch (IOException e) {
          diagnostics.warning(new UnreadableCodeUnitDiagnostic(entryOrigin, e.toString()));
        }
        continue;
      }
      CodeUnitReader reader = getReader(name);
      if (reader != null) {
        addCodeUnit(reader, entryOrigin, ByteStreams.toByteArray(zipStream));
      }
    }
    if (entryCount == 0) {
      diagnostics.warning(
          new UnreadableCodeUnitDiagnostic(origin, "Archive is empty or not a zip archive"));
    }
  }

  private void addCodeUnit(CodeUnitReader reader, Origin origin, byte[] bytes) {
    CodeUnit unit;
    try {
      unit = reader.read(origin, bytes);
    } catch (MalformedCodeUnitException e) {
      diagnostics.warning(new UnreadableCodeUnitDiagnostic(e.getOrigin(), e.getMessage()));
      return;
    }
    addCodeUnit(unit);
  }

  /** Adds the identifiers of a code unit and all its nested units. */
  public IdentifierHarvester addCodeUnit(CodeUnit unit) {
    codeUnitCount++;
    Deque<CodeUnit> worklist = new ArrayDeque<>();
    worklist.add(unit);
    while (!worklist.isEmpty()) {
      CodeUnit current = worklist.removeFirst();
      identifiers.addAll(current.getReferencedNames());
      for (String constant : current.getStringConstants()) {
        if (IdentifierUtils.isIdentifier(constant)) {
          identifiers.add(constant);
        }
      }
      worklist.addAll(current.getNestedUnits());
    }
    return this;
  }

  private CodeUnitReader getReader(String fileName) {
    for (CodeUnitReader reader : readers) {
      if (reader.accepts(fileName)) {
        return reader;
      }
    }
    return null;
  }

  public IdentifierSet build() {
    return identifiers.build();
  }
}
