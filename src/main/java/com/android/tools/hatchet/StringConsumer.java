// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.origin.PathOrigin;
import com.android.tools.hatchet.utils.ExceptionDiagnostic;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Interface for receiving String resource. */
public interface StringConsumer {

  /**
   * Callback to receive a String resource.
   *
   * <p>The consumer may receive the string in several chunks. The chunks are received in order.
   *
   * @param string String resource.
   * @param handler Diagnostics handler for reporting.
   */
  void accept(String string, DiagnosticsHandler handler);

  /**
   * Callback signifying that the last chunk has been received.
   *
   * @param handler Diagnostics handler for reporting.
   */
  default void finished(DiagnosticsHandler handler) {}

  /** File consumer to write contents to a file-system file. */
  class FileConsumer implements StringConsumer {

    private final Path outputPath;
    private final StringBuilder builder = new StringBuilder();

    public FileConsumer(Path outputPath) {
      this.outputPath = outputPath;
    }

    @Override
    public void accept(String string, DiagnosticsHandler handler) {
      builder.append(string);
    }

    @Override
    public void finished(DiagnosticsHandler handler) {
      Origin origin = new PathOrigin(outputPath);
      try {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
          Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
          writer.write(builder.toString());
        }
      } catch (IOException e) {
        handler.error(new ExceptionDiagnostic(e, origin));
      }
    }
  }
}
