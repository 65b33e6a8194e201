// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.origin.PathOrigin;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads documentation pages from a local mirror of the documentation. */
public class DirectoryDocumentationSource implements DocumentationSource {

  private final Path root;

  public DirectoryDocumentationSource(Path root) {
    this.root = root;
  }

  public Path getRoot() {
    return root;
  }

  @Override
  public String readPage(String name) throws IOException {
    Path page = root.resolve(name);
    if (!Files.isRegularFile(page)) {
      return null;
    }
    return new String(Files.readAllBytes(page), StandardCharsets.UTF_8);
  }

  @Override
  public Origin getOrigin(String name) {
    return new PathOrigin(root.resolve(name));
  }
}
