// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.position;

/** A line and column position in a text resource. Both are 1-based. */
public class TextPosition implements Position {

  private final int line;
  private final int column;

  public TextPosition(int line, int column) {
    assert line >= 1;
    assert column >= 1;
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String getDescription() {
    return "line " + line + ", column " + column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TextPosition)) {
      return false;
    }
    TextPosition other = (TextPosition) o;
    return line == other.line && column == other.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
