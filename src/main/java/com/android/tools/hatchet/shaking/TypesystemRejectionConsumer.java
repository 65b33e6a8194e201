// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.shaking;

import com.android.tools.hatchet.DiagnosticsHandler;
import com.android.tools.hatchet.StringConsumer;
import com.android.tools.hatchet.shaking.RejectionRecord.MemberRejection;
import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;

/**
 * Writes rejections as a typesystem document for the binding generator.
 *
 * <pre>
 * &lt;typesystem package="PySide.QtGui"&gt;
 *   &lt;rejection class="QAccessibleEvent"/&gt;
 *   &lt;rejection class="QApplication" function-name="applicationDirPath"/&gt;
 * &lt;/typesystem&gt;
 * </pre>
 *
 * <p>A member of unknown kind is rejected both as a function and as a field.
 */
public class TypesystemRejectionConsumer implements RejectionConsumer {

  private static final Escaper ESCAPER = XmlEscapers.xmlAttributeEscaper();

  private final String packageName;
  private final StringConsumer output;
  private boolean started = false;

  public TypesystemRejectionConsumer(String packageName, StringConsumer output) {
    this.packageName = packageName;
    this.output = output;
  }

  private void ensureStarted(DiagnosticsHandler handler) {
    if (!started) {
      started = true;
      output.accept("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n", handler);
      output.accept("<typesystem package=\"" + ESCAPER.escape(packageName) + "\">\n", handler);
    }
  }

  @Override
  public void accept(RejectionRecord record, DiagnosticsHandler handler) {
    ensureStarted(handler);
    if (record.isTypeRejection()) {
      writeRejection(record.getType(), null, null, handler);
      return;
    }
    MemberRejection rejection = record.asMemberRejection();
    switch (rejection.getKind()) {
      case FIELD:
        writeRejection(rejection.getType(), "field-name", rejection.getMember(), handler);
        break;
      case FUNCTION:
        writeRejection(rejection.getType(), "function-name", rejection.getMember(), handler);
        break;
      default:
        writeRejection(rejection.getType(), "function-name", rejection.getMember(), handler);
        writeRejection(rejection.getType(), "field-name", rejection.getMember(), handler);
        break;
    }
  }

  private void writeRejection(
      String type, String memberAttribute, String member, DiagnosticsHandler handler) {
    StringBuilder builder = new StringBuilder("  <rejection class=\"");
    builder.append(ESCAPER.escape(type)).append('"');
    if (memberAttribute != null) {
      builder.append(' ').append(memberAttribute).append("=\"");
      builder.append(ESCAPER.escape(member)).append('"');
    }
    builder.append("/>\n");
    output.accept(builder.toString(), handler);
  }

  @Override
  public void finished(DiagnosticsHandler handler) {
    ensureStarted(handler);
    output.accept("</typesystem>\n", handler);
    output.finished(handler);
  }
}
