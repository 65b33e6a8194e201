// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.catalog.TypeCatalog;
import com.android.tools.hatchet.harvest.IdentifierHarvester;
import com.android.tools.hatchet.harvest.IdentifierSet;
import com.android.tools.hatchet.shaking.Enqueuer;
import com.android.tools.hatchet.shaking.KeepPolicy;
import com.android.tools.hatchet.shaking.ReachabilityResult;
import com.android.tools.hatchet.shaking.RejectionCollector;
import com.android.tools.hatchet.shaking.RejectionConsumer;
import com.android.tools.hatchet.shaking.RejectionEmitter;
import com.android.tools.hatchet.shaking.RejectionRecord;
import com.android.tools.hatchet.utils.ExceptionUtils;
import com.android.tools.hatchet.utils.Reporter;
import com.android.tools.hatchet.utils.StringDiagnostic;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds the types and members of a binding layer that an application does not use.
 *
 * <p>The analysis harvests the identifiers of the application, computes the useful binding types
 * from them and the keep policy, and reports everything else as a rejection.
 */
public class Hatchet {

  private static void run(
      List<Path> roots,
      IdentifierHarvester harvester,
      TypeCatalog catalog,
      KeepPolicy policy,
      RejectionConsumer consumer,
      HatchetOptions options) {
    Reporter reporter = options.reporter;
    for (Path root : roots) {
      harvester.addPath(root);
    }
    if (reporter.hasErrors()) {
      return;
    }
    IdentifierSet identifiers = harvester.build();
    reporter.info(
        new StringDiagnostic(
            "Harvested "
                + identifiers.size()
                + " identifiers from "
                + harvester.getCodeUnitCount()
                + " code units"));
    ReachabilityResult result =
        new Enqueuer(catalog, policy, identifiers, options).traceApplication();
    RejectionCollector collector = new RejectionCollector(consumer);
    new RejectionEmitter(catalog, result).emit(collector, reporter);
    reporter.info(
        new StringDiagnostic(
            "Rejecting "
                + collector.getTypeRejectionCount()
                + " types and "
                + collector.getMemberRejectionCount()
                + " members"));
  }

  public static void run(HatchetCommand command) throws HatchetFailedException {
    HatchetOptions options = command.getInternalOptions();
    ExceptionUtils.withHatchetHandler(
        options.reporter,
        () ->
            run(
                command.getApplicationRoots(),
                new IdentifierHarvester(command.getCodeUnitReaders(), options.reporter),
                command.getTypeCatalog(),
                command.getKeepPolicy(),
                command.getRejectionConsumer(),
                options));
  }

  /** Computes the rejections for already harvested identifiers. */
  public static List<RejectionRecord> computeRejections(
      TypeCatalog catalog, KeepPolicy policy, IdentifierSet identifiers, DiagnosticsHandler handler)
      throws HatchetFailedException {
    HatchetOptions options = new HatchetOptions(new Reporter(handler));
    RejectionCollector collector = new RejectionCollector();
    ExceptionUtils.withHatchetHandler(
        options.reporter,
        () -> {
          ReachabilityResult result =
              new Enqueuer(catalog, policy, identifiers, options).traceApplication();
          new RejectionEmitter(catalog, result).emit(collector, options.reporter);
        });
    return collector.getRecords();
  }
}
