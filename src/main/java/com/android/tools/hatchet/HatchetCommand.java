// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet;

import com.android.tools.hatchet.catalog.CachingTypeCatalog;
import com.android.tools.hatchet.catalog.TypeCatalog;
import com.android.tools.hatchet.catalog.TypeCatalogSource;
import com.android.tools.hatchet.harvest.CodeUnitReader;
import com.android.tools.hatchet.harvest.IdentifierHarvester;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.shaking.KeepPolicy;
import com.android.tools.hatchet.shaking.KeepPolicyParser;
import com.android.tools.hatchet.shaking.RejectionConsumer;
import com.android.tools.hatchet.shaking.TypesystemRejectionConsumer;
import com.android.tools.hatchet.utils.Reporter;
import com.android.tools.hatchet.utils.StringDiagnostic;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Immutable command structure for an invocation of the {@link Hatchet} analysis. */
public class HatchetCommand {

  private final List<Path> applicationRoots;
  private final List<CodeUnitReader> codeUnitReaders;
  private final TypeCatalog catalog;
  private final KeepPolicy keepPolicy;
  private final RejectionConsumer rejectionConsumer;
  private final Boolean traceUsefulTypes;
  private final Reporter reporter;

  public static class Builder {

    private final Reporter reporter;
    private final List<Path> applicationRoots = new ArrayList<>();
    private List<CodeUnitReader> codeUnitReaders = IdentifierHarvester.defaultReaders();
    private TypeCatalog catalog = null;
    private TypeCatalogSource catalogSource = null;
    private boolean useDefaultKeepPolicy = true;
    private final KeepPolicy.Builder keepPolicy = KeepPolicy.builder();
    private final KeepPolicyParser keepPolicyParser;
    private RejectionConsumer rejectionConsumer = null;
    private Boolean traceUsefulTypes = null;

    private Builder(DiagnosticsHandler diagnosticsHandler) {
      this.reporter = new Reporter(diagnosticsHandler);
      this.keepPolicyParser = new KeepPolicyParser(reporter);
    }

    public Reporter getReporter() {
      return reporter;
    }

    /** Add directories, archives or single files with the code of the application. */
    public Builder addApplicationRoots(Path... roots) {
      return addApplicationRoots(Arrays.asList(roots));
    }

    public Builder addApplicationRoots(Collection<Path> roots) {
      applicationRoots.addAll(roots);
      return this;
    }

    /** Replace the readers used to recognize the application's code units. */
    public Builder setCodeUnitReaders(List<CodeUnitReader> readers) {
      this.codeUnitReaders = readers;
      return this;
    }

    public Builder setTypeCatalog(TypeCatalog catalog) {
      this.catalog = catalog;
      return this;
    }

    /** Set the backend of the type catalog. Its answers are cached for the run. */
    public Builder setTypeCatalogSource(TypeCatalogSource catalogSource) {
      this.catalogSource = catalogSource;
      return this;
    }

    /** Whether the rules needed by the toolkit's own runtime are used. Defaults to true. */
    public Builder setUseDefaultKeepPolicy(boolean useDefaultKeepPolicy) {
      this.useDefaultKeepPolicy = useDefaultKeepPolicy;
      return this;
    }

    public Builder addKeepPolicy(KeepPolicy policy) {
      keepPolicy.addAll(policy);
      return this;
    }

    /** Add files with keep policy rules. Errors are reported when the command is built. */
    public Builder addKeepPolicyFiles(Path... paths) {
      for (Path path : paths) {
        try {
          keepPolicyParser.parse(path);
        } catch (HatchetFailedException e) {
          // The parser has reported the errors.
          assert reporter.hasErrors();
        }
      }
      return this;
    }

    public Builder addKeepPolicyRules(String rules, Origin origin) {
      try {
        keepPolicyParser.parse(rules, origin);
      } catch (HatchetFailedException e) {
        // The parser has reported the errors.
        assert reporter.hasErrors();
      }
      return this;
    }

    public Builder setRejectionConsumer(RejectionConsumer rejectionConsumer) {
      this.rejectionConsumer = rejectionConsumer;
      return this;
    }

    /** Write the rejections as a typesystem document for the given binding package. */
    public Builder setTypesystemOutputPath(Path outputPath, String packageName) {
      return setRejectionConsumer(
          new TypesystemRejectionConsumer(
              packageName, new StringConsumer.FileConsumer(outputPath)));
    }

    /** Overrides the tracing default of {@link HatchetOptions}. */
    public Builder setTraceUsefulTypes(boolean traceUsefulTypes) {
      this.traceUsefulTypes = traceUsefulTypes;
      return this;
    }

    private void validate() {
      if (catalog == null && catalogSource == null) {
        reporter.error(new StringDiagnostic("A type catalog is required"));
      } else if (catalog != null && catalogSource != null) {
        reporter.error(
            new StringDiagnostic(
                "Only one of a type catalog and a type catalog source is allowed"));
      }
      if (rejectionConsumer == null) {
        reporter.error(new StringDiagnostic("A rejection consumer is required"));
      }
    }

    public HatchetCommand build() throws HatchetFailedException {
      validate();
      reporter.failIfPendingErrors();
      if (useDefaultKeepPolicy) {
        keepPolicy.addAll(KeepPolicy.defaultPolicy());
      }
      keepPolicy.addAll(keepPolicyParser.getPolicy());
      return new HatchetCommand(
          ImmutableList.copyOf(applicationRoots),
          ImmutableList.copyOf(codeUnitReaders),
          catalog != null ? catalog : new CachingTypeCatalog(catalogSource, reporter),
          keepPolicy.build(),
          rejectionConsumer,
          traceUsefulTypes,
          reporter);
    }
  }

  public static Builder builder() {
    return new Builder(new DiagnosticsHandler() {});
  }

  public static Builder builder(DiagnosticsHandler diagnosticsHandler) {
    return new Builder(diagnosticsHandler);
  }

  private HatchetCommand(
      List<Path> applicationRoots,
      List<CodeUnitReader> codeUnitReaders,
      TypeCatalog catalog,
      KeepPolicy keepPolicy,
      RejectionConsumer rejectionConsumer,
      Boolean traceUsefulTypes,
      Reporter reporter) {
    this.applicationRoots = applicationRoots;
    this.codeUnitReaders = codeUnitReaders;
    this.catalog = catalog;
    this.keepPolicy = keepPolicy;
    this.rejectionConsumer = rejectionConsumer;
    this.traceUsefulTypes = traceUsefulTypes;
    this.reporter = reporter;
  }

  public List<Path> getApplicationRoots() {
    return applicationRoots;
  }

  public List<CodeUnitReader> getCodeUnitReaders() {
    return codeUnitReaders;
  }

  public TypeCatalog getTypeCatalog() {
    return catalog;
  }

  public KeepPolicy getKeepPolicy() {
    return keepPolicy;
  }

  public RejectionConsumer getRejectionConsumer() {
    return rejectionConsumer;
  }

  Reporter getReporter() {
    return reporter;
  }

  HatchetOptions getInternalOptions() {
    HatchetOptions options = new HatchetOptions(reporter);
    if (traceUsefulTypes != null) {
      options.traceUsefulTypes = traceUsefulTypes;
    }
    return options;
  }
}
