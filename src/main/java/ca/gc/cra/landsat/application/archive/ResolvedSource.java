package ca.gc.cra.landsat.application.archive;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of source classification: where the MTL file is and which directory band files are relative to.
 *
 * @param kind how the source was classified
 * @param baseDirectory directory that band file names resolve against
 * @param metadataFile located MTL file
 * @since 0.1.0
 */
public record ResolvedSource(SourceKind kind, Path baseDirectory, Path metadataFile) {
  public ResolvedSource {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(baseDirectory, "baseDirectory");
    Objects.requireNonNull(metadataFile, "metadataFile");
  }
}
