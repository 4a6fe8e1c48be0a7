package ca.gc.cra.landsat.application.archive;

/**
 * Classification of a source handed to the resolver.
 *
 * @since 0.1.0
 */
public enum SourceKind {
  /** Directory holding the MTL file and band files. */
  DIRECTORY,
  /** The MTL text file itself. */
  METADATA_FILE,
  /** Zip or tar container extracted before parsing. */
  ARCHIVE
}
