package ca.gc.cra.landsat.infrastructure.archive;

/**
 * Container formats recognized by {@link SniffingArchiveOpener}.
 *
 * @since 0.1.0
 */
public enum ArchiveFormat {
  /** PKZIP container. */
  ZIP,
  /** Uncompressed POSIX/GNU tar. */
  TAR,
  /** Tar wrapped in gzip ({@code .tar.gz}, {@code .tgz}). */
  TAR_GZIP,
  /** Tar wrapped in bzip2 ({@code .tar.bz2}). */
  TAR_BZIP2
}
