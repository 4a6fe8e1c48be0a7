package ca.gc.cra.landsat.infrastructure.archive;

import ca.gc.cra.landsat.application.port.ArchiveOpener;
import ca.gc.cra.landsat.application.port.ArchiveReader;
import ca.gc.cra.landsat.domain.error.UnsupportedSourceException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarUtils;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArchiveOpener} that recognizes zip and tar containers from their leading bytes.
 * <p><strong>Why:</strong> Landsat downloads are frequently renamed, so file extensions cannot be trusted.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match zip local-file signatures and tar headers: {@code ustar}/GNU magic, or a valid header checksum for
 *   pre-POSIX (v7) archives that carry no magic.</li>
 *   <li>Look through gzip and bzip2 wrappers for a tar header.</li>
 *   <li>Open the matching {@link ArchiveReader}; the format is decided once, here.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Reads at most one tar record (512 bytes) of decompressed content per check.</p>
 *
 * @since 0.1.0
 */
public final class SniffingArchiveOpener implements ArchiveOpener {
  private static final Logger log = LoggerFactory.getLogger(SniffingArchiveOpener.class);
  private static final int TAR_RECORD = 512;
  private static final int COMPRESSION_SIGNATURE = 4;

  @Override
  public boolean isArchive(Path file) {
    try {
      return detect(file).isPresent();
    } catch (IOException ex) {
      log.debug("Unable to sniff {} as archive: {}", file, ex.getMessage());
      return false;
    }
  }

  @Override
  public ArchiveReader open(Path file) throws IOException {
    ArchiveFormat format = detect(file)
        .orElseThrow(() -> new UnsupportedSourceException("Unsupported archive file " + file));
    log.debug("Opening {} as {}", file, format);
    return format == ArchiveFormat.ZIP ? new ZipArchiveReader(file) : new TarArchiveReader(file, format);
  }

  /**
   * Determines the container format of a file from its content.
   *
   * @param file candidate archive
   * @return detected format, or empty when the file is not a supported container
   * @throws IOException if the file exists but cannot be read
   */
  public Optional<ArchiveFormat> detect(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    byte[] header = readHeader(file);
    if (ZipArchiveInputStream.matches(header, header.length)) {
      return Optional.of(ArchiveFormat.ZIP);
    }
    if (looksLikeTar(header)) {
      return Optional.of(ArchiveFormat.TAR);
    }
    if (GzipCompressorInputStream.matches(header, Math.min(header.length, COMPRESSION_SIGNATURE))
        && wrapsTar(file, ArchiveFormat.TAR_GZIP)) {
      return Optional.of(ArchiveFormat.TAR_GZIP);
    }
    if (BZip2CompressorInputStream.matches(header, Math.min(header.length, COMPRESSION_SIGNATURE))
        && wrapsTar(file, ArchiveFormat.TAR_BZIP2)) {
      return Optional.of(ArchiveFormat.TAR_BZIP2);
    }
    return Optional.empty();
  }

  private static byte[] readHeader(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return in.readNBytes(TAR_RECORD);
    }
  }

  private static boolean wrapsTar(Path file, ArchiveFormat format) throws IOException {
    try (InputStream raw = new BufferedInputStream(Files.newInputStream(file));
         InputStream in = format == ArchiveFormat.TAR_GZIP
             ? new GzipCompressorInputStream(raw)
             : new BZip2CompressorInputStream(raw)) {
      byte[] record = in.readNBytes(TAR_RECORD);
      return looksLikeTar(record);
    } catch (IOException ex) {
      log.debug("{} looks like {} but does not decompress: {}", file, format, ex.getMessage());
      return false;
    }
  }

  static boolean looksLikeTar(byte[] record) {
    if (TarArchiveInputStream.matches(record, record.length)) {
      return true;
    }
    if (record.length < TAR_RECORD || record[0] == 0) {
      return false;
    }
    try {
      return TarUtils.verifyCheckSum(record);
    } catch (IllegalArgumentException ex) {
      log.debug("Header checksum field is not octal: {}", ex.getMessage());
      return false;
    }
  }
}
