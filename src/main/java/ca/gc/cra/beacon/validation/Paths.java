package ca.gc.cra.beacon.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for Beacon log directories and log files.
 * <p><strong>Why:</strong> File handlers must write into existing, writable directories; creating them up front
 * turns a late appender start failure into a clear configuration error.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked log directory is validated as the link
 *     itself would be resolved by the OS.
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable log directory, creating it and any parents when missing.
   *
   * @param path candidate directory; must not be {@code null}
   * @return canonical directory path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or cannot be created
   */
  public static Path ensureWritableDir(Path path) {
    Path normalized = normalize("directory", path);
    try {
      if (!Files.exists(normalized)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a log file target and ensures its parent directory exists.
   *
   * @param file candidate log file; must not be {@code null}
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the path is malformed, names an existing directory, or its parent cannot be
   *     prepared
   */
  public static Path ensureLogFile(Path file) {
    Path normalized = normalize("file", file);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("log file path is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("log file has no parent directory: " + normalized);
    }
    Path realParent = ensureWritableDir(parent);
    return realParent.resolve(normalized.getFileName());
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
