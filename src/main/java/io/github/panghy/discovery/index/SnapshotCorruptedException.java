package io.github.panghy.discovery.index;

/**
 * Thrown when an index snapshot cannot be read back: truncated, failing its checksum, of an
 * unknown format version, or built with parameters that do not match the current configuration.
 * Callers recover by rebuilding the index from the item store.
 */
public class SnapshotCorruptedException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new SnapshotCorruptedException with the specified message.
   *
   * @param message the detail message
   */
  public SnapshotCorruptedException(String message) {
    super(message);
  }

  /**
   * Creates a new SnapshotCorruptedException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public SnapshotCorruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
