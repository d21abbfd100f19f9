package io.github.cryptoinspector.exception;

/**
 * A forensic package is structurally unusable: a required member is absent or cannot be parsed.
 */
public class ArchiveFormatException extends EvidenceException {

  public ArchiveFormatException(final String message) {
    super(message);
  }

  public ArchiveFormatException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
