package io.github.cryptoinspector.exception;

/**
 * Base of the evidence core's unchecked exceptions. I/O failures are reported as
 * {@link java.io.IOException} and are not part of this hierarchy.
 */
public class EvidenceException extends RuntimeException {

  public EvidenceException(final String message) {
    super(message);
  }

  public EvidenceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
