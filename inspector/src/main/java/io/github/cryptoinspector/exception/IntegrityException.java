package io.github.cryptoinspector.exception;

/**
 * Recomputed content hash of an artifact or archive entry does not match the recorded one.
 */
public class IntegrityException extends EvidenceException {

  public IntegrityException(final String message) {
    super(message);
  }
}
