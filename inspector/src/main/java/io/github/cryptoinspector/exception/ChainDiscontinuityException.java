package io.github.cryptoinspector.exception;

/**
 * An audit event's previous-hash does not equal its predecessor's chain hash.
 */
public class ChainDiscontinuityException extends EvidenceException {

  public ChainDiscontinuityException(final String message) {
    super(message);
  }
}
