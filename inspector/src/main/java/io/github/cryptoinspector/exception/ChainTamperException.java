package io.github.cryptoinspector.exception;

/**
 * An audit event's chain hash does not match the recomputation over its own fields.
 */
public class ChainTamperException extends EvidenceException {

  public ChainTamperException(final String message) {
    super(message);
  }
}
