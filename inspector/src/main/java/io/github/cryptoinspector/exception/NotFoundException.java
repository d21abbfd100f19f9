package io.github.cryptoinspector.exception;

/**
 * A case, artifact or report that an operation names does not exist.
 */
public class NotFoundException extends EvidenceException {

  public NotFoundException(final String message) {
    super(message);
  }
}
