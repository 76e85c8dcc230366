package io.github.panghy.discovery.search;

/**
 * Both retrieval paths failed, as opposed to a search that simply found nothing.
 */
public class SearchFailedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SearchFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
