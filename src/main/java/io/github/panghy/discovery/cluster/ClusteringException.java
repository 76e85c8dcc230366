package io.github.panghy.discovery.cluster;

/**
 * A clustering pass aborted before committing; the previous cluster assignment is untouched.
 */
public class ClusteringException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ClusteringException(String message) {
    super(message);
  }

  public ClusteringException(String message, Throwable cause) {
    super(message, cause);
  }
}
