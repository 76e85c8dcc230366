package io.github.panghy.discovery.embed;

/**
 * Raised when text cannot be turned into an embedding.
 */
public class EmbeddingException extends Exception {

  /** Failure category. */
  public enum Kind {
    /** Nothing left to embed after text preparation. */
    EMPTY_INPUT,
    /** The encoder reports itself unavailable. */
    MODEL_UNAVAILABLE,
    /** The encoder threw or returned an unusable vector. */
    INFERENCE_FAILED
  }

  private final Kind kind;

  public EmbeddingException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public EmbeddingException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
