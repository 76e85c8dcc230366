package io.github.panghy.discovery.api;

/**
 * Black-box sentence encoder supplied by the surrounding application.
 *
 * <p>The engine never loads or owns a model; it receives an encoder handle at construction so
 * tests can substitute a deterministic stub. Implementations must be thread-safe for up to
 * {@code embeddingConcurrency} concurrent calls.</p>
 */
public interface TextEncoder {

  /**
   * Encodes already-prepared text into a vector.
   *
   * @param text cleaned, non-empty input
   * @return the embedding; its length must equal the configured dimension
   */
  float[] encode(String text);

  /**
   * Whether the underlying model is loaded and ready. Defaults to {@code true}.
   */
  default boolean isAvailable() {
    return true;
  }
}
