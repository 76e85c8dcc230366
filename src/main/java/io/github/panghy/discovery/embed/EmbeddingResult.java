package io.github.panghy.discovery.embed;

/**
 * Outcome of embedding one text of a batch: exactly one of {@code vector} and {@code error} is
 * non-null.
 */
public record EmbeddingResult(float[] vector, EmbeddingException error) {

  public static EmbeddingResult success(float[] vector) {
    return new EmbeddingResult(vector, null);
  }

  public static EmbeddingResult failure(EmbeddingException error) {
    return new EmbeddingResult(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
