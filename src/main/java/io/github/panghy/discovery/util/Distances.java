package io.github.panghy.discovery.util;

import java.util.Collection;

/**
 * Basic similarity and vector arithmetic utilities shared by the index and the cluster engine.
 */
public final class Distances {
  private Distances() {}

  /**
   * Computes dot product between two vectors.
   *
   * @param a vector A
   * @param b vector B (must be same length as A)
   * @return dot product value
   */
  public static double dot(float[] a, float[] b) {
    double s = 0.0;
    for (int i = 0; i < a.length; i++) s += (double) a[i] * b[i];
    return s;
  }

  /**
   * Computes Euclidean norm of a vector.
   *
   * @param a vector
   * @return sqrt(sum(x^2))
   */
  public static double norm(float[] a) {
    double s = 0.0;
    for (float v : a) s += (double) v * v;
    return Math.sqrt(s);
  }

  /**
   * Computes cosine similarity for two vectors in R^n.
   *
   * @param a vector A
   * @param b vector B
   * @return cosine similarity in [-1, 1] (0 if either has zero norm)
   */
  public static double cosine(float[] a, float[] b) {
    double n = norm(a) * norm(b);
    if (n == 0.0) return 0.0;
    return dot(a, b) / n;
  }

  /**
   * Cosine similarity when both norms are already known.
   */
  public static double cosine(float[] a, double normA, float[] b, double normB) {
    double n = normA * normB;
    if (n == 0.0) return 0.0;
    return dot(a, b) / n;
  }

  /**
   * Element-wise mean of a non-empty collection of equally sized vectors.
   *
   * @param vectors vectors to average
   * @return a new vector holding the mean
   * @throws IllegalArgumentException if the collection is empty or lengths differ
   */
  public static float[] mean(Collection<float[]> vectors) {
    if (vectors.isEmpty()) throw new IllegalArgumentException("vectors must not be empty");
    int dim = -1;
    double[] acc = null;
    for (float[] v : vectors) {
      if (acc == null) {
        dim = v.length;
        acc = new double[dim];
      } else if (v.length != dim) {
        throw new IllegalArgumentException("vector length " + v.length + " != " + dim);
      }
      for (int i = 0; i < dim; i++) acc[i] += v[i];
    }
    float[] out = new float[dim];
    int n = vectors.size();
    for (int i = 0; i < dim; i++) out[i] = (float) (acc[i] / n);
    return out;
  }
}
