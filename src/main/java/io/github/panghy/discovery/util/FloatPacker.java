package io.github.panghy.discovery.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs float32 vectors to little-endian bytes and back.
 *
 * <p>The index snapshot stores every vector through this class so the on-disk layout does not
 * depend on the platform byte order.</p>
 */
public final class FloatPacker {
  private FloatPacker() {}

  /**
   * Packs a float array into a little-endian byte array (4 bytes per element).
   *
   * @param arr the float array to pack (must not be null)
   * @return a new byte array containing the packed floats
   */
  public static byte[] floatsToBytes(float[] arr) {
    ByteBuffer bb = ByteBuffer.allocate(arr.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (float v : arr) bb.putFloat(v);
    return bb.array();
  }

  /**
   * Unpacks a little-endian byte array into a float array of the expected length.
   *
   * @param bytes          packed floats
   * @param expectedLength number of floats the caller expects
   * @return the unpacked vector
   * @throws IllegalArgumentException if {@code bytes} does not hold exactly {@code expectedLength} floats
   */
  public static float[] bytesToFloats(byte[] bytes, int expectedLength) {
    if (bytes.length != expectedLength * Float.BYTES) {
      throw new IllegalArgumentException(
          "expected " + expectedLength * Float.BYTES + " bytes but got " + bytes.length);
    }
    ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    float[] out = new float[expectedLength];
    for (int i = 0; i < expectedLength; i++) out[i] = bb.getFloat();
    return out;
  }
}
