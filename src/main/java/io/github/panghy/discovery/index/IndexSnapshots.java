package io.github.panghy.discovery.index;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.util.FloatPacker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes single-file index snapshots.
 *
 * <p>Layout: fixed32 magic, varint format version, fixed64 CRC32 of the body, then the
 * length-prefixed body. The body holds the build parameters, node count, entry slot and top
 * level, then for every slot: item id, level, tombstone flag, little-endian float32 vector bytes
 * and the adjacency of each layer.</p>
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so a crash mid-save
 * leaves the previous snapshot intact.</p>
 */
public final class IndexSnapshots {
  private static final Logger LOGGER = LoggerFactory.getLogger(IndexSnapshots.class);

  /** "HNSW" in ASCII. */
  static final int MAGIC = 0x484E5357;

  static final int FORMAT_VERSION = 1;

  /** Far above any level a seeded geometric draw produces. */
  private static final int MAX_LEVEL = 64;

  private IndexSnapshots() {}

  /**
   * Writes {@code index} to {@code path}, replacing any existing snapshot.
   */
  public static void save(HnswIndex index, Path path) throws IOException {
    byte[] body = index.readState((nodes, entry, maxLevel) -> encodeBody(index.getConfig(), nodes, entry, maxLevel));
    CRC32 crc = new CRC32();
    crc.update(body);

    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    Path tmp = path.resolveSibling(path.getFileName().toString() + ".tmp");
    try (OutputStream os = Files.newOutputStream(tmp)) {
      CodedOutputStream out = CodedOutputStream.newInstance(os);
      out.writeFixed32NoTag(MAGIC);
      out.writeUInt32NoTag(FORMAT_VERSION);
      out.writeFixed64NoTag(crc.getValue());
      out.writeByteArrayNoTag(body);
      out.flush();
    }
    try {
      Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
    LOGGER.info("Saved index snapshot to {} ({} live entries, {} bytes)", path, index.size(), body.length);
  }

  /**
   * Loads the snapshot at {@code path}.
   *
   * @return the restored index, or empty when no snapshot exists
   * @throws SnapshotCorruptedException when the file is truncated, fails its checksum, has an
   *                                    unknown version or was built with a different dimension,
   *                                    metric or {@code m}
   * @throws IOException                when the file exists but cannot be read
   */
  public static Optional<HnswIndex> load(DiscoveryConfig config, Path path)
      throws IOException, SnapshotCorruptedException {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
    byte[] body;
    try {
      CodedInputStream in = CodedInputStream.newInstance(bytes);
      in.setSizeLimit(Integer.MAX_VALUE);
      int magic = in.readFixed32();
      if (magic != MAGIC) throw new SnapshotCorruptedException("Not an index snapshot: " + path);
      int version = in.readUInt32();
      if (version != FORMAT_VERSION) {
        throw new SnapshotCorruptedException("Unsupported snapshot version " + version);
      }
      long expectedCrc = in.readFixed64();
      body = in.readByteArray();
      CRC32 crc = new CRC32();
      crc.update(body);
      if (crc.getValue() != expectedCrc) throw new SnapshotCorruptedException("Snapshot checksum mismatch: " + path);
    } catch (IOException e) {
      throw new SnapshotCorruptedException("Truncated snapshot: " + path, e);
    }
    HnswIndex index = decodeBody(config, body);
    LOGGER.info("Loaded index snapshot from {} ({} live entries)", path, index.size());
    return Optional.of(index);
  }

  private static byte[] encodeBody(DiscoveryConfig config, List<HnswIndex.Node> nodes, int entry, int maxLevel) {
    try {
      ByteArrayOutputStream bos = new ByteArrayOutputStream();
      CodedOutputStream out = CodedOutputStream.newInstance(bos);
      out.writeUInt32NoTag(config.getDimension());
      out.writeUInt32NoTag(config.getMetric().ordinal());
      out.writeUInt32NoTag(config.getM());
      out.writeUInt32NoTag(config.getEfConstruction());
      out.writeUInt32NoTag(config.getEfSearch());
      out.writeInt64NoTag(config.getRandomSeed());
      out.writeUInt32NoTag(nodes.size());
      out.writeSInt32NoTag(entry);
      out.writeSInt32NoTag(maxLevel);
      for (HnswIndex.Node n : nodes) {
        out.writeInt64NoTag(n.id);
        out.writeUInt32NoTag(n.level);
        out.writeBoolNoTag(n.deleted);
        out.writeByteArrayNoTag(FloatPacker.floatsToBytes(n.vector));
        for (int l = 0; l <= n.level; l++) {
          int[] links = n.links[l];
          out.writeUInt32NoTag(links.length);
          for (int s : links) out.writeUInt32NoTag(s);
        }
      }
      out.flush();
      return bos.toByteArray();
    } catch (IOException e) {
      throw new IllegalStateException("in-memory snapshot encoding failed", e);
    }
  }

  private static HnswIndex decodeBody(DiscoveryConfig config, byte[] body) throws SnapshotCorruptedException {
    try {
      CodedInputStream in = CodedInputStream.newInstance(body);
      in.setSizeLimit(Integer.MAX_VALUE);
      int dimension = in.readUInt32();
      int metric = in.readUInt32();
      int m = in.readUInt32();
      in.readUInt32(); // efConstruction, superseded by the current configuration
      in.readUInt32(); // efSearch, likewise
      in.readInt64(); // seed
      if (dimension != config.getDimension()
          || metric != config.getMetric().ordinal()
          || m != config.getM()) {
        throw new SnapshotCorruptedException(String.format(
            "Snapshot parameters (dimension=%d, metric=%d, m=%d) do not match configuration (%d, %s, %d)",
            dimension, metric, m, config.getDimension(), config.getMetric(), config.getM()));
      }
      int count = in.readUInt32();
      int entry = in.readSInt32();
      int maxLevel = in.readSInt32();
      if (count < 0 || entry < -1 || entry >= count || (entry < 0) != (maxLevel < 0)) {
        throw new SnapshotCorruptedException("Invalid snapshot header: count=" + count + ", entry=" + entry);
      }
      List<HnswIndex.Node> nodes = new ArrayList<>(Math.min(count, body.length));
      for (int i = 0; i < count; i++) {
        long id = in.readInt64();
        int level = in.readUInt32();
        boolean deleted = in.readBool();
        // tombstones may sit above the live top level
        if (level < 0 || level > MAX_LEVEL || (!deleted && level > maxLevel)) {
          throw new SnapshotCorruptedException("Invalid level " + level + " at slot " + i);
        }
        float[] vector;
        try {
          vector = FloatPacker.bytesToFloats(in.readByteArray(), dimension);
        } catch (IllegalArgumentException e) {
          throw new SnapshotCorruptedException("Invalid vector at slot " + i, e);
        }
        HnswIndex.Node node = new HnswIndex.Node(id, vector, level);
        node.deleted = deleted;
        for (int l = 0; l <= level; l++) {
          int degree = in.readUInt32();
          if (degree < 0 || degree > count) throw new SnapshotCorruptedException("Invalid degree at slot " + i);
          int[] links = new int[degree];
          for (int j = 0; j < degree; j++) {
            links[j] = in.readUInt32();
            if (links[j] < 0 || links[j] >= count) {
              throw new SnapshotCorruptedException("Dangling link " + links[j] + " at slot " + i);
            }
          }
          node.links[l] = links;
        }
        nodes.add(node);
      }
      if (!in.isAtEnd()) throw new SnapshotCorruptedException("Trailing bytes after snapshot body");
      if (entry >= 0 && (nodes.get(entry).deleted || nodes.get(entry).level != maxLevel)) {
        throw new SnapshotCorruptedException("Snapshot entry point is not a live top-level node");
      }
      for (HnswIndex.Node n : nodes) {
        for (int l = 0; l <= n.level; l++) {
          for (int s : n.links[l]) {
            if (nodes.get(s).level < l) throw new SnapshotCorruptedException("Link below target level at node " + n.id);
          }
        }
      }
      return HnswIndex.restore(config, nodes, entry, maxLevel);
    } catch (IOException e) {
      throw new SnapshotCorruptedException("Truncated snapshot body", e);
    }
  }
}
