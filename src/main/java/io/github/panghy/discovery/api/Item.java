package io.github.panghy.discovery.api;

import io.github.panghy.discovery.text.MetadataTextBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * One library entry.
 *
 * <p>{@code textContent} is the prepared concatenation of title, channel, tags, description and
 * thumbnail OCR text; when the builder leaves it unset it is derived with
 * {@link MetadataTextBuilder#buildText}. An item references its cluster by id only.</p>
 *
 * @param id          stable identifier, never reused after deletion
 * @param title       display title
 * @param channel     uploader or channel name, {@code null} for local files
 * @param description free-form description, may be {@code null}
 * @param tags        provider tags (never {@code null})
 * @param ocrText     text recognized on the thumbnail, may be {@code null}
 * @param textContent text fed to the encoder and matched by keyword search
 * @param embedding   computed embedding, {@code null} until the encoder has run
 * @param clusterId   id of the live cluster this item belongs to, or {@code null}
 * @param source      remote or local media
 * @param duration    playback length
 * @param publishedAt provider publish time, may be {@code null}
 * @param addedAt     time the item entered the library
 */
@Builder(toBuilder = true)
public record Item(
    long id,
    String title,
    String channel,
    String description,
    List<String> tags,
    String ocrText,
    String textContent,
    float[] embedding,
    Long clusterId,
    Source source,
    Duration duration,
    Instant publishedAt,
    Instant addedAt) {

  public Item {
    title = title == null ? "" : title;
    tags = tags == null ? List.of() : List.copyOf(tags);
    source = source == null ? Source.REMOTE : source;
    duration = duration == null ? Duration.ZERO : duration;
    addedAt = addedAt == null ? Instant.EPOCH : addedAt;
    if (textContent == null) {
      textContent = MetadataTextBuilder.buildText(title, channel, tags, description, ocrText);
    }
  }

  /** Whether the embedding has been computed. */
  public boolean hasEmbedding() {
    return embedding != null;
  }

  /** Publish time when known, otherwise the time the item was added. */
  public Instant recency() {
    return publishedAt != null ? publishedAt : addedAt;
  }

  public Item withEmbedding(float[] vector) {
    return toBuilder().embedding(vector).build();
  }

  public Item withClusterId(Long newClusterId) {
    return toBuilder().clusterId(newClusterId).build();
  }

  @Override
  public String toString() {
    return String.format(
        "Item(id=%d, title=%s, embedding=%s, clusterId=%s)",
        id, title, embedding == null ? "none" : embedding.length + "d", clusterId);
  }
}
