package io.github.panghy.discovery.config;

import io.github.panghy.discovery.search.FusionStrategy;
import java.nio.file.Path;
import java.time.Duration;
import java.time.InstantSource;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a discovery engine instance.
 *
 * <p>Uses a builder, validates inputs, and exposes getters only. The config carries the
 * algorithmic parameters of every subsystem (HNSW index, kNN graph, Leiden clustering, hybrid
 * search fusion, embedding batching) and the operational settings (worker threads, snapshot
 * location, time source, metric attributes).</p>
 */
public final class DiscoveryConfig {

  /** Similarity used for both index construction and querying. */
  public enum Metric {
    /** Cosine similarity; tolerant of encoders that do not unit-normalize their output. */
    COSINE,
    /** Raw inner product; only meaningful for unit-normalized embeddings. */
    INNER_PRODUCT
  }

  private final int dimension;
  private final Metric metric;

  private final int m;
  private final int efConstruction;
  private final int efSearch;
  private final long randomSeed;

  private final int graphNeighbors;
  private final double resolution;
  private final int maxIterations;
  private final double minModularityGain;
  private final int minClusterSize;
  private final double stabilityThreshold;
  private final double reclusterGrowthThreshold;
  private final int labelTermCount;

  private final int rrfK;
  private final int vectorTopK;
  private final int maxResults;
  private final FusionStrategy fusionStrategy;
  private final double keywordWeight;
  private final double vectorWeight;
  private final Duration searchTimeout;

  private final int embeddingConcurrency;
  private final int maxTextLength;
  private final int embeddingCacheSize;

  private final int backgroundThreads;
  private final int searchThreads;
  private final Path snapshotPath;
  private final InstantSource instantSource;
  private final Map<String, String> metricAttributes;

  private DiscoveryConfig(Builder b) {
    if (b.dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = b.dimension;
    this.metric = Objects.requireNonNull(b.metric, "metric must not be null");

    if (b.m < 2) throw new IllegalArgumentException("m must be >= 2");
    this.m = b.m;
    if (b.efConstruction < b.m) throw new IllegalArgumentException("efConstruction must be >= m");
    this.efConstruction = b.efConstruction;
    if (b.efSearch <= 0) throw new IllegalArgumentException("efSearch must be positive");
    this.efSearch = b.efSearch;
    this.randomSeed = b.randomSeed;

    if (b.graphNeighbors <= 0) throw new IllegalArgumentException("graphNeighbors must be positive");
    this.graphNeighbors = b.graphNeighbors;
    if (!(b.resolution > 0.0)) throw new IllegalArgumentException("resolution must be positive");
    this.resolution = b.resolution;
    if (b.maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be positive");
    this.maxIterations = b.maxIterations;
    if (b.minModularityGain < 0.0) throw new IllegalArgumentException("minModularityGain must be >= 0");
    this.minModularityGain = b.minModularityGain;
    if (b.minClusterSize <= 0) throw new IllegalArgumentException("minClusterSize must be positive");
    this.minClusterSize = b.minClusterSize;
    if (b.stabilityThreshold < -1.0 || b.stabilityThreshold > 1.0) {
      throw new IllegalArgumentException("stabilityThreshold must be within [-1, 1]");
    }
    this.stabilityThreshold = b.stabilityThreshold;
    if (b.reclusterGrowthThreshold < 0.0) {
      throw new IllegalArgumentException("reclusterGrowthThreshold must not be negative");
    }
    this.reclusterGrowthThreshold = b.reclusterGrowthThreshold;
    if (b.labelTermCount < 3 || b.labelTermCount > 5) {
      throw new IllegalArgumentException("labelTermCount must be between 3 and 5");
    }
    this.labelTermCount = b.labelTermCount;

    if (b.rrfK < 0) throw new IllegalArgumentException("rrfK must not be negative");
    this.rrfK = b.rrfK;
    if (b.vectorTopK <= 0) throw new IllegalArgumentException("vectorTopK must be positive");
    this.vectorTopK = b.vectorTopK;
    if (b.maxResults <= 0) throw new IllegalArgumentException("maxResults must be positive");
    this.maxResults = b.maxResults;
    this.fusionStrategy = Objects.requireNonNull(b.fusionStrategy, "fusionStrategy must not be null");
    if (b.keywordWeight < 0.0 || b.vectorWeight < 0.0) {
      throw new IllegalArgumentException("fusion weights must not be negative");
    }
    this.keywordWeight = b.keywordWeight;
    this.vectorWeight = b.vectorWeight;
    this.searchTimeout = requirePositive(b.searchTimeout, "searchTimeout");

    if (b.embeddingConcurrency <= 0) throw new IllegalArgumentException("embeddingConcurrency must be positive");
    this.embeddingConcurrency = b.embeddingConcurrency;
    if (b.maxTextLength <= 0) throw new IllegalArgumentException("maxTextLength must be positive");
    this.maxTextLength = b.maxTextLength;
    if (b.embeddingCacheSize < 0) throw new IllegalArgumentException("embeddingCacheSize must be >= 0");
    this.embeddingCacheSize = b.embeddingCacheSize;

    if (b.backgroundThreads <= 0) throw new IllegalArgumentException("backgroundThreads must be positive");
    this.backgroundThreads = b.backgroundThreads;
    if (b.searchThreads <= 0) throw new IllegalArgumentException("searchThreads must be positive");
    this.searchThreads = b.searchThreads;
    this.snapshotPath = b.snapshotPath;
    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
    this.metricAttributes = Map.copyOf(b.metricAttributes);
  }

  private static Duration requirePositive(Duration d, String name) {
    if (d == null) throw new IllegalArgumentException(name + " must not be null");
    if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    return d;
  }

  /** Returns the fixed embedding dimension. */
  public int getDimension() {
    return dimension;
  }

  /** Returns the similarity metric. */
  public Metric getMetric() {
    return metric;
  }

  /** Returns the HNSW link budget per node on upper layers (layer 0 allows twice as many). */
  public int getM() {
    return m;
  }

  /** Returns the candidate list size used while inserting. */
  public int getEfConstruction() {
    return efConstruction;
  }

  /** Returns the default candidate list size used while querying. */
  public int getEfSearch() {
    return efSearch;
  }

  /** Returns the seed for HNSW level assignment and Leiden node ordering. */
  public long getRandomSeed() {
    return randomSeed;
  }

  /** Returns k for the kNN graph. */
  public int getGraphNeighbors() {
    return graphNeighbors;
  }

  /** Returns the Leiden resolution parameter; higher values yield more, smaller clusters. */
  public double getResolution() {
    return resolution;
  }

  /** Returns the Leiden iteration cap. */
  public int getMaxIterations() {
    return maxIterations;
  }

  /** Returns the modularity gain below which Leiden stops iterating. */
  public double getMinModularityGain() {
    return minModularityGain;
  }

  /** Returns the smallest community kept as a cluster (1 keeps singletons). */
  public int getMinClusterSize() {
    return minClusterSize;
  }

  /** Returns the centroid cosine similarity needed to carry a cluster id across passes. */
  public double getStabilityThreshold() {
    return stabilityThreshold;
  }

  /** Returns the item growth fraction after which a recluster is due. */
  public double getReclusterGrowthThreshold() {
    return reclusterGrowthThreshold;
  }

  /** Returns the number of terms in generated cluster labels. */
  public int getLabelTermCount() {
    return labelTermCount;
  }

  /** Returns the reciprocal rank fusion constant. */
  public int getRrfK() {
    return rrfK;
  }

  /** Returns how many neighbours the vector retrieval path asks the index for. */
  public int getVectorTopK() {
    return vectorTopK;
  }

  /** Returns the cap on fused search results. */
  public int getMaxResults() {
    return maxResults;
  }

  /** Returns the fusion strategy. */
  public FusionStrategy getFusionStrategy() {
    return fusionStrategy;
  }

  /** Returns the keyword weight for {@link FusionStrategy#WEIGHTED_SUM}. */
  public double getKeywordWeight() {
    return keywordWeight;
  }

  /** Returns the vector weight for {@link FusionStrategy#WEIGHTED_SUM}. */
  public double getVectorWeight() {
    return vectorWeight;
  }

  /** Returns how long fusion waits for a retrieval path. */
  public Duration getSearchTimeout() {
    return searchTimeout;
  }

  /** Returns the maximum number of concurrent encoder calls in a batch. */
  public int getEmbeddingConcurrency() {
    return embeddingConcurrency;
  }

  /** Returns the character budget of prepared embedding input. */
  public int getMaxTextLength() {
    return maxTextLength;
  }

  /** Returns the number of cached query embeddings (0 disables the cache). */
  public int getEmbeddingCacheSize() {
    return embeddingCacheSize;
  }

  /** Returns the number of background worker threads. */
  public int getBackgroundThreads() {
    return backgroundThreads;
  }

  /** Returns the number of threads reserved for the vector path of searches. */
  public int getSearchThreads() {
    return searchThreads;
  }

  /** Returns the index snapshot file, or {@code null} when snapshots are disabled. */
  public Path getSnapshotPath() {
    return snapshotPath;
  }

  /** Returns the time source (injectable for tests). */
  public InstantSource getInstantSource() {
    return instantSource;
  }

  /** Additional metric attributes to add to emitted metrics/spans. */
  public Map<String, String> getMetricAttributes() {
    return metricAttributes;
  }

  /** Creates a new builder for {@link DiscoveryConfig}. */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link DiscoveryConfig}. */
  public static final class Builder {
    private int dimension = 384;
    private Metric metric = Metric.COSINE;
    private int m = 16;
    private int efConstruction = 200;
    private int efSearch = 100;
    private long randomSeed = 42L;
    private int graphNeighbors = 10;
    private double resolution = 1.0;
    private int maxIterations = 50;
    private double minModularityGain = 1e-6;
    private int minClusterSize = 1;
    private double stabilityThreshold = 0.85;
    private double reclusterGrowthThreshold = 0.10;
    private int labelTermCount = 3;
    private int rrfK = 60;
    private int vectorTopK = 20;
    private int maxResults = 100;
    private FusionStrategy fusionStrategy = FusionStrategy.RECIPROCAL_RANK;
    private double keywordWeight = 0.5;
    private double vectorWeight = 0.5;
    private Duration searchTimeout = Duration.ofMillis(200);
    private int embeddingConcurrency = 10;
    private int maxTextLength = 1000;
    private int embeddingCacheSize = 1000;
    private int backgroundThreads = 2;
    private int searchThreads = 2;
    private Path snapshotPath;
    private InstantSource instantSource = InstantSource.system();
    private final Map<String, String> metricAttributes = new HashMap<>();

    private Builder() {}

    /** Sets the embedding dimension. */
    public Builder dimension(int dimension) {
      this.dimension = dimension;
      return this;
    }

    /** Sets the similarity metric. */
    public Builder metric(Metric metric) {
      this.metric = metric;
      return this;
    }

    /** Sets the HNSW upper-layer link budget. */
    public Builder m(int m) {
      this.m = m;
      return this;
    }

    /** Sets the insertion candidate list size. */
    public Builder efConstruction(int efConstruction) {
      this.efConstruction = efConstruction;
      return this;
    }

    /** Sets the query candidate list size. */
    public Builder efSearch(int efSearch) {
      this.efSearch = efSearch;
      return this;
    }

    /** Sets the random seed. */
    public Builder randomSeed(long randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    /** Sets k for the kNN graph. */
    public Builder graphNeighbors(int graphNeighbors) {
      this.graphNeighbors = graphNeighbors;
      return this;
    }

    /** Sets the Leiden resolution. */
    public Builder resolution(double resolution) {
      this.resolution = resolution;
      return this;
    }

    /** Sets the Leiden iteration cap. */
    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    /** Sets the Leiden convergence threshold. */
    public Builder minModularityGain(double minModularityGain) {
      this.minModularityGain = minModularityGain;
      return this;
    }

    /** Sets the minimum cluster size (1 keeps singletons). */
    public Builder minClusterSize(int minClusterSize) {
      this.minClusterSize = minClusterSize;
      return this;
    }

    /** Sets the centroid similarity needed to keep a cluster id across passes. */
    public Builder stabilityThreshold(double stabilityThreshold) {
      this.stabilityThreshold = stabilityThreshold;
      return this;
    }

    /** Sets the growth fraction after which a recluster is due. */
    public Builder reclusterGrowthThreshold(double reclusterGrowthThreshold) {
      this.reclusterGrowthThreshold = reclusterGrowthThreshold;
      return this;
    }

    /** Sets the number of label terms (3..5). */
    public Builder labelTermCount(int labelTermCount) {
      this.labelTermCount = labelTermCount;
      return this;
    }

    /** Sets the reciprocal rank fusion constant. */
    public Builder rrfK(int rrfK) {
      this.rrfK = rrfK;
      return this;
    }

    /** Sets the number of neighbours fetched by the vector path. */
    public Builder vectorTopK(int vectorTopK) {
      this.vectorTopK = vectorTopK;
      return this;
    }

    /** Sets the fused result cap. */
    public Builder maxResults(int maxResults) {
      this.maxResults = maxResults;
      return this;
    }

    /** Sets the fusion strategy. */
    public Builder fusionStrategy(FusionStrategy fusionStrategy) {
      this.fusionStrategy = fusionStrategy;
      return this;
    }

    /** Sets the weighted-sum weights. */
    public Builder fusionWeights(double keywordWeight, double vectorWeight) {
      this.keywordWeight = keywordWeight;
      this.vectorWeight = vectorWeight;
      return this;
    }

    /** Sets how long fusion waits for each retrieval path. */
    public Builder searchTimeout(Duration searchTimeout) {
      this.searchTimeout = searchTimeout;
      return this;
    }

    /** Sets the number of concurrent encoder calls allowed in a batch. */
    public Builder embeddingConcurrency(int embeddingConcurrency) {
      this.embeddingConcurrency = embeddingConcurrency;
      return this;
    }

    /** Sets the character budget of prepared embedding input. */
    public Builder maxTextLength(int maxTextLength) {
      this.maxTextLength = maxTextLength;
      return this;
    }

    /** Sets the query embedding cache size (0 disables it). */
    public Builder embeddingCacheSize(int embeddingCacheSize) {
      this.embeddingCacheSize = embeddingCacheSize;
      return this;
    }

    /** Sets the number of background worker threads. */
    public Builder backgroundThreads(int backgroundThreads) {
      this.backgroundThreads = backgroundThreads;
      return this;
    }

    /** Sets the number of search threads; background jobs never run on them. */
    public Builder searchThreads(int searchThreads) {
      this.searchThreads = searchThreads;
      return this;
    }

    /** Sets the index snapshot file ({@code null} disables snapshots). */
    public Builder snapshotPath(Path snapshotPath) {
      this.snapshotPath = snapshotPath;
      return this;
    }

    /** Sets the time source used to obtain the current time. */
    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    /** Adds a metric attribute (key/value) to be included on metrics/spans. */
    public Builder metricAttribute(String key, String value) {
      this.metricAttributes.put(key, value);
      return this;
    }

    /** Builds the immutable {@link DiscoveryConfig}. */
    public DiscoveryConfig build() {
      return new DiscoveryConfig(this);
    }
  }
}
