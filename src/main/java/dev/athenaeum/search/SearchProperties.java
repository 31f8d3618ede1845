package dev.athenaeum.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code athenaeum.search.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code candidates} - top-K fetched from each retrieval branch before fusion (default 50,
 *       bounded [10, 200])
 *   <li>{@code max-query-length} - longest accepted normalised query, in characters (default 1000)
 *   <li>{@code factual-max-tokens} / {@code conceptual-min-tokens} - classifier thresholds
 *       (defaults 3 and 6)
 *   <li>{@code weights.<factual|conceptual|mixed>.semantic|lexical} - fusion weights per query
 *       type (factual 0.3/0.7, others 0.7/0.3)
 *   <li>{@code timeout} - default request deadline (default 3s)
 *   <li>{@code lexical-enabled} / {@code semantic-enabled} - switch a branch off; responses are
 *       then flagged degraded
 *   <li>{@code min-similarity} - cosine similarity floor for semantic hits (default 0.5)
 *   <li>{@code default-page-size} / {@code max-page-size} - page bounds (defaults 10 and 50)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.search")
public class SearchProperties {

  private int candidates = 50;
  private int maxQueryLength = 1000;
  private int factualMaxTokens = QueryClassifier.DEFAULT_FACTUAL_MAX_TOKENS;
  private int conceptualMinTokens = QueryClassifier.DEFAULT_CONCEPTUAL_MIN_TOKENS;
  private Duration timeout = Duration.ofSeconds(3);
  private boolean lexicalEnabled = true;
  private boolean semanticEnabled = true;
  private double minSimilarity = 0.5;
  private int defaultPageSize = 10;
  private int maxPageSize = 50;
  private Weights weights = new Weights();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (candidates < 10 || candidates > 200) {
      throw new IllegalStateException(
          "athenaeum.search.candidates must be in [10, 200], got: " + candidates);
    }
    if (maxQueryLength < 1) {
      throw new IllegalStateException(
          "athenaeum.search.max-query-length must be >= 1, got: " + maxQueryLength);
    }
    if (factualMaxTokens < 0 || conceptualMinTokens <= factualMaxTokens) {
      throw new IllegalStateException(
          "athenaeum.search.conceptual-min-tokens must exceed factual-max-tokens, got: "
              + conceptualMinTokens
              + " <= "
              + factualMaxTokens);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "athenaeum.search.timeout must be a positive duration, got: " + timeout);
    }
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalStateException(
          "athenaeum.search.min-similarity must be in [-1.0, 1.0], got: " + minSimilarity);
    }
    if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
      throw new IllegalStateException(
          "athenaeum.search page sizes must satisfy 1 <= default-page-size <= max-page-size");
    }
    for (QueryType type : QueryType.values()) {
      WeightPair pair = weights.forType(type);
      if (!inUnitRange(pair.getSemantic()) || !inUnitRange(pair.getLexical())) {
        throw new IllegalStateException(
            "athenaeum.search.weights."
                + type.name().toLowerCase(Locale.ROOT)
                + " must be in [0.0, 1.0]");
      }
    }
  }

  private static boolean inUnitRange(double value) {
    return value >= 0.0 && value <= 1.0;
  }

  /** Fusion weights for a query type. */
  public FusionWeights weightsFor(QueryType type) {
    WeightPair pair = weights.forType(type);
    return new FusionWeights(pair.getSemantic(), pair.getLexical());
  }

  public int getCandidates() {
    return candidates;
  }

  public void setCandidates(int candidates) {
    this.candidates = candidates;
  }

  public int getMaxQueryLength() {
    return maxQueryLength;
  }

  public void setMaxQueryLength(int maxQueryLength) {
    this.maxQueryLength = maxQueryLength;
  }

  public int getFactualMaxTokens() {
    return factualMaxTokens;
  }

  public void setFactualMaxTokens(int factualMaxTokens) {
    this.factualMaxTokens = factualMaxTokens;
  }

  public int getConceptualMinTokens() {
    return conceptualMinTokens;
  }

  public void setConceptualMinTokens(int conceptualMinTokens) {
    this.conceptualMinTokens = conceptualMinTokens;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public boolean isLexicalEnabled() {
    return lexicalEnabled;
  }

  public void setLexicalEnabled(boolean lexicalEnabled) {
    this.lexicalEnabled = lexicalEnabled;
  }

  public boolean isSemanticEnabled() {
    return semanticEnabled;
  }

  public void setSemanticEnabled(boolean semanticEnabled) {
    this.semanticEnabled = semanticEnabled;
  }

  public double getMinSimilarity() {
    return minSimilarity;
  }

  public void setMinSimilarity(double minSimilarity) {
    this.minSimilarity = minSimilarity;
  }

  public int getDefaultPageSize() {
    return defaultPageSize;
  }

  public void setDefaultPageSize(int defaultPageSize) {
    this.defaultPageSize = defaultPageSize;
  }

  public int getMaxPageSize() {
    return maxPageSize;
  }

  public void setMaxPageSize(int maxPageSize) {
    this.maxPageSize = maxPageSize;
  }

  public Weights getWeights() {
    return weights;
  }

  public void setWeights(Weights weights) {
    this.weights = weights;
  }

  /** Per-type weight pairs bound from {@code athenaeum.search.weights.*}. */
  public static class Weights {

    private WeightPair factual = new WeightPair(0.3, 0.7);
    private WeightPair conceptual = new WeightPair(0.7, 0.3);
    private WeightPair mixed = new WeightPair(0.7, 0.3);

    WeightPair forType(QueryType type) {
      return switch (type) {
        case FACTUAL -> factual;
        case CONCEPTUAL -> conceptual;
        case MIXED -> mixed;
      };
    }

    public WeightPair getFactual() {
      return factual;
    }

    public void setFactual(WeightPair factual) {
      this.factual = factual;
    }

    public WeightPair getConceptual() {
      return conceptual;
    }

    public void setConceptual(WeightPair conceptual) {
      this.conceptual = conceptual;
    }

    public WeightPair getMixed() {
      return mixed;
    }

    public void setMixed(WeightPair mixed) {
      this.mixed = mixed;
    }
  }

  /** Mutable semantic/lexical weight pair for property binding. */
  public static class WeightPair {

    private double semantic;
    private double lexical;

    public WeightPair() {}

    public WeightPair(double semantic, double lexical) {
      this.semantic = semantic;
      this.lexical = lexical;
    }

    public double getSemantic() {
      return semantic;
    }

    public void setSemantic(double semantic) {
      this.semantic = semantic;
    }

    public double getLexical() {
      return lexical;
    }

    public void setLexical(double lexical) {
      this.lexical = lexical;
    }
  }
}
