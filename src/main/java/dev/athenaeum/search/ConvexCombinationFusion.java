package dev.athenaeum.search;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pure static utility for fusing semantic and lexical search results using Convex Combination.
 *
 * <p>Applies min-max normalisation to each source's scores independently, then combines them using
 * a weighted formula: {@code fused = w.semantic * normSemantic + w.lexical * normLexical}.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions. The
 * output depends only on scores, ids and validity instants, never on input order.
 */
public final class ConvexCombinationFusion {

  /** Best candidate first: higher score, then later validity start, then smaller version id. */
  private static final Comparator<ScoredCandidate> BEST_SNAPSHOT =
      Comparator.comparingDouble(ScoredCandidate::score)
          .thenComparing(ScoredCandidate::validFrom)
          .thenComparing(c -> c.versionId().toString(), Comparator.reverseOrder());

  static final Comparator<FusedCandidate> RANKING =
      Comparator.comparingDouble(FusedCandidate::fusedScore)
          .reversed()
          .thenComparing(FusedCandidate::validFrom, Comparator.reverseOrder())
          .thenComparing(c -> c.contentItemId().toString());

  private ConvexCombinationFusion() {}

  /**
   * Fuses semantic and lexical candidates into one ranking of content items.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Collapse each source to its best snapshot per content item
   *   <li>Min-max normalise each source to [0, 1] (if max == min, all normalise to 1.0)
   *   <li>Combine by content item id; an item missing from a source gets 0.0 for that source
   *   <li>Sort by fused score descending, then more recent {@code validFrom}, then content item
   *       id; limit to maxResults
   * </ol>
   *
   * @param semanticResults candidates from vector search
   * @param lexicalResults candidates from full-text search
   * @param weights weights for the two normalised components
   * @param maxResults maximum number of results to return
   * @return fused candidates, best first
   */
  static List<FusedCandidate> fuse(
      List<ScoredCandidate> semanticResults,
      List<ScoredCandidate> lexicalResults,
      FusionWeights weights,
      int maxResults) {
    if (semanticResults.isEmpty() && lexicalResults.isEmpty()) {
      return List.of();
    }

    Map<UUID, ScoredCandidate> semantic = bestPerItem(semanticResults);
    Map<UUID, ScoredCandidate> lexical = bestPerItem(lexicalResults);

    double semanticMin = minScore(semantic);
    double semanticMax = maxScore(semantic);
    double lexicalMin = minScore(lexical);
    double lexicalMax = maxScore(lexical);

    Map<UUID, FusedCandidate> fused = new HashMap<>();
    for (ScoredCandidate sc : semantic.values()) {
      double norm = normalise(sc.score(), semanticMin, semanticMax);
      fused.put(sc.contentItemId(), combine(sc.contentItemId(), sc.validFrom(), norm, 0.0, weights));
    }
    for (ScoredCandidate lc : lexical.values()) {
      double norm = normalise(lc.score(), lexicalMin, lexicalMax);
      FusedCandidate existing = fused.get(lc.contentItemId());
      if (existing != null) {
        Instant latest =
            lc.validFrom().isAfter(existing.validFrom()) ? lc.validFrom() : existing.validFrom();
        fused.put(
            lc.contentItemId(),
            combine(lc.contentItemId(), latest, existing.semanticScore(), norm, weights));
      } else {
        fused.put(lc.contentItemId(), combine(lc.contentItemId(), lc.validFrom(), 0.0, norm, weights));
      }
    }

    return fused.values().stream().sorted(RANKING).limit(maxResults).toList();
  }

  private static FusedCandidate combine(
      UUID contentItemId,
      Instant validFrom,
      double semanticNorm,
      double lexicalNorm,
      FusionWeights weights) {
    double score = weights.semantic() * semanticNorm + weights.lexical() * lexicalNorm;
    return new FusedCandidate(contentItemId, validFrom, semanticNorm, lexicalNorm, score);
  }

  private static Map<UUID, ScoredCandidate> bestPerItem(List<ScoredCandidate> candidates) {
    Map<UUID, ScoredCandidate> best = new HashMap<>();
    for (ScoredCandidate candidate : candidates) {
      best.merge(
          candidate.contentItemId(),
          candidate,
          (a, b) -> BEST_SNAPSHOT.compare(a, b) >= 0 ? a : b);
    }
    return best;
  }

  /**
   * Min-max normalises a score to [0, 1]. If max == min (all scores identical), returns 1.0.
   *
   * @param score the raw score to normalise
   * @param min the minimum score in the source
   * @param max the maximum score in the source
   * @return normalised score in [0, 1]
   */
  static double normalise(double score, double min, double max) {
    if (max == min) {
      return 1.0;
    }
    return (score - min) / (max - min);
  }

  private static double minScore(Map<UUID, ScoredCandidate> candidates) {
    return candidates.values().stream().mapToDouble(ScoredCandidate::score).min().orElse(0.0);
  }

  private static double maxScore(Map<UUID, ScoredCandidate> candidates) {
    return candidates.values().stream().mapToDouble(ScoredCandidate::score).max().orElse(0.0);
  }
}
