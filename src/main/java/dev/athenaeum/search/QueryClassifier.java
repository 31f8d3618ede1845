package dev.athenaeum.search;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure static classifier mapping normalised query text to a {@link QueryType}.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>contains a double-quoted phrase, or has at most {@code factualMaxTokens} tokens: FACTUAL
 *   <li>starts with an interrogative or imperative-explain word, ends with {@code ?}, or has at
 *       least {@code conceptualMinTokens} tokens: CONCEPTUAL
 *   <li>otherwise: MIXED
 * </ol>
 */
public final class QueryClassifier {

  static final int DEFAULT_FACTUAL_MAX_TOKENS = 3;
  static final int DEFAULT_CONCEPTUAL_MIN_TOKENS = 6;

  private static final Pattern QUOTED_PHRASE = Pattern.compile("\"[^\"]+\"");

  private static final Set<String> QUESTION_WORDS =
      Set.of(
          "who", "what", "when", "where", "why", "how", "which", "can", "does", "do", "is", "are",
          "should", "explain", "describe");

  private QueryClassifier() {}

  /** Classifies with the default token thresholds. */
  public static QueryType classify(String normalisedQuery) {
    return classify(normalisedQuery, DEFAULT_FACTUAL_MAX_TOKENS, DEFAULT_CONCEPTUAL_MIN_TOKENS);
  }

  /**
   * Classifies normalised query text.
   *
   * @param normalisedQuery output of {@link QueryNormalizer#normalise(String)}
   * @param factualMaxTokens queries with at most this many tokens are FACTUAL
   * @param conceptualMinTokens queries with at least this many tokens are CONCEPTUAL
   * @return the query type
   */
  public static QueryType classify(
      String normalisedQuery, int factualMaxTokens, int conceptualMinTokens) {
    if (QUOTED_PHRASE.matcher(normalisedQuery).find()) {
      return QueryType.FACTUAL;
    }
    String[] tokens = normalisedQuery.split(" ");
    if (tokens.length <= factualMaxTokens) {
      return QueryType.FACTUAL;
    }
    if (QUESTION_WORDS.contains(tokens[0])
        || normalisedQuery.endsWith("?")
        || tokens.length >= conceptualMinTokens) {
      return QueryType.CONCEPTUAL;
    }
    return QueryType.MIXED;
  }
}
