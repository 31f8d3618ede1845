package dev.athenaeum.mcp;

import dev.athenaeum.search.SearchResult;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats search results for tool output and cuts them to a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Results are appended in rank order until the next one
 * would exceed the budget. The first result is always returned, truncated at the character level if
 * it alone exceeds the budget.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${athenaeum.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats as many results as fit within the token budget.
   *
   * @param results ranked results
   * @return formatted text, empty if there are no results
   */
  public String truncate(@Nullable List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int usedTokens = 0;
    for (int i = 0; i < results.size(); i++) {
      String formatted = format(i + 1, results.get(i));
      int tokens = estimateTokens(formatted);

      if (i == 0 && tokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (usedTokens + tokens > tokenBudget) {
        break;
      }
      output.append(formatted);
      usedTokens += tokens;
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static String format(int rank, SearchResult result) {
    String validity =
        result.validFrom() + " .. " + (result.validTo() != null ? result.validTo() : "current");
    String summary =
        result.summary() != null && !result.summary().isBlank() ? result.summary() + "\n\n" : "";
    return String.format(
        Locale.ROOT,
        "## [%d] %s (v%d)\nItem: %s\nValid: %s\nScore: %.3f (semantic %.3f, lexical %.3f)\n\n%s%s\n\n---\n",
        rank,
        result.title(),
        result.versionNumber(),
        result.contentItemId(),
        validity,
        result.score(),
        result.semanticScore(),
        result.lexicalScore(),
        summary,
        result.text());
  }
}
