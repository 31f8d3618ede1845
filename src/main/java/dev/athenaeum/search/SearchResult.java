package dev.athenaeum.search;

import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One ranked, access-filtered, version-resolved result.
 *
 * @param contentItemId the item
 * @param versionId the version valid at the request's as-of time
 * @param versionNumber that version's sequence number
 * @param title snapshot title
 * @param summary snapshot summary, if any
 * @param text snapshot text
 * @param score fused score
 * @param semanticScore normalised semantic component
 * @param lexicalScore normalised lexical component
 * @param validFrom start of the version's validity
 * @param validTo end of the version's validity; null while current
 */
public record SearchResult(
    UUID contentItemId,
    UUID versionId,
    int versionNumber,
    String title,
    @Nullable String summary,
    String text,
    double score,
    double semanticScore,
    double lexicalScore,
    Instant validFrom,
    @Nullable Instant validTo) {}
