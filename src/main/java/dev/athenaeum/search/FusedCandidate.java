package dev.athenaeum.search;

import java.time.Instant;
import java.util.UUID;

/**
 * One content item after fusion.
 *
 * @param contentItemId the item
 * @param validFrom most recent {@code valid_from} among the item's matched snapshots
 * @param semanticScore normalised semantic score, 0 if the item had no semantic hit
 * @param lexicalScore normalised lexical score, 0 if the item had no lexical hit
 * @param fusedScore weighted combination of the two
 */
public record FusedCandidate(
    UUID contentItemId,
    Instant validFrom,
    double semanticScore,
    double lexicalScore,
    double fusedScore) {}
