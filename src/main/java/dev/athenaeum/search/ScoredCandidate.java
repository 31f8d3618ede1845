package dev.athenaeum.search;

import java.time.Instant;
import java.util.UUID;

/**
 * A search candidate with its raw score from a single source (semantic or lexical). Used as input
 * to {@link ConvexCombinationFusion} for score normalisation and combination.
 *
 * @param contentItemId the item the matched snapshot belongs to; the fusion key
 * @param versionId the matched snapshot
 * @param validFrom start of validity of the matched snapshot, used for tie-breaking
 * @param score the raw score from the source (relevance for vectors, ts_rank_cd for full text)
 */
record ScoredCandidate(UUID contentItemId, UUID versionId, Instant validFrom, double score) {}
