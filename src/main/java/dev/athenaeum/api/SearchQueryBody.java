package dev.athenaeum.api;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/search}.
 *
 * @param query the query text
 * @param categoryId optional category filter
 * @param tag optional tag filter
 * @param sourceType optional source type filter
 * @param asOf optional as-of instant (ISO-8601)
 * @param offset optional page offset, default 0
 * @param limit optional page size, default from configuration
 * @param timeoutMs optional deadline in milliseconds
 */
public record SearchQueryBody(
    String query,
    @Nullable String categoryId,
    @Nullable String tag,
    @Nullable String sourceType,
    @Nullable Instant asOf,
    @Nullable Integer offset,
    @Nullable Integer limit,
    @Nullable Long timeoutMs) {}
