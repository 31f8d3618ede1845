package dev.athenaeum.search;

import dev.athenaeum.cache.CacheKey;
import dev.athenaeum.cache.CachedResults;
import dev.athenaeum.cache.QueryFrequencyTracker;
import dev.athenaeum.cache.SearchResultCache;
import dev.athenaeum.cache.TtlClass;
import dev.athenaeum.content.ContentItem;
import dev.athenaeum.content.ContentItemRepository;
import dev.athenaeum.content.ContentVersion;
import dev.athenaeum.content.ContentVersionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Query orchestrator: the single entry point of the retrieval pipeline.
 *
 * <p>Pipeline: normalise and classify the query -> result cache lookup (hits are re-resolved
 * against the content store before being served) -> lexical and semantic retrieval in parallel
 * under one deadline, interrupting branches still running when it elapses -> convex combination
 * fusion with per-type weights -> access filter -> version resolution at the as-of instant ->
 * page -> cache populate unless degraded.
 *
 * <p>One failing branch degrades the response instead of failing it; both failing, or the
 * deadline elapsing, fail the request. Transport errors never leave this class unconverted.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  /** As-of cache key component for requests resolved at the current time. */
  static final String AS_OF_NOW = "now";

  private final LexicalRetriever lexicalRetriever;
  private final SemanticRetriever semanticRetriever;
  private final ContentItemRepository contentItemRepository;
  private final ContentVersionRepository contentVersionRepository;
  private final AccessFilter accessFilter;
  private final VersionResolver versionResolver;
  private final SearchResultCache resultCache;
  private final QueryFrequencyTracker frequencyTracker;
  private final SearchProperties searchProperties;
  private final ExecutorService searchExecutor;
  private final Clock clock;

  public SearchService(
      LexicalRetriever lexicalRetriever,
      SemanticRetriever semanticRetriever,
      ContentItemRepository contentItemRepository,
      ContentVersionRepository contentVersionRepository,
      AccessFilter accessFilter,
      VersionResolver versionResolver,
      SearchResultCache resultCache,
      QueryFrequencyTracker frequencyTracker,
      SearchProperties searchProperties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor,
      Clock clock) {
    this.lexicalRetriever = lexicalRetriever;
    this.semanticRetriever = semanticRetriever;
    this.contentItemRepository = contentItemRepository;
    this.contentVersionRepository = contentVersionRepository;
    this.accessFilter = accessFilter;
    this.versionResolver = versionResolver;
    this.resultCache = resultCache;
    this.frequencyTracker = frequencyTracker;
    this.searchProperties = searchProperties;
    this.searchExecutor = searchExecutor;
    this.clock = clock;
  }

  /**
   * Runs one search.
   *
   * @param request the query, claims, filters, as-of instant and page
   * @return the ranked, access-filtered, version-resolved page
   * @throws InvalidQueryException if the query is empty or too long, or the page is too large
   * @throws UnauthorizedException if the principal carries no claims
   * @throws UpstreamUnavailableException if neither branch (or the content store) can be read
   * @throws UpstreamTimeoutException if the deadline elapses before fusion completes
   */
  public RankedResults search(SearchRequest request) {
    Duration deadline = request.timeout() != null ? request.timeout() : searchProperties.getTimeout();
    long deadlineNanos = System.nanoTime() + deadline.toNanos();

    String query = QueryNormalizer.normalise(request.query());
    if (query.length() > searchProperties.getMaxQueryLength()) {
      throw new InvalidQueryException(
          "Query exceeds " + searchProperties.getMaxQueryLength() + " characters");
    }
    if (request.limit() > searchProperties.getMaxPageSize()) {
      throw new InvalidQueryException(
          "limit must be at most " + searchProperties.getMaxPageSize());
    }
    Principal principal = request.principal();
    accessFilter.requireClaims(principal);

    QueryType queryType =
        QueryClassifier.classify(
            query,
            searchProperties.getFactualMaxTokens(),
            searchProperties.getConceptualMinTokens());
    Instant asOf = request.asOf() != null ? request.asOf() : clock.instant();
    CacheKey key =
        new CacheKey(
            query,
            request.filters().cacheToken(),
            request.asOf() != null ? request.asOf().toString() : AS_OF_NOW,
            request.offset(),
            request.limit(),
            principal.scopeFingerprint());
    TtlClass ttlClass = frequencyTracker.recordLookup(query);
    log.debug("Query '{}' classified {}, ttl class {}", query, queryType, ttlClass);

    Optional<CachedResults> cached = resultCache.get(key);
    if (cached.isPresent()) {
      Optional<List<SearchResult>> hydrated = hydrate(cached.get(), principal, asOf);
      if (hydrated.isPresent()) {
        log.debug("Cache hit for '{}' ({} results)", query, hydrated.get().size());
        return new RankedResults(
            hydrated.get(), queryType, false, true, asOf, request.offset(), request.limit());
      }
      log.debug("Cached page for '{}' no longer resolves; recomputing", query);
      resultCache.evict(key);
    }

    Retrieval retrieval =
        retrieve(query, request.filters(), asOf, deadline, deadlineNanos);
    List<FusedCandidate> fused =
        ConvexCombinationFusion.fuse(
            retrieval.semantic(),
            retrieval.lexical(),
            searchProperties.weightsFor(queryType),
            retrieval.size());
    if (System.nanoTime() - deadlineNanos > 0) {
      log.warn("Search for '{}' exceeded its {} ms deadline during fusion", query, deadline.toMillis());
      throw new UpstreamTimeoutException(deadline);
    }

    List<ResolvedCandidate> resolved = filterAndResolve(principal, fused, asOf);
    List<ResolvedCandidate> page = page(resolved, request.offset(), request.limit());
    List<SearchResult> results = page.stream().map(ResolvedCandidate::toResult).toList();

    if (retrieval.degraded()) {
      log.warn("Serving degraded results for '{}' (not cached)", query);
    } else {
      resultCache.put(key, toCached(page, queryType), ttlClass);
    }
    return new RankedResults(
        results, queryType, retrieval.degraded(), false, asOf, request.offset(), request.limit());
  }

  /**
   * Drops every cached page referencing the item.
   *
   * @return number of pages dropped
   */
  public int invalidate(UUID contentItemId) {
    int dropped = resultCache.invalidate(contentItemId);
    log.info("Invalidated {} cached page(s) for content item {}", dropped, contentItemId);
    return dropped;
  }

  private Retrieval retrieve(
      String query, SearchFilters filters, Instant asOf, Duration deadline, long deadlineNanos) {
    int topK = searchProperties.getCandidates();
    Future<List<ScoredCandidate>> lexical =
        searchProperties.isLexicalEnabled()
            ? dispatch("lexical", () -> lexicalRetriever.retrieve(query, filters, asOf, topK))
            : null;
    Future<List<ScoredCandidate>> semantic =
        searchProperties.isSemanticEnabled()
            ? dispatch("semantic", () -> semanticRetriever.retrieve(query, filters, asOf, topK))
            : null;

    List<ScoredCandidate> lexicalResults;
    List<ScoredCandidate> semanticResults;
    try {
      lexicalResults = await("lexical", lexical, deadlineNanos);
      semanticResults = await("semantic", semantic, deadlineNanos);
    } catch (TimeoutException e) {
      cancel(lexical);
      cancel(semantic);
      log.warn("Search for '{}' timed out after {} ms", query, deadline.toMillis());
      throw new UpstreamTimeoutException(deadline);
    }

    if (lexicalResults == null && semanticResults == null) {
      throw new UpstreamUnavailableException("No retrieval branch is available");
    }
    boolean degraded = lexicalResults == null || semanticResults == null;
    return new Retrieval(
        lexicalResults != null ? lexicalResults : List.of(),
        semanticResults != null ? semanticResults : List.of(),
        degraded);
  }

  /** Submits one branch; a saturated or stopped pool yields an already failed branch. */
  private Future<List<ScoredCandidate>> dispatch(
      String branch, Callable<List<ScoredCandidate>> task) {
    try {
      return searchExecutor.submit(task);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new UpstreamUnavailableException(branch + " retrieval rejected by search executor", e));
    }
  }

  /** Waits for one branch; null means the branch is disabled or failed. */
  private @Nullable List<ScoredCandidate> await(
      String branch, @Nullable Future<List<ScoredCandidate>> future, long deadlineNanos)
      throws TimeoutException {
    if (future == null) {
      log.debug("{} retrieval disabled by configuration", branch);
      return null;
    }
    long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("{} retrieval failed, continuing without it: {}", branch, cause.toString());
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamUnavailableException("Interrupted while waiting for " + branch + " retrieval", e);
    }
  }

  /** Interrupts the worker still running the branch, releasing its pool thread. */
  private static void cancel(@Nullable Future<?> future) {
    if (future != null) {
      future.cancel(true);
    }
  }

  private List<ResolvedCandidate> filterAndResolve(
      Principal principal, List<FusedCandidate> fused, Instant asOf) {
    if (fused.isEmpty()) {
      return List.of();
    }
    Set<UUID> ids =
        fused.stream().map(FusedCandidate::contentItemId).collect(Collectors.toSet());
    Map<UUID, ContentItem> items = loadItems(ids);
    Map<UUID, List<ContentVersion>> versions = loadVersions(ids);

    List<ResolvedCandidate> resolved = new ArrayList<>();
    for (FusedCandidate candidate : accessFilter.filter(principal, fused, items)) {
      try {
        ContentVersion version =
            versionResolver.resolve(
                candidate.contentItemId(),
                versions.getOrDefault(candidate.contentItemId(), List.of()),
                asOf);
        resolved.add(new ResolvedCandidate(candidate, version));
      } catch (NoValidVersionException e) {
        log.warn("Dropping candidate: {}", e.getMessage());
      }
    }
    return resolved;
  }

  /**
   * Rebuilds a cached page from the content store. Empty if any reference no longer resolves to
   * the cached version and hash, or is no longer readable by the principal.
   */
  private Optional<List<SearchResult>> hydrate(
      CachedResults cached, Principal principal, Instant asOf) {
    if (cached.hits().isEmpty()) {
      return Optional.of(List.of());
    }
    Set<UUID> ids = cached.contentItemIds();
    Map<UUID, ContentItem> items = loadItems(ids);
    Map<UUID, List<ContentVersion>> versions = loadVersions(ids);

    List<SearchResult> results = new ArrayList<>(cached.hits().size());
    for (CachedResults.Hit hit : cached.hits()) {
      ContentItem item = items.get(hit.contentItemId());
      if (item == null || !accessFilter.canRead(principal, item)) {
        return Optional.empty();
      }
      ContentVersion version;
      try {
        version =
            versionResolver.resolve(
                hit.contentItemId(), versions.getOrDefault(hit.contentItemId(), List.of()), asOf);
      } catch (NoValidVersionException e) {
        return Optional.empty();
      }
      if (!version.getId().equals(hit.versionId())
          || !version.getContentHash().equals(hit.contentHash())) {
        return Optional.empty();
      }
      results.add(
          toResult(version, hit.score(), hit.semanticScore(), hit.lexicalScore()));
    }
    return Optional.of(results);
  }

  private Map<UUID, ContentItem> loadItems(Collection<UUID> ids) {
    try {
      return contentItemRepository.findAllById(ids).stream()
          .collect(Collectors.toMap(ContentItem::getId, Function.identity()));
    } catch (DataAccessException e) {
      throw new UpstreamUnavailableException("Content store unavailable", e);
    }
  }

  private Map<UUID, List<ContentVersion>> loadVersions(Collection<UUID> ids) {
    try {
      return contentVersionRepository.findByContentItemIdIn(ids).stream()
          .collect(Collectors.groupingBy(ContentVersion::getContentItemId));
    } catch (DataAccessException e) {
      throw new UpstreamUnavailableException("Content store unavailable", e);
    }
  }

  private static <T> List<T> page(List<T> all, int offset, int limit) {
    if (offset >= all.size()) {
      return List.of();
    }
    return List.copyOf(all.subList(offset, Math.min(all.size(), offset + limit)));
  }

  private CachedResults toCached(List<ResolvedCandidate> page, QueryType queryType) {
    List<CachedResults.Hit> hits =
        page.stream()
            .map(
                r ->
                    new CachedResults.Hit(
                        r.candidate().contentItemId(),
                        r.version().getId(),
                        r.version().getContentHash(),
                        r.candidate().fusedScore(),
                        r.candidate().semanticScore(),
                        r.candidate().lexicalScore()))
            .toList();
    return new CachedResults(hits, queryType.name(), clock.instant());
  }

  private static SearchResult toResult(
      ContentVersion version, double score, double semanticScore, double lexicalScore) {
    return new SearchResult(
        version.getContentItemId(),
        version.getId(),
        version.getVersionNumber(),
        version.getTitle(),
        version.getSummary(),
        version.getText(),
        score,
        semanticScore,
        lexicalScore,
        version.getValidFrom(),
        version.getValidTo());
  }

  private record Retrieval(
      List<ScoredCandidate> lexical, List<ScoredCandidate> semantic, boolean degraded) {

    int size() {
      return Math.max(1, lexical.size() + semantic.size());
    }
  }

  private record ResolvedCandidate(FusedCandidate candidate, ContentVersion version) {

    SearchResult toResult() {
      return SearchService.toResult(
          version, candidate.fusedScore(), candidate.semanticScore(), candidate.lexicalScore());
    }
  }
}
