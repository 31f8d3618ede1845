package dev.athenaeum.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.athenaeum.cache.CacheProperties;
import dev.athenaeum.cache.QueryFrequencyTracker;
import dev.athenaeum.cache.SearchResultCache;
import dev.athenaeum.content.ContentItem;
import dev.athenaeum.content.ContentItemRepository;
import dev.athenaeum.content.ContentVersion;
import dev.athenaeum.content.ContentVersionRepository;
import dev.athenaeum.fixture.ContentItemBuilder;
import dev.athenaeum.fixture.ContentVersionBuilder;
import dev.athenaeum.fixture.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

  private static final String QUERY = "shape of the earth";
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
  private static final Principal READER = new Principal("u1", Set.of("reader"), Set.of("acme"));

  @Mock LexicalRetriever lexicalRetriever;

  @Mock SemanticRetriever semanticRetriever;

  @Mock ContentItemRepository contentItemRepository;

  @Mock ContentVersionRepository contentVersionRepository;

  private final MutableClock clock = new MutableClock(NOW);
  private SearchProperties searchProperties;
  private SearchResultCache resultCache;
  private ExecutorService executor;
  private SearchService searchService;

  private final ContentItem itemA = new ContentItemBuilder().title("Earth shape").build();
  private final ContentItem itemB = new ContentItemBuilder().title("Flat earth myths").build();
  private final ContentVersion versionA =
      new ContentVersionBuilder().contentItemId(itemA.getId()).validFrom(T0).build();
  private final ContentVersion versionB =
      new ContentVersionBuilder().contentItemId(itemB.getId()).validFrom(T0).build();

  @BeforeEach
  void setUp() {
    searchProperties = new SearchProperties();
    CacheProperties cacheProperties = new CacheProperties();
    resultCache = new SearchResultCache(cacheProperties, clock);
    executor = Executors.newFixedThreadPool(2);
    searchService =
        new SearchService(
            lexicalRetriever,
            semanticRetriever,
            contentItemRepository,
            contentVersionRepository,
            new AccessFilter(),
            new VersionResolver(),
            resultCache,
            new QueryFrequencyTracker(cacheProperties, clock),
            searchProperties,
            executor,
            clock);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  // --- Helpers ---

  private static ScoredCandidate scored(ContentVersion version, double score) {
    return new ScoredCandidate(
        version.getContentItemId(), version.getId(), version.getValidFrom(), score);
  }

  private void stubLexical(List<ScoredCandidate> candidates) {
    when(lexicalRetriever.retrieve(eq(QUERY), any(), any(), anyInt())).thenReturn(candidates);
  }

  private void stubSemantic(List<ScoredCandidate> candidates) {
    when(semanticRetriever.retrieve(eq(QUERY), any(), any(), anyInt())).thenReturn(candidates);
  }

  private void stubStore(List<ContentItem> items, List<ContentVersion> versions) {
    when(contentItemRepository.findAllById(any())).thenReturn(items);
    when(contentVersionRepository.findByContentItemIdIn(any())).thenReturn(versions);
  }

  private void stubTwoItemCorpus() {
    stubSemantic(List.of(scored(versionA, 0.9), scored(versionB, 0.6)));
    stubLexical(List.of(scored(versionA, 2.0), scored(versionB, 1.0)));
    stubStore(List.of(itemA, itemB), List.of(versionA, versionB));
  }

  // --- Pipeline ---

  @Test
  void fusesBothBranchesAndResolvesVersions() {
    stubTwoItemCorpus();

    RankedResults ranked = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(ranked.degraded()).isFalse();
    assertThat(ranked.cached()).isFalse();
    assertThat(ranked.queryType()).isEqualTo(QueryType.MIXED);
    assertThat(ranked.asOf()).isEqualTo(NOW);
    assertThat(ranked.results())
        .extracting(SearchResult::versionId)
        .containsExactly(versionA.getId(), versionB.getId());
    assertThat(ranked.results().get(0).text()).isEqualTo(versionA.getText());
    assertThat(ranked.results().get(0).score()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void retrievalUsesConfiguredCandidatePoolAndAsOf() {
    searchProperties.setCandidates(20);
    stubTwoItemCorpus();

    searchService.search(new SearchRequest(QUERY, READER));

    verify(lexicalRetriever).retrieve(QUERY, SearchFilters.none(), NOW, 20);
    verify(semanticRetriever).retrieve(QUERY, SearchFilters.none(), NOW, 20);
  }

  // --- Cache ---

  @Test
  void repeatedQueryIsServedFromCacheWithIdenticalResults() {
    stubTwoItemCorpus();

    RankedResults first = searchService.search(new SearchRequest(QUERY, READER));
    RankedResults second = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(second.cached()).isTrue();
    assertThat(second.results()).isEqualTo(first.results());
    verify(lexicalRetriever, times(1)).retrieve(any(), any(), any(), anyInt());
    verify(semanticRetriever, times(1)).retrieve(any(), any(), any(), anyInt());
  }

  @Test
  void equivalentQueryTextSharesCacheEntry() {
    stubTwoItemCorpus();

    searchService.search(new SearchRequest("Shape of the EARTH", READER));
    RankedResults second = searchService.search(new SearchRequest("  shape  of the earth ", READER));

    assertThat(second.cached()).isTrue();
  }

  @Test
  void invalidationForcesRecompute() {
    stubTwoItemCorpus();
    searchService.search(new SearchRequest(QUERY, READER));

    int dropped = searchService.invalidate(itemA.getId());
    RankedResults again = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(dropped).isEqualTo(1);
    assertThat(again.cached()).isFalse();
    verify(lexicalRetriever, times(2)).retrieve(any(), any(), any(), anyInt());
  }

  @Test
  void cachedPageReferencingSupersededVersionIsRecomputed() {
    stubSemantic(List.of(scored(versionA, 0.9)));
    stubLexical(List.of());
    ContentVersion successor =
        new ContentVersionBuilder()
            .contentItemId(itemA.getId())
            .versionNumber(2)
            .validFrom(NOW.minusSeconds(60))
            .build();
    when(contentItemRepository.findAllById(any())).thenReturn(List.of(itemA));
    when(contentVersionRepository.findByContentItemIdIn(any()))
        .thenReturn(List.of(versionA), List.of(versionA, successor));

    searchService.search(new SearchRequest(QUERY, READER));
    versionA.close(NOW.minusSeconds(60));
    RankedResults after = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(after.cached()).isFalse();
    assertThat(after.results()).extracting(SearchResult::versionId).containsExactly(successor.getId());
  }

  @Test
  void cachedPageIsNotServedOnceItemBecomesRestricted() {
    stubTwoItemCorpus();
    RankedResults first = searchService.search(new SearchRequest(QUERY, READER));
    assertThat(first.results())
        .extracting(SearchResult::contentItemId)
        .contains(itemB.getId());

    itemB.setRequiredRoles(ContentItem.joinCommaSeparated(List.of("admin")));
    RankedResults second = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(second.cached()).isFalse();
    assertThat(second.results())
        .extracting(SearchResult::contentItemId)
        .containsExactly(itemA.getId());
    verify(lexicalRetriever, times(2)).retrieve(any(), any(), any(), anyInt());
  }

  @Test
  void differentAccessScopeDoesNotShareCache() {
    stubTwoItemCorpus();
    Principal editor = new Principal("u2", Set.of("editor"), Set.of("acme"));

    searchService.search(new SearchRequest(QUERY, READER));
    RankedResults other = searchService.search(new SearchRequest(QUERY, editor));

    assertThat(other.cached()).isFalse();
  }

  @Test
  void sameScopeDifferentIdentifierSharesCache() {
    stubTwoItemCorpus();
    Principal sameScope = new Principal("someone-else", Set.of("reader"), Set.of("acme"));

    searchService.search(new SearchRequest(QUERY, READER));

    assertThat(searchService.search(new SearchRequest(QUERY, sameScope)).cached()).isTrue();
  }

  @Test
  void cacheEntryExpiresAfterTtl() {
    stubTwoItemCorpus();
    searchService.search(new SearchRequest(QUERY, READER));

    clock.advance(Duration.ofHours(2));
    RankedResults later = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(later.cached()).isFalse();
  }

  // --- Failure handling ---

  @Test
  void failingBranchDegradesAndIsNotCached() {
    stubLexical(List.of(scored(versionA, 2.0)));
    when(semanticRetriever.retrieve(eq(QUERY), any(), any(), anyInt()))
        .thenThrow(new IllegalStateException("embedding store down"));
    stubStore(List.of(itemA), List.of(versionA));

    RankedResults first = searchService.search(new SearchRequest(QUERY, READER));
    RankedResults second = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(first.degraded()).isTrue();
    assertThat(first.results()).extracting(SearchResult::contentItemId).containsExactly(itemA.getId());
    assertThat(second.cached()).isFalse();
  }

  @Test
  void disabledBranchCountsAsDegraded() {
    searchProperties.setSemanticEnabled(false);
    stubLexical(List.of(scored(versionA, 2.0)));
    stubStore(List.of(itemA), List.of(versionA));

    RankedResults ranked = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(ranked.degraded()).isTrue();
    verifyNoInteractions(semanticRetriever);
  }

  @Test
  void bothBranchesFailingThrowsUpstreamUnavailable() {
    when(lexicalRetriever.retrieve(eq(QUERY), any(), any(), anyInt()))
        .thenThrow(new IllegalStateException("db down"));
    when(semanticRetriever.retrieve(eq(QUERY), any(), any(), anyInt()))
        .thenThrow(new IllegalStateException("store down"));

    assertThatThrownBy(() -> searchService.search(new SearchRequest(QUERY, READER)))
        .isInstanceOf(UpstreamUnavailableException.class);
  }

  @Test
  void slowBranchPastDeadlineThrowsUpstreamTimeout() {
    when(lexicalRetriever.retrieve(eq(QUERY), any(), any(), anyInt()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(2_000);
              return List.of();
            });
    SearchRequest request =
        new SearchRequest(QUERY, READER, null, null, 0, 10, Duration.ofMillis(100));

    assertThatThrownBy(() -> searchService.search(request))
        .isInstanceOf(UpstreamTimeoutException.class)
        .satisfies(
            e -> assertThat(((UpstreamTimeoutException) e).getDeadline())
                .isEqualTo(Duration.ofMillis(100)));
  }

  @Test
  void branchStillRunningAtDeadlineIsInterrupted() throws InterruptedException {
    CountDownLatch interrupted = new CountDownLatch(1);
    when(lexicalRetriever.retrieve(eq(QUERY), any(), any(), anyInt()))
        .thenAnswer(
            invocation -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
              return List.of();
            });
    SearchRequest request =
        new SearchRequest(QUERY, READER, null, null, 0, 10, Duration.ofMillis(100));

    assertThatThrownBy(() -> searchService.search(request))
        .isInstanceOf(UpstreamTimeoutException.class);
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void rejectedDispatchCountsAsUnavailableBranch() {
    executor.shutdownNow();

    assertThatThrownBy(() -> searchService.search(new SearchRequest(QUERY, READER)))
        .isInstanceOf(UpstreamUnavailableException.class);
    verifyNoInteractions(lexicalRetriever, semanticRetriever);
  }

  @Test
  void contentStoreFailureThrowsUpstreamUnavailable() {
    stubSemantic(List.of(scored(versionA, 0.9)));
    stubLexical(List.of());
    when(contentItemRepository.findAllById(any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> searchService.search(new SearchRequest(QUERY, READER)))
        .isInstanceOf(UpstreamUnavailableException.class);
  }

  // --- Validation and access ---

  @Test
  void principalWithoutClaimsIsRejectedBeforeRetrieval() {
    Principal anonymous = new Principal(null, Set.of(), Set.of());

    assertThatThrownBy(() -> searchService.search(new SearchRequest(QUERY, anonymous)))
        .isInstanceOf(UnauthorizedException.class);
    verifyNoInteractions(lexicalRetriever, semanticRetriever);
  }

  @Test
  void overlongQueryIsRejected() {
    searchProperties.setMaxQueryLength(10);

    assertThatThrownBy(() -> searchService.search(new SearchRequest(QUERY, READER)))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("10");
  }

  @Test
  void pageLargerThanMaximumIsRejected() {
    SearchRequest request = new SearchRequest(QUERY, READER, SearchFilters.none(), 0, 51);

    assertThatThrownBy(() -> searchService.search(request))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void restrictedItemsAreFilteredBeforePaging() {
    ContentItem restricted = new ContentItemBuilder().requiredRoles("hr").build();
    ContentItem itemC = new ContentItemBuilder().build();
    ContentVersion restrictedVersion =
        new ContentVersionBuilder().contentItemId(restricted.getId()).validFrom(T0).build();
    ContentVersion versionC =
        new ContentVersionBuilder().contentItemId(itemC.getId()).validFrom(T0).build();
    stubSemantic(
        List.of(scored(versionA, 0.9), scored(restrictedVersion, 0.8), scored(versionC, 0.7)));
    stubLexical(List.of());
    stubStore(
        List.of(itemA, restricted, itemC), List.of(versionA, restrictedVersion, versionC));

    RankedResults page =
        searchService.search(new SearchRequest(QUERY, READER, SearchFilters.none(), 1, 1));

    assertThat(page.results()).extracting(SearchResult::contentItemId).containsExactly(itemC.getId());
    assertThat(page.offset()).isEqualTo(1);
  }

  @Test
  void candidateWithoutValidVersionIsDropped() {
    ContentVersion future =
        new ContentVersionBuilder().contentItemId(itemB.getId()).validFrom(NOW.plusSeconds(3600)).build();
    stubSemantic(List.of(scored(versionA, 0.9), scored(future, 0.8)));
    stubLexical(List.of());
    stubStore(List.of(itemA, itemB), List.of(versionA, future));

    RankedResults ranked = searchService.search(new SearchRequest(QUERY, READER));

    assertThat(ranked.results()).extracting(SearchResult::contentItemId).containsExactly(itemA.getId());
  }

  @Test
  void asOfResolvesHistoricalVersion() {
    Instant t1 = Instant.parse("2024-03-01T00:00:00Z");
    ContentVersion v1 =
        new ContentVersionBuilder().contentItemId(itemA.getId()).validFrom(T0).validTo(t1).build();
    ContentVersion v2 =
        new ContentVersionBuilder().contentItemId(itemA.getId()).versionNumber(2).validFrom(t1).build();
    stubSemantic(List.of(scored(v1, 0.9)));
    stubLexical(List.of());
    stubStore(List.of(itemA), List.of(v1, v2));

    RankedResults ranked =
        searchService.search(
            new SearchRequest(QUERY, READER, null, t1.minusMillis(1), 0, 10, null));

    assertThat(ranked.asOf()).isEqualTo(t1.minusMillis(1));
    assertThat(ranked.results()).extracting(SearchResult::versionId).containsExactly(v1.getId());
  }
}
