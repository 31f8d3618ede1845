package dev.athenaeum.mcp;

import dev.athenaeum.search.InvalidQueryException;
import dev.athenaeum.search.QueryType;
import dev.athenaeum.search.RankedResults;
import dev.athenaeum.search.SearchProperties;
import dev.athenaeum.search.SearchRequest;
import dev.athenaeum.search.SearchResult;
import dev.athenaeum.search.SearchService;
import dev.athenaeum.search.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @Mock
    SearchService searchService;

    @Captor
    ArgumentCaptor<SearchRequest> requestCaptor;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(searchService, new SearchProperties(),
                new TokenBudgetTruncator(5000));
    }

    private static SearchResult result(String title, String text) {
        return new SearchResult(UUID.randomUUID(), UUID.randomUUID(), 2, title, null, text,
                0.69, 0.9, 0.2, Instant.parse("2024-01-01T00:00:00Z"), null);
    }

    private static RankedResults ranked(boolean degraded, SearchResult... results) {
        return new RankedResults(List.of(results), QueryType.MIXED, degraded, false, NOW, 0, 10);
    }

    // --- search_knowledge ---

    @Test
    void searchKnowledgeFormatsResults() {
        given(searchService.search(any())).willReturn(
                ranked(false, result("Shape of the earth", "The earth is an oblate spheroid.")));

        String output = mcpToolService.searchKnowledge("shape of the earth", "reader", null,
                null, null, null, null, null);

        assertThat(output).contains("## [1] Shape of the earth (v2)");
        assertThat(output).contains("Score: 0.690 (semantic 0.900, lexical 0.200)");
        assertThat(output).contains("Valid: 2024-01-01T00:00:00Z .. current");
        assertThat(output).contains("The earth is an oblate spheroid.");
    }

    @Test
    void searchKnowledgePassesClaimsFiltersAndAsOf() {
        given(searchService.search(requestCaptor.capture())).willReturn(ranked(false));

        mcpToolService.searchKnowledge("earth", "reader, editor", "acme/legal", "geo", "intro",
                "wiki", "2024-03-01T00:00:00Z", 5);

        SearchRequest request = requestCaptor.getValue();
        assertThat(request.principal().roles()).containsExactlyInAnyOrder("reader", "editor");
        assertThat(request.principal().tenants()).containsExactly("acme/legal");
        assertThat(request.filters().categoryId()).isEqualTo("geo");
        assertThat(request.filters().tag()).isEqualTo("intro");
        assertThat(request.filters().sourceType()).isEqualTo("wiki");
        assertThat(request.asOf()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(request.limit()).isEqualTo(5);
    }

    @Test
    void searchKnowledgeClampsMaxResults() {
        given(searchService.search(requestCaptor.capture())).willReturn(ranked(false));

        mcpToolService.searchKnowledge("earth", "reader", null, null, null, null, null, 500);
        assertThat(requestCaptor.getValue().limit()).isEqualTo(50);

        mcpToolService.searchKnowledge("earth", "reader", null, null, null, null, null, 0);
        assertThat(requestCaptor.getValue().limit()).isEqualTo(10);
    }

    @Test
    void searchKnowledgeFlagsDegradedResults() {
        given(searchService.search(any())).willReturn(ranked(true, result("Title", "Body")));

        String output = mcpToolService.searchKnowledge("earth", "reader", null, null, null, null,
                null, null);

        assertThat(output).startsWith("Note: partial results");
    }

    @Test
    void searchKnowledgeWithEmptyQueryReturnsError() {
        String output = mcpToolService.searchKnowledge("  ", "reader", null, null, null, null,
                null, null);

        assertThat(output).isEqualTo("Error: Query must not be empty. Provide a search query string.");
        verifyNoInteractions(searchService);
    }

    @Test
    void searchKnowledgeWithMalformedAsOfReturnsError() {
        String output = mcpToolService.searchKnowledge("earth", "reader", null, null, null, null,
                "yesterday", null);

        assertThat(output).startsWith("Error: asOf must be an ISO-8601 instant");
        verifyNoInteractions(searchService);
    }

    @Test
    void searchKnowledgeReportsSearchErrors() {
        given(searchService.search(any()))
                .willThrow(new UnauthorizedException("Request carries no role or tenant claims"));

        String output = mcpToolService.searchKnowledge("earth", null, null, null, null, null,
                null, null);

        assertThat(output).isEqualTo("Error: Request carries no role or tenant claims");
    }

    @Test
    void searchKnowledgeReportsUnexpectedErrors() {
        given(searchService.search(any())).willThrow(new IllegalStateException("boom"));

        String output = mcpToolService.searchKnowledge("earth", "reader", null, null, null, null,
                null, null);

        assertThat(output).isEqualTo("Error searching knowledge base: boom");
    }

    @Test
    void searchKnowledgeWithNoResultsMentionsActiveFilters() {
        given(searchService.search(any())).willReturn(ranked(false));

        String plain = mcpToolService.searchKnowledge("earth", "reader", null, null, null, null,
                null, null);
        String filtered = mcpToolService.searchKnowledge("earth", "reader", null, "geo", null,
                "wiki", null, null);

        assertThat(plain).isEqualTo("No results found for query: earth");
        assertThat(filtered).isEqualTo(
                "No results for query 'earth' with filters [category='geo', sourceType='wiki'].");
    }

    @Test
    void searchKnowledgeOverlongQueryReportsInvalidQuery() {
        given(searchService.search(any()))
                .willThrow(new InvalidQueryException("Query exceeds 1000 characters"));

        String output = mcpToolService.searchKnowledge("earth", "reader", null, null, null, null,
                null, null);

        assertThat(output).isEqualTo("Error: Query exceeds 1000 characters");
    }

    // --- invalidate_content ---

    @Test
    void invalidateContentReportsDroppedPages() {
        UUID itemId = UUID.randomUUID();
        given(searchService.invalidate(itemId)).willReturn(2);

        String output = mcpToolService.invalidateContent(itemId.toString());

        assertThat(output).isEqualTo(
                "Invalidated 2 cached result page(s) for content item " + itemId + ".");
        verify(searchService).invalidate(itemId);
    }

    @Test
    void invalidateContentRejectsMalformedId() {
        String output = mcpToolService.invalidateContent("not-a-uuid");

        assertThat(output).isEqualTo("Error: 'not-a-uuid' is not a valid UUID.");
        verifyNoInteractions(searchService);
    }

    @Test
    void invalidateContentRejectsEmptyId() {
        assertThat(mcpToolService.invalidateContent(" "))
                .isEqualTo("Error: contentItemId must not be empty.");
    }
}
