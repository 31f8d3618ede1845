package dev.athenaeum.api;

import dev.athenaeum.ingestion.ContentDraft;
import dev.athenaeum.ingestion.ContentIndexer;
import dev.athenaeum.ingestion.ContentIndexer.IndexResult;
import dev.athenaeum.search.SearchService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative endpoints used by the editing collaborator: index new text, list an item's
 * versions, retire an item, change its visibility and force cache invalidation.
 */
@RestController
@RequestMapping("/api/content")
public class ContentAdminController {

  private final ContentIndexer contentIndexer;
  private final SearchService searchService;

  public ContentAdminController(ContentIndexer contentIndexer, SearchService searchService) {
    this.contentIndexer = contentIndexer;
    this.searchService = searchService;
  }

  @PostMapping
  public IndexResult index(@RequestBody ContentDraft draft) {
    return contentIndexer.indexVersion(draft);
  }

  @GetMapping("/{id}/versions")
  public ResponseEntity<List<VersionSummary>> versions(@PathVariable UUID id) {
    return contentIndexer
        .history(id)
        .map(history -> ResponseEntity.ok(history.stream().map(VersionSummary::from).toList()))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/{id}/retire")
  public ResponseEntity<Map<String, Object>> retire(
      @PathVariable UUID id, @RequestParam(required = false) @Nullable Instant at) {
    boolean retired = contentIndexer.retire(id, at);
    return ResponseEntity.ok(Map.of("contentItemId", id, "retired", retired));
  }

  @PutMapping("/{id}/access")
  public ResponseEntity<Void> updateAccess(
      @PathVariable UUID id, @RequestBody AccessUpdateBody body) {
    contentIndexer.updateAccess(
        id, body.tenantPath(), body.requiredRoles() != null ? body.requiredRoles() : List.of());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/invalidate")
  public ResponseEntity<Map<String, Object>> invalidate(@PathVariable UUID id) {
    int dropped = searchService.invalidate(id);
    return ResponseEntity.ok(Map.of("contentItemId", id, "invalidated", dropped));
  }
}
