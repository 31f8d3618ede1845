package dev.athenaeum.ingestion;

import dev.athenaeum.content.ContentChangedEvent;
import dev.athenaeum.content.ContentChangedEvent.ChangeType;
import dev.athenaeum.content.ContentHasher;
import dev.athenaeum.content.ContentItem;
import dev.athenaeum.content.ContentItemRepository;
import dev.athenaeum.content.ContentVersion;
import dev.athenaeum.content.ContentVersionRepository;
import dev.athenaeum.content.EmbeddingMetadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Write side of the content store: turns drafts into versioned snapshots and their embeddings.
 *
 * <p>Indexing a draft closes the item's current version at the new version's {@code valid_from},
 * stores the new version row, embeds the snapshot under {@code embedding_id = version id} and
 * publishes a {@link ContentChangedEvent}. Listeners drop cached pages only after the
 * transaction commits.
 *
 * <p>A draft naming its item always lands on that item. A draft without an item id is matched
 * to an existing item by its SHA-256 document hash, so re-submitting known text adds no new
 * item. Text identical to the target item's current version is skipped entirely and never
 * creates a duplicate vector entry.
 */
@Service
public class ContentIndexer {

    private static final Logger log = LoggerFactory.getLogger(ContentIndexer.class);

    private final ContentItemRepository contentItemRepository;
    private final ContentVersionRepository contentVersionRepository;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final EmbeddingModel embeddingModel;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ContentIndexer(ContentItemRepository contentItemRepository,
                          ContentVersionRepository contentVersionRepository,
                          EmbeddingStore<TextSegment> embeddingStore,
                          EmbeddingModel embeddingModel,
                          ApplicationEventPublisher eventPublisher,
                          Clock clock) {
        this.contentItemRepository = contentItemRepository;
        this.contentVersionRepository = contentVersionRepository;
        this.embeddingStore = embeddingStore;
        this.embeddingModel = embeddingModel;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Stores a draft as the new current version of its item.
     *
     * @param draft the new text and item metadata
     * @return the item and version ids, or a skipped result if the text is already indexed
     * @throws IllegalArgumentException if the draft's {@code validFrom} does not come after the
     *                                  item's latest version
     */
    @Transactional
    public IndexResult indexVersion(ContentDraft draft) {
        String hash = ContentHasher.documentHash(draft.title(), draft.summary(), draft.text());
        Instant validFrom = draft.validFrom() != null ? draft.validFrom() : clock.instant();

        UUID requestedId = draft.contentItemId();
        Optional<ContentItem> existing = requestedId != null
                ? contentItemRepository.findById(requestedId)
                : contentItemRepository.findFirstByContentHashOrderByCreatedAtAsc(hash);
        if (existing.isPresent() && hash.equals(existing.get().getContentHash())
                && hasCurrentVersion(existing.get().getId())) {
            log.debug("Content unchanged for item {}, skipping indexing", existing.get().getId());
            return IndexResult.skipped(existing.get().getId());
        }

        UUID itemId = existing.map(ContentItem::getId)
                .orElse(requestedId != null ? requestedId : UUID.randomUUID());

        List<ContentVersion> history =
                contentVersionRepository.findByContentItemIdIn(List.of(itemId));
        Optional<ContentVersion> latest =
                history.stream().max(Comparator.comparingInt(ContentVersion::getVersionNumber));
        ChangeType changeType = ChangeType.CREATED;
        if (latest.isPresent()) {
            ContentVersion previous = latest.get();
            Instant floor = previous.isCurrent() ? previous.getValidFrom() : previous.getValidTo();
            if (!validFrom.isAfter(floor)) {
                throw new IllegalArgumentException("validFrom " + validFrom
                        + " must be after " + floor + " for content item " + itemId);
            }
            if (previous.isCurrent()) {
                closeVersion(previous, validFrom);
                changeType = ChangeType.SUPERSEDED;
            }
        }

        ContentItem item = existing.orElseGet(
                () -> new ContentItem(itemId, draft.title(), hash, draft.sourceType()));
        applyDraft(item, draft, hash);
        contentItemRepository.save(item);

        int versionNumber = latest.map(v -> v.getVersionNumber() + 1).orElse(1);
        ContentVersion version = new ContentVersion(UUID.randomUUID(), itemId, versionNumber,
                draft.title(), draft.summary(), draft.text(), hash, validFrom);
        version.setCreatedBy(draft.author());
        contentVersionRepository.save(version);

        storeEmbedding(item, version);
        eventPublisher.publishEvent(new ContentChangedEvent(itemId, changeType, validFrom));

        log.debug("Indexed content item {} version {} ({})", itemId, versionNumber, changeType);
        return new IndexResult(itemId, version.getId(), versionNumber, false);
    }

    /**
     * Closes the current version of an item without a successor.
     *
     * @param contentItemId the item
     * @param at end of validity; null means now
     * @return true if a current version was closed, false if the item was already retired
     */
    @Transactional
    public boolean retire(UUID contentItemId, @Nullable Instant at) {
        Instant when = at != null ? at : clock.instant();
        Optional<ContentVersion> current =
                contentVersionRepository.findByContentItemIdAndValidToIsNull(contentItemId);
        if (current.isEmpty()) {
            log.debug("Content item {} has no current version, nothing to retire", contentItemId);
            return false;
        }
        closeVersion(current.get(), when);
        eventPublisher.publishEvent(new ContentChangedEvent(contentItemId, ChangeType.RETIRED, when));
        log.info("Retired content item {} at {}", contentItemId, when);
        return true;
    }

    /**
     * Replaces the visibility scope of an item.
     *
     * @param contentItemId the item
     * @param tenantPath new tenant scope; null makes the item platform-wide
     * @param requiredRoles new required roles; empty means any role
     * @throws IllegalArgumentException if the item does not exist
     */
    @Transactional
    public void updateAccess(UUID contentItemId, @Nullable String tenantPath,
                             List<String> requiredRoles) {
        ContentItem item = contentItemRepository.findById(contentItemId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown content item: " + contentItemId));
        item.setTenantPath(tenantPath);
        item.setRequiredRoles(ContentItem.joinCommaSeparated(requiredRoles));
        contentItemRepository.save(item);
        eventPublisher.publishEvent(
                new ContentChangedEvent(contentItemId, ChangeType.ACCESS_CHANGED, clock.instant()));
    }

    /**
     * Returns the revision history of an item, oldest version first.
     *
     * @param contentItemId the item
     * @return the versions, or empty if the item does not exist
     */
    @Transactional(readOnly = true)
    public Optional<List<ContentVersion>> history(UUID contentItemId) {
        if (!contentItemRepository.existsById(contentItemId)) {
            return Optional.empty();
        }
        return Optional.of(
                contentVersionRepository.findByContentItemIdOrderByVersionNumberAsc(contentItemId));
    }

    private boolean hasCurrentVersion(UUID contentItemId) {
        return contentVersionRepository.findByContentItemIdAndValidToIsNull(contentItemId).isPresent();
    }

    /** Flushed immediately: at most one open version per item is enforced by a unique index. */
    private void closeVersion(ContentVersion version, Instant at) {
        version.close(at);
        contentVersionRepository.saveAndFlush(version);
        contentVersionRepository.updateEmbeddingValidTo(version.getId(), at.toEpochMilli());
    }

    private static void applyDraft(ContentItem item, ContentDraft draft, String hash) {
        item.setTitle(draft.title());
        item.setContentHash(hash);
        item.setSourceType(draft.sourceType());
        item.setOwnerId(draft.ownerId());
        item.setTenantPath(draft.tenantPath());
        item.setRequiredRoles(ContentItem.joinCommaSeparated(draft.requiredRoles()));
        item.setCategoryId(draft.categoryId());
        item.setTags(ContentItem.joinCommaSeparated(draft.tags()));
    }

    private void storeEmbedding(ContentItem item, ContentVersion version) {
        TextSegment segment = TextSegment.from(embeddingText(version),
                EmbeddingMetadata.forVersion(item, version));
        Embedding embedding = embeddingModel.embed(segment).content();
        embeddingStore.addAll(List.of(version.getId().toString()), List.of(embedding),
                List.of(segment));
    }

    private static String embeddingText(ContentVersion version) {
        StringBuilder sb = new StringBuilder(version.getTitle());
        if (version.getSummary() != null && !version.getSummary().isBlank()) {
            sb.append("\n\n").append(version.getSummary());
        }
        return sb.append("\n\n").append(version.getText()).toString();
    }

    /**
     * Result of indexing one draft.
     *
     * @param contentItemId the item the draft belongs to
     * @param versionId     the new version, null if skipped
     * @param versionNumber the new version's number, 0 if skipped
     * @param skipped       true if identical text was already indexed
     */
    public record IndexResult(UUID contentItemId, @Nullable UUID versionId, int versionNumber,
                              boolean skipped) {

        static IndexResult skipped(UUID contentItemId) {
            return new IndexResult(contentItemId, null, 0, true);
        }
    }
}
