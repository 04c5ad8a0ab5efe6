package dev.mediasync.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One item mirrored from a feed source, keyed by the identifier the source assigned to it.
 */
@Table("content_items")
@Getter
@Setter
@ToString(exclude = {"body", "rawPayload"})
@EqualsAndHashCode(of = "externalId")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem implements Persistable<String>, NewRecordAware {

    @Id
    @Column("external_id")
    private String externalId;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Column("source_id")
    private String sourceId;

    private String author;

    /** Creation time at the source, UTC. */
    @Column("posted_at")
    private LocalDateTime postedAt;

    private String title;

    private String body;

    /** Raw locator picked from the feed entry; canonicalised only when downloading. */
    @Column("media_url")
    private String mediaUrl;

    /** Filename of the stored {@link MediaAsset}; set once. */
    @Column("media_uid")
    private String mediaUid;

    @Builder.Default
    private Integer score = 0;

    @Column("comment_count")
    @Builder.Default
    private Integer commentCount = 0;

    @Column("raw_payload")
    private String rawPayload;

    @Column("ingested_at")
    private LocalDateTime ingestedAt;

    @Override
    public String getId() {
        return externalId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    public MediaState mediaState() {
        if (mediaUrl == null || mediaUrl.isBlank()) {
            return MediaState.NO_MEDIA;
        }
        return mediaUid == null ? MediaState.PENDING_MEDIA : MediaState.MEDIA_READY;
    }
}
