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

@Table("media_assets")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "uidFilename")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAsset implements Persistable<String>, NewRecordAware {

    /** Generated name of the file inside the media directory */
    @Id
    @Column("uid_filename")
    private String uidFilename;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Column("original_url")
    private String originalUrl;

    @Column("content_type")
    private String contentType;

    @Column("size_bytes")
    private Long sizeBytes;

    @Column("saved_at")
    private LocalDateTime savedAt;

    /** External id of the content item the file was downloaded for, if any */
    @Column("content_item_id")
    private String contentItemId;

    @Override
    public String getId() {
        return uidFilename;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
