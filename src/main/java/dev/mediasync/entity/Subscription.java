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

@Table("subscriptions")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "sourceId")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription implements Persistable<String>, NewRecordAware {

    /** Feed source identifier, e.g. a subreddit name. */
    @Id
    @Column("source_id")
    private String sourceId;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    private String title;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Override
    public String getId() {
        return sourceId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
