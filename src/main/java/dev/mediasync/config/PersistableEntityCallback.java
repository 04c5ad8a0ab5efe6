package dev.mediasync.config;

import dev.mediasync.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks every entity read from the database as existing. Subscriptions, content items and
 * media assets all carry natural keys assigned before the first save, so Spring Data cannot
 * tell an INSERT from an UPDATE by looking at the id.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware aware) {
            aware.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
