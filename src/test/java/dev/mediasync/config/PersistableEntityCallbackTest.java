package dev.mediasync.config;

import dev.mediasync.entity.ContentItem;
import dev.mediasync.entity.MediaAsset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PersistableEntityCallback Tests")
class PersistableEntityCallbackTest {

    private final PersistableEntityCallback callback = new PersistableEntityCallback();

    @Test
    @DisplayName("Should mark a content item read from the database as existing")
    void shouldMarkContentItemAsExisting() {
        ContentItem item = ContentItem.builder().externalId("p1").build();
        assertThat(item.isNew()).isTrue();

        Publisher<Object> result = callback.onAfterConvert(item, SqlIdentifier.unquoted("content_items"));

        StepVerifier.create(Mono.from(result))
                .assertNext(obj -> assertThat(((ContentItem) obj).isNew()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should mark a media asset read from the database as existing")
    void shouldMarkMediaAssetAsExisting() {
        MediaAsset asset = MediaAsset.builder().uidFilename("abc.jpg").build();

        Publisher<Object> result = callback.onAfterConvert(asset, SqlIdentifier.unquoted("media_assets"));

        StepVerifier.create(Mono.from(result))
                .assertNext(obj -> assertThat(((MediaAsset) obj).isNew()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should return entity unchanged when not NewRecordAware")
    void shouldReturnUnchangedForNonNewRecordAwareEntity() {
        String plainObject = "not a NewRecordAware";

        Publisher<Object> result = callback.onAfterConvert(plainObject, SqlIdentifier.unquoted("test_table"));

        StepVerifier.create(Mono.from(result))
                .assertNext(obj -> assertThat(obj).isEqualTo("not a NewRecordAware"))
                .verifyComplete();
    }
}
