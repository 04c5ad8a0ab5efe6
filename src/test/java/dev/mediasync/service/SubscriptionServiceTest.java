package dev.mediasync.service;

import dev.mediasync.entity.Subscription;
import dev.mediasync.service.store.InMemoryContentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubscriptionService")
class SubscriptionServiceTest {

    private InMemoryContentStore store;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        service = new SubscriptionService(store);
    }

    @Test
    @DisplayName("should store a trimmed id and use it as title when none is given")
    void subscribe_shouldTrimAndDefaultTitle() {
        StepVerifier.create(service.subscribe("  earthporn ", " "))
                .expectNext(true)
                .verifyComplete();

        StepVerifier.create(service.list())
                .assertNext(subscription -> {
                    assertThat(subscription.getSourceId()).isEqualTo("earthporn");
                    assertThat(subscription.getTitle()).isEqualTo("earthporn");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report false when subscribing twice")
    void subscribe_twice_shouldNotDuplicate() {
        service.subscribe("siteA", "Site A").block();

        StepVerifier.create(service.subscribe("siteA", "Other"))
                .expectNext(false)
                .verifyComplete();

        assertThat(store.listSubscriptions().count().block()).isEqualTo(1L);
    }

    @Test
    @DisplayName("should reject a blank source id")
    void subscribe_blank_shouldFail() {
        StepVerifier.create(service.subscribe("   ", "title"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    @DisplayName("should remove a subscription and report whether one existed")
    void unsubscribe_shouldRemove() {
        store.subscribe("siteA");

        StepVerifier.create(service.unsubscribe(" siteA"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(service.unsubscribe("siteA"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("should count only newly created defaults")
    void seedDefaults_shouldCountCreated() {
        store.subscribe("siteA");

        StepVerifier.create(service.seedDefaults(List.of("siteA", "siteB", "siteC")))
                .expectNext(2L)
                .verifyComplete();

        assertThat(service.list().map(Subscription::getSourceId).collectList().block())
                .containsExactly("siteA", "siteB", "siteC");
    }
}
