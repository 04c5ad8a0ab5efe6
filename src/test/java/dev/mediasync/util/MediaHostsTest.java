package dev.mediasync.util;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class MediaHostsTest {

    @Test
    void matches_shouldAcceptDomainAndSubdomainsOnly() {
        assertThat(MediaHosts.matches("imgur.com", "imgur.com")).isTrue();
        assertThat(MediaHosts.matches("m.imgur.com", "imgur.com")).isTrue();
        assertThat(MediaHosts.matches("notimgur.com", "imgur.com")).isFalse();
        assertThat(MediaHosts.matches(null, "imgur.com")).isFalse();
        assertThat(MediaHosts.matches("imgur.com", "")).isFalse();
    }

    @Test
    void matches_shouldIgnoreCaseRegardlessOfDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertThat(MediaHosts.matches("I.IMGUR.COM", "imgur.com")).isTrue();
            assertThat(MediaHosts.matches("www.reddit.com", "REDDIT.COM")).isTrue();
        } finally {
            Locale.setDefault(original);
        }
    }
}
