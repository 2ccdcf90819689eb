package com.phillippitts.ambient.service.filter;

import com.phillippitts.ambient.domain.AppFilter;
import com.phillippitts.ambient.domain.AudioFilter;
import com.phillippitts.ambient.exception.InvalidFilterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterStoreTest {

    private FilterStore store;

    @BeforeEach
    void setUp() {
        store = new FilterStore();
    }

    @Test
    void shouldAllowEverythingWithoutFilters() {
        assertThat(store.isAppAllowed("Chrome", "Inbox")).isTrue();
        assertThat(store.isAudioSourceAllowed("microphone")).isTrue();
    }

    @Test
    void shouldBlockBlacklistedAppCaseInsensitively() {
        store.addAppFilter(AppFilter.blacklist("Chrome"));

        assertThat(store.isAppAllowed("chrome", "Inbox")).isFalse();
        assertThat(store.isAppAllowed("CHROME", null)).isFalse();
        assertThat(store.isAppAllowed("Slack", "general")).isTrue();
    }

    @Test
    void shouldOnlyAllowWhitelistedAppsOnceAWhitelistExists() {
        store.addAppFilter(AppFilter.whitelist("Code"));

        assertThat(store.isAppAllowed("Code", "Main.java")).isTrue();
        assertThat(store.isAppAllowed("Chrome", "Inbox")).isFalse();
    }

    @Test
    void shouldRequireWindowPatternForWhitelistedApp() {
        store.addAppFilter(AppFilter.whitelist("Chrome", "GitHub", "Jira"));

        assertThat(store.isAppAllowed("Chrome", "Pull requests - github")).isTrue();
        assertThat(store.isAppAllowed("Chrome", "Bank account")).isFalse();
    }

    @Test
    void shouldTreatFilterFlaggedBothWaysAsBlacklisted() {
        // Arrange
        store.addAppFilter(new AppFilter("Chrome", true, true, List.of()));

        // Act & Assert
        assertThat(store.isAppAllowed("Chrome", "anything")).isFalse();
        assertThat(store.listAppFilters()).hasSize(1);
    }

    @Test
    void shouldRejectBlankAppName() {
        assertThatThrownBy(() -> store.addAppFilter(new AppFilter("  ", false, true, List.of())))
                .isInstanceOf(InvalidFilterException.class)
                .extracting("field").isEqualTo("appName");
    }

    @Test
    void shouldRejectBlankWindowPattern() {
        assertThatThrownBy(() -> store.addAppFilter(AppFilter.whitelist("Chrome", "GitHub", " ")))
                .isInstanceOf(InvalidFilterException.class)
                .extracting("field").isEqualTo("windowPatterns");
    }

    @Test
    void shouldRejectVolumeThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> store.addAudioFilter(new AudioFilter("microphone", false, false, 1.5, List.of())))
                .isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> store.addAudioFilter(new AudioFilter("microphone", false, false, -0.1, List.of())))
                .isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> store.addAudioFilter(new AudioFilter("microphone", false, false, Double.NaN, List.of())))
                .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void shouldUseSourceThresholdOrDefault() {
        store.addAudioFilter(new AudioFilter("system", false, false, 0.3, List.of()));

        assertThat(store.volumeThresholdFor("System", 0.1)).isEqualTo(0.3);
        assertThat(store.volumeThresholdFor("microphone", 0.1)).isEqualTo(0.1);
    }

    @Test
    void shouldApplyWhitelistPrecedenceToAudioSources() {
        store.addAudioFilter(new AudioFilter("microphone", true, false, null, List.of()));
        store.addAudioFilter(new AudioFilter("system", false, true, null, List.of()));

        assertThat(store.isAudioSourceAllowed("microphone")).isTrue();
        assertThat(store.isAudioSourceAllowed("system")).isFalse();
        assertThat(store.isAudioSourceAllowed("line-in")).isFalse();
    }

    @Test
    void shouldGateTranscriptsOnSourceKeywords() {
        store.addAudioFilter(new AudioFilter("microphone", false, false, null, List.of("deadline", "Meeting")));

        assertThat(store.matchesAudioKeywords("microphone", "the meeting moved to three")).isTrue();
        assertThat(store.matchesAudioKeywords("microphone", "what's for lunch")).isFalse();
        assertThat(store.matchesAudioKeywords("system", "what's for lunch")).isTrue();
    }

    @Test
    void shouldRemoveFilters() {
        store.addAppFilter(AppFilter.blacklist("Chrome"));

        assertThat(store.removeAppFilter("chrome")).isTrue();
        assertThat(store.removeAppFilter("chrome")).isFalse();
        assertThat(store.isAppAllowed("Chrome", "Inbox")).isTrue();
    }
}
