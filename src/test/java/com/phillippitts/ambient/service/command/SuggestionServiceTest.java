package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.CommandHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionServiceTest {

    private CommandHistory history;
    private SuggestionService suggestions;

    @BeforeEach
    void setUp() {
        CommandProperties props = new CommandProperties(0.7, 2500, 60_000, 50, 3);
        history = new CommandHistory(props);
        suggestions = new SuggestionService(history, props);
    }

    @Test
    void shouldRankPrefixMatchesBeforeSubstringMatches() {
        record("search for weather");
        record("open weather app");

        assertThat(suggestions.suggest("open")).first().isEqualTo("open weather app");
        assertThat(suggestions.suggest("weather")).containsExactly("open weather app", "search for weather",
                "look up weather tomorrow");
    }

    @Test
    void shouldPreferFrequentAndRecentCommands() {
        record("open slack");
        record("open spotify");
        record("open slack");
        record("open safari");

        assertThat(suggestions.suggest("open s")).containsExactly("open slack", "open safari", "open spotify");
    }

    @Test
    void shouldCollapseCaseInsensitiveDuplicates() {
        record("Open Chrome");
        record("open chrome");

        assertThat(suggestions.suggest("open c")).containsExactly("Open Chrome");
    }

    @Test
    void shouldFallBackToExamples() {
        assertThat(suggestions.suggest("hel")).containsExactly("help");
        assertThat(suggestions.suggest("  ")).isEmpty();
        assertThat(suggestions.suggest(null)).isEmpty();
    }

    @Test
    void shouldRespectLimit() {
        for (String c : new String[]{"open a1", "open a2", "open a3", "open a4"}) {
            record(c);
        }

        assertThat(suggestions.suggest("open")).hasSize(3);
    }

    private void record(String command) {
        history.record(new CommandHistoryEntry(command, true, Instant.now(), "ok"));
    }
}
