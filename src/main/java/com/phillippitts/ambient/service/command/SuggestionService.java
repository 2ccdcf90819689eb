package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.CommandHistoryEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Command completions from history and the built-in example commands.
 *
 * <p>Ranking: prefix matches before substring matches, then by frequency times recency
 * (history position of the last use, 1.0 for the newest). Examples score zero, so they follow
 * history matches of the same kind. Case-insensitive duplicates are collapsed.
 */
@Component
public class SuggestionService {

    private final CommandHistory history;
    private final int limit;

    public SuggestionService(CommandHistory history, CommandProperties props) {
        this.history = Objects.requireNonNull(history);
        this.limit = props.getSuggestionLimit();
    }

    public List<String> suggest(String partial) {
        if (partial == null || partial.isBlank()) {
            return List.of();
        }
        String query = partial.trim().toLowerCase(Locale.ROOT);

        Map<String, Candidate> candidates = new LinkedHashMap<>();
        List<CommandHistoryEntry> entries = history.all();
        for (int i = 0; i < entries.size(); i++) {
            String command = entries.get(i).command();
            if (command == null || command.isBlank()) {
                continue;
            }
            String key = command.trim().toLowerCase(Locale.ROOT);
            double recency = (double) (i + 1) / entries.size();
            Candidate c = candidates.computeIfAbsent(key, k -> new Candidate(command.trim()));
            c.frequency++;
            c.recency = recency;
        }
        for (String example : PhraseTable.examples()) {
            candidates.putIfAbsent(example, new Candidate(example));
        }

        List<Ranked> ranked = new ArrayList<>();
        candidates.forEach((key, c) -> {
            if (key.startsWith(query)) {
                ranked.add(new Ranked(c.text, 0, c.score()));
            } else if (key.contains(query)) {
                ranked.add(new Ranked(c.text, 1, c.score()));
            }
        });
        ranked.sort(Comparator.comparingInt(Ranked::kind)
                .thenComparing(Comparator.comparingDouble(Ranked::score).reversed()));
        return ranked.stream().limit(limit).map(Ranked::text).toList();
    }

    private record Ranked(String text, int kind, double score) { }

    private static final class Candidate {
        final String text;
        int frequency;
        double recency;

        Candidate(String text) {
            this.text = text;
        }

        double score() {
            return frequency * recency;
        }
    }
}
