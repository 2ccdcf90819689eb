package com.phillippitts.ambient.domain;

import java.util.Map;

/**
 * Routed interpretation of a command.
 *
 * @param category action category
 * @param functionName handler operation, e.g. {@code webSearch}
 * @param confidence score in [0,1]; exactly 1.0 only for exact phrase matches
 * @param rawCommand the command as received
 * @param args extracted arguments ({@code app}, {@code url}, {@code query}, {@code recipient},
 *             {@code subject}, {@code body})
 * @param strategy routing stage that produced this intent
 */
public record Intent(IntentCategory category,
                     String functionName,
                     double confidence,
                     String rawCommand,
                     Map<String, String> args,
                     MatchStrategy strategy) {

    public Intent {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    public static Intent unresolved(String rawCommand) {
        return new Intent(IntentCategory.UNKNOWN, "none", 0.0, rawCommand, Map.of(), MatchStrategy.NONE);
    }

    public String arg(String name) {
        return args.get(name);
    }
}
