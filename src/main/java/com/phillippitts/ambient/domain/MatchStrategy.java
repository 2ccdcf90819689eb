package com.phillippitts.ambient.domain;

/** Which routing stage produced an intent. */
public enum MatchStrategy {
    EXACT,
    FUZZY,
    CLARIFIER,
    NONE
}
