package com.phillippitts.ambient.domain;

/** Result class of routing a command. */
public enum RoutingOutcome {
    /** A deterministic match; safe to execute. */
    READY,
    /** The clarifier proposed steps that must be confirmed before running. */
    NEEDS_CONFIRMATION,
    /** Nothing matched and the clarifier could not help. */
    UNRESOLVED
}
