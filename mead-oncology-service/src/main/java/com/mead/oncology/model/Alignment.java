package com.mead.oncology.model;

public enum Alignment {
    ALIGNED,
    PARTIALLY_ALIGNED,
    NOT_ALIGNED,
    /** Kept for collaborators that record failed lookups; the engine reports these by exception. */
    UNKNOWN_COMBINATION
}
