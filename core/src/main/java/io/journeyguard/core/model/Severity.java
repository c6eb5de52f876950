package io.journeyguard.core.model;

/** Finding severity. Fixability is carried separately by {@link FixHint}. */
public enum Severity {
    ERROR,
    WARNING
}
