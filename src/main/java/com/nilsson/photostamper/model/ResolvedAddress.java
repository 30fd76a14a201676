package com.nilsson.photostamper.model;

import java.util.Objects;

/**
 Place name shown on the overlay, together with how it was obtained.
 <p>
 The text is never null or empty. Anything that could not be resolved is represented by
 {@link #BLANK}, a single space, so the address line always occupies the same slot in the layout.
 </p>
 */
public final class ResolvedAddress {

    public static final String BLANK = " ";

    public enum Outcome {
        RESOLVED,
        NO_COORDINATE,
        NO_MATCH,
        TIMED_OUT,
        FAILED
    }

    private final String text;
    private final Outcome outcome;

    private ResolvedAddress(String text, Outcome outcome) {
        this.text = text;
        this.outcome = outcome;
    }

    public static ResolvedAddress resolved(String text) {
        if (text == null || text.isBlank()) {
            return unresolved(Outcome.NO_MATCH);
        }
        return new ResolvedAddress(text, Outcome.RESOLVED);
    }

    public static ResolvedAddress unresolved(Outcome outcome) {
        if (outcome == Outcome.RESOLVED) {
            throw new IllegalArgumentException("A resolved address needs text");
        }
        return new ResolvedAddress(BLANK, outcome);
    }

    public String getText() {
        return text;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedAddress)) return false;
        ResolvedAddress that = (ResolvedAddress) o;
        return text.equals(that.text) && outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, outcome);
    }

    @Override
    public String toString() {
        return outcome + "('" + text + "')";
    }
}
