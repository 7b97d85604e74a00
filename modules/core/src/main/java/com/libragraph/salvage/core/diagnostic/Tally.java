package com.libragraph.salvage.core.diagnostic;

/**
 * Per-component candidate accounting. Every candidate a component finds ends up
 * accepted, rejected or duplicate; {@link #reconciles()} checks exactly that.
 */
public record Tally(String component, long found, long accepted, long rejected, long duplicate) {

    public static Tally empty(String component) {
        return new Tally(component, 0, 0, 0, 0);
    }

    public boolean reconciles() {
        return found == accepted + rejected + duplicate;
    }
}
