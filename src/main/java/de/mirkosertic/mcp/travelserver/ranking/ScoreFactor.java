package de.mirkosertic.mcp.travelserver.ranking;

/**
 * The independent factors a destination score is made of.
 */
public enum ScoreFactor {

    BUDGET("budget"),
    MOOD("mood"),
    DURATION("duration"),
    TEXT_MATCH("text_match"),
    CATEGORY("destination_category"),
    MONTHS("best_months"),
    DISTANCE("distance");

    private final String key;

    ScoreFactor(final String key) {
        this.key = key;
    }

    /**
     * Name used in result payloads.
     */
    public String key() {
        return key;
    }
}
