package pubspork.ledger;

import java.util.Locale;

/**
 * What we know about a publication in the ledger.
 */
public enum KnownPubState {

    /** Seen, not curated yet. */
    NEW("new"),
    /** In the library of relevant pubs. */
    IN_LIBRARY("in_library"),
    /** Looked at and judged not relevant. Only a person sets this. */
    IGNORE("ignore");

    private static final String LEGACY_IN_LIBRARY = "inlib";

    private String value;

    KnownPubState(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @param value state column as found in a ledger file
     * @throws IllegalArgumentException for anything that is not a known state
     */
    public static KnownPubState fromValue(String value) {
        String trimmed = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (LEGACY_IN_LIBRARY.equals(trimmed)) {
            return IN_LIBRARY;
        }
        for (KnownPubState state : values()) {
            if (state.value.equals(trimmed)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown known pub state '" + value + "'");
    }

    @Override
    public String toString() {
        return this.getValue();
    }

}
