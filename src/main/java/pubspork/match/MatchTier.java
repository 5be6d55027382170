package pubspork.match;

/**
 * Confidence of an identity match, strongest first.
 */
public enum MatchTier {

    /** Same DOI. */
    CERTAIN("certain"),
    /** Same normalized title, years at most one apart. */
    HIGH("high"),
    /** Near-identical titles, or a truncated title that prefixes the other. */
    PROBABLE("probable");

    private String value;

    MatchTier(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return this.getValue();
    }

}
