package pubspork.match.service;

/**
 * What a run concluded about a reported publication.
 */
public enum Classification {

    NEWLY_REPORTED("newly-reported"),
    REPEAT_NEW("repeat-new"),
    ALREADY_IN_LIBRARY("already-in-library"),
    PREVIOUSLY_IGNORED("previously-ignored");

    private String value;

    Classification(final String value) {
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
