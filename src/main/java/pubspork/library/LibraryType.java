package pubspork.library;

import java.util.Arrays;

/**
 * Library export formats we can read, by their command line name.
 */
public enum LibraryType {

    ZOTERO_CSV("zotero-csv"),
    CITEULIKE_JSON("citeulike-json");

    private String value;

    LibraryType(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static LibraryType fromValue(String value) {
        for (LibraryType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown library type '" + value + "', expected one of "
                + Arrays.toString(values()));
    }

    /**
     * @param origin origin of a raw record
     * @return whether the record came from a library export rather than an alert
     */
    public static boolean isLibraryOrigin(String origin) {
        for (LibraryType type : values()) {
            if (type.value.equals(origin)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return this.getValue();
    }

}
