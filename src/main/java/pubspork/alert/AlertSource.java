package pubspork.alert;

import java.util.Arrays;

/**
 * Services that send publication alerts, by their command line name.
 */
public enum AlertSource {

    GOOGLE_SCHOLAR_EMAIL("googlescholar-email"),
    MY_NCBI_EMAIL("myncbi-email"),
    SCIENCE_DIRECT_EMAIL("sciencedirect-email"),
    WILEY_EMAIL("wiley-email"),
    WEB_OF_SCIENCE_EMAIL("webofscience-email");

    private String value;

    AlertSource(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AlertSource fromValue(String value) {
        for (AlertSource source : values()) {
            if (source.value.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown alert source '" + value + "', expected one of "
                + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return this.getValue();
    }

}
