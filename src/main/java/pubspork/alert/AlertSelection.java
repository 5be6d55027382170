package pubspork.alert;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Splitter;

import lombok.Getter;
import lombok.ToString;

/**
 * Which alerts a run looks at: from which sources, and sent in which date range.
 * Since is inclusive, before is exclusive, either may be absent.
 */
@Getter
@ToString
public class AlertSelection {

    public static final String ALL_SOURCES = "all";

    private final Set<AlertSource> sources;
    private final LocalDate since;
    private final LocalDate before;

    /**
     * @param sources sources to keep, empty for all of them
     */
    public AlertSelection(Set<AlertSource> sources, LocalDate since, LocalDate before) {
        if (since != null && before != null && !since.isBefore(before)) {
            throw new IllegalArgumentException("Alert date range is empty: since " + since + ", before " + before);
        }
        this.sources = sources.isEmpty() ? EnumSet.allOf(AlertSource.class) : EnumSet.copyOf(sources);
        this.since = since;
        this.before = before;
    }

    public static AlertSelection all() {
        return new AlertSelection(Collections.<AlertSource>emptySet(), null, null);
    }

    /**
     * @param sources "all" or a comma separated list of source names
     * @throws IllegalArgumentException for an unknown source name
     */
    public static Set<AlertSource> parseSources(String sources) {
        Set<AlertSource> parsed = EnumSet.noneOf(AlertSource.class);
        if (sources == null || ALL_SOURCES.equals(sources.trim())) {
            return parsed;
        }
        for (String source : Splitter.on(',').trimResults().omitEmptyStrings().split(sources)) {
            parsed.add(AlertSource.fromValue(source));
        }
        return parsed;
    }

    public boolean hasDateRange() {
        return this.since != null || this.before != null;
    }

    public boolean accepts(AlertSource source, LocalDate alertDate) {
        if (!this.sources.contains(source)) {
            return false;
        }
        if (alertDate == null) {
            return !hasDateRange();
        }
        if (this.since != null && alertDate.isBefore(this.since)) {
            return false;
        }
        return this.before == null || alertDate.isBefore(this.before);
    }
}
