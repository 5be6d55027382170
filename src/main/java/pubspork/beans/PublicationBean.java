package pubspork.beans;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import pubspork.model.exception.InvalidRecordException;

/**
 * <p> A publication as the matching engine understands it, independent of where it
 * came from. Instances are immutable; use {@link #toBuilder()} to derive a changed copy. <p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class PublicationBean {

    public static final String ORIGIN_LEDGER = "ledger";

    /** Case-folded, whitespace collapsed title used for comparison. */
    private final String title;
    /** Title as given, for display. */
    private final String rawTitle;
    private final List<String> authors;
    /** Lower-cased DOI without URL prefix, or null. */
    private final String doi;
    private final Integer year;
    private final String journal;
    private final String sourceUrl;
    private final String origin;
    /** The given title was cut short by the alert service. */
    private final boolean truncatedTitle;

    @Builder(toBuilder = true)
    public PublicationBean(String title, String rawTitle, List<String> authors, String doi, Integer year,
            String journal, String sourceUrl, String origin, boolean truncatedTitle) {
        this.title = title == null ? "" : title;
        if (this.title.isEmpty() && StringUtils.isEmpty(doi)) {
            throw new InvalidRecordException("Publication from " + origin + " has neither a title nor a DOI: '"
                    + StringUtils.defaultString(rawTitle) + "'");
        }
        this.rawTitle = rawTitle == null ? "" : rawTitle;
        this.authors = authors == null ? Collections.<String>emptyList() : ImmutableList.copyOf(authors);
        this.doi = StringUtils.isEmpty(doi) ? null : doi;
        this.year = year;
        this.journal = journal;
        this.sourceUrl = sourceUrl;
        this.origin = origin;
        this.truncatedTitle = truncatedTitle;
    }

    public boolean hasDoi() {
        return this.doi != null;
    }

    public boolean hasTitle() {
        return !this.title.isEmpty();
    }
}
