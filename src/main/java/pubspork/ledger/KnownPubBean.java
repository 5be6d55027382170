package pubspork.ledger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import pubspork.beans.PublicationBean;
import pubspork.normalize.PublicationNormalizer;

/**
 * <p> One row of the known pubs ledger. Title, authors and journal are kept as they
 * were first reported. State, annotation and the extra columns belong to the person
 * curating the ledger and are written back exactly as read. <p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnownPubBean {

    private static final Joiner AUTHOR_JOINER = Joiner.on("; ");

    private String title;
    private String authors;
    private String doi;
    private Integer year;
    private String journal;
    private KnownPubState state;
    private LocalDate firstSeenDate;
    private LocalDate entryDate;
    @Builder.Default
    private String annotation = "";
    /** Columns a person added to the file, by header name. */
    @Builder.Default
    private Map<String, String> extraColumns = new LinkedHashMap<>();
    /**
     * Managed cells that could not be read, such as a state we do not know or a date a
     * spreadsheet reformatted, by column name. Written back as found until the matching
     * field gets a value.
     */
    @Builder.Default
    private Map<String, String> unreadCells = new LinkedHashMap<>();
    /** Cells past the last header column. */
    @Builder.Default
    private List<String> trailingCells = new ArrayList<>();

    public static KnownPubBean fromPublication(PublicationBean publication, KnownPubState state, LocalDate today) {
        return KnownPubBean.builder()
                .title(publication.getRawTitle())
                .authors(AUTHOR_JOINER.join(publication.getAuthors()))
                .doi(publication.getDoi())
                .year(publication.getYear())
                .journal(publication.getJournal())
                .state(state)
                .firstSeenDate(today)
                .entryDate(today)
                .build();
    }

    /**
     * @throws pubspork.model.exception.InvalidRecordException if the row has neither title nor DOI
     */
    public PublicationBean toPublication() {
        return PublicationBean.builder()
                .title(PublicationNormalizer.toComparisonTitle(this.title))
                .rawTitle(this.title)
                .authors(PublicationNormalizer.splitAuthors(this.authors, true))
                .doi(this.doi)
                .year(this.year)
                .journal(this.journal)
                .sourceUrl(this.doi == null ? null : PublicationNormalizer.DOI_RESOLVER_URL + this.doi)
                .origin(PublicationBean.ORIGIN_LEDGER)
                .truncatedTitle(PublicationNormalizer.isTruncatedTitle(this.title))
                .build();
    }
}
