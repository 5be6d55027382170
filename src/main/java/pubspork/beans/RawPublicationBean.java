package pubspork.beans;

import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * <p> A publication exactly as an alert or library adapter reported it. Nothing here is
 * cleaned up yet; see {@link pubspork.normalize.PublicationNormalizer}. <p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawPublicationBean {

    /** Alert source tag or library type that produced the record. */
    @JsonProperty("source")
    private String origin;
    private String title;
    private String authors;
    private String doi;
    private String url;
    private String journal;
    private String year;
    private String date;

    /** Only alert records have these. */
    private LocalDate alertDate;
    private String search;

    /** Only library records have these. */
    private List<String> tags;
    private LocalDate entryDate;
}
