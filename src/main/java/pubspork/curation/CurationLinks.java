package pubspork.curation;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Places a curator can go to look at a publication or find it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CurationLinks {

    private String pubUrl;
    /** The pub through the institution's paywall proxy. */
    private String proxyUrl;
    /** Title search at the institution's library. */
    private String librarySearchUrl;
    private String googleSearchUrl;
    private String googleScholarSearchUrl;
    private String pubmedSearchUrl;
}
