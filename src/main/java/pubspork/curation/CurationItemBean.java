package pubspork.curation;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CurationItemBean {

    private String classification;
    /** How sure the ledger match is; absent for newly reported pubs. */
    private String matchTier;
    private String title;
    private List<String> authors;
    private String doi;
    private Integer year;
    private String journal;
    private int alertCount;
    private Set<String> sources;
    private Set<String> searches;
    private LocalDate firstSeenDate;
    private String annotation;
    private CurationLinks links;
}
