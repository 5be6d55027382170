package pubspork.match;

import lombok.AllArgsConstructor;
import lombok.Data;
import pubspork.beans.PublicationBean;

@Data
@AllArgsConstructor
public class MatchResult {

    private final PublicationBean matched;
    /** Position of the matched record in the population it was found in. */
    private final int index;
    private final MatchTier tier;
    private final double score;
}
