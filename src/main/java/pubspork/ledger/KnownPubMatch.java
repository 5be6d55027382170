package pubspork.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import pubspork.match.MatchTier;

/**
 * A ledger entry found for a publication, and how sure we are of it.
 */
@Data
@AllArgsConstructor
public class KnownPubMatch {

    private final KnownPubBean entry;
    private final MatchTier tier;
}
