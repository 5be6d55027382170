package pubspork.match.service;

import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Data;
import pubspork.beans.PublicationBean;
import pubspork.ledger.KnownPubBean;
import pubspork.match.MatchTier;

/**
 * <p> One distinct publication from an alert batch, after every alert reporting it has been
 * folded together and it has been looked up in the ledger. <p>
 */
@Data
public class ClassifiedPublication {

    private PublicationBean publication;
    private Classification classification;
    /** Ledger entry it was classified against, or created for it. */
    private KnownPubBean entry;
    /** Null for newly reported publications. */
    private MatchTier tier;
    private int alertCount;
    private final Set<String> origins = new LinkedHashSet<>();
    private final Set<String> searches = new LinkedHashSet<>();

    public ClassifiedPublication(PublicationBean publication) {
        this.publication = publication;
    }

    public void addAlert(String origin, String search) {
        this.alertCount++;
        if (origin != null) {
            this.origins.add(origin);
        }
        if (search != null) {
            this.searches.add(search);
        }
    }

    /**
     * Takes over the alerts of another item reporting the same publication.
     */
    public void absorb(ClassifiedPublication other) {
        this.alertCount += other.alertCount;
        this.origins.addAll(other.origins);
        this.searches.addAll(other.searches);
    }
}
