package pubspork.match.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;
import pubspork.ledger.KnownPubsLedger;

/**
 * Result of one match run. The ledger has already been updated in memory but not saved.
 */
@Getter
@ToString(exclude = "ledger")
public class MatchOutcome {

    private final List<ClassifiedPublication> classified;
    private final KnownPubsLedger ledger;
    private final Map<Classification, Integer> counts = new EnumMap<>(Classification.class);
    private final int skippedLibraryRecords;
    private final int skippedAlertRecords;
    /** Library records that are another library record over again. */
    private final int libraryDuplicates;

    public MatchOutcome(List<ClassifiedPublication> classified, KnownPubsLedger ledger, int skippedLibraryRecords,
            int skippedAlertRecords, int libraryDuplicates) {
        this.classified = classified;
        this.ledger = ledger;
        this.skippedLibraryRecords = skippedLibraryRecords;
        this.skippedAlertRecords = skippedAlertRecords;
        this.libraryDuplicates = libraryDuplicates;
        for (Classification classification : Classification.values()) {
            this.counts.put(classification, 0);
        }
        for (ClassifiedPublication publication : classified) {
            this.counts.merge(publication.getClassification(), 1, Integer::sum);
        }
    }

    public int getCount(Classification classification) {
        return this.counts.get(classification);
    }

    /** Records dropped for having neither a title nor a DOI. */
    public int getSkippedRecords() {
        return this.skippedLibraryRecords + this.skippedAlertRecords;
    }
}
