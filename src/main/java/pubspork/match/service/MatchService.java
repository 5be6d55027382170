package pubspork.match.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import pubspork.beans.RawPublicationBean;
import pubspork.ledger.KnownPubsLedger;

public interface MatchService {

    MatchOutcome runMatch(List<RawPublicationBean> alertRecords, List<RawPublicationBean> libraryRecords,
            KnownPubsLedger ledger, LocalDate today);
    MatchOutcome runMatch(List<RawPublicationBean> alertRecords, List<RawPublicationBean> libraryRecords,
            KnownPubsLedger ledger, LocalDate today, Set<String> okDuplicateTitles);

}
