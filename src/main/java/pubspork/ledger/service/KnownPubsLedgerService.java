package pubspork.ledger.service;

import java.nio.file.Path;

import pubspork.ledger.KnownPubsLedger;

public interface KnownPubsLedgerService {

    KnownPubsLedger load(Path path);
    void save(KnownPubsLedger ledger, Path path);

}
