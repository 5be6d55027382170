package pubspork.match.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import lombok.extern.slf4j.Slf4j;
import pubspork.beans.PublicationBean;
import pubspork.beans.RawPublicationBean;
import pubspork.ledger.KnownPubBean;
import pubspork.ledger.KnownPubMatch;
import pubspork.ledger.KnownPubState;
import pubspork.ledger.KnownPubsLedger;
import pubspork.match.IdentityMatcher;
import pubspork.match.MatchResult;
import pubspork.match.MatchTier;
import pubspork.model.exception.InvalidRecordException;
import pubspork.normalize.PublicationNormalizer;

/**
 * <p><b><i>Runs one match: library into the ledger, then every alerted publication
 * classified against the ledger.<p><b><i>
 *
 * A publication that is in the library never comes out as new, and neither does one that
 * has been seen in any earlier run.
 */
@Slf4j
@Service
public class MatchServiceImpl implements MatchService {

    private final PublicationNormalizer publicationNormalizer;
    private final IdentityMatcher identityMatcher;

    @Autowired
    public MatchServiceImpl(PublicationNormalizer publicationNormalizer, IdentityMatcher identityMatcher) {
        this.publicationNormalizer = publicationNormalizer;
        this.identityMatcher = identityMatcher;
    }

    @Override
    public MatchOutcome runMatch(List<RawPublicationBean> alertRecords, List<RawPublicationBean> libraryRecords,
            KnownPubsLedger ledger, LocalDate today) {
        return runMatch(alertRecords, libraryRecords, ledger, today, Collections.<String>emptySet());
    }

    /**
     * @param okDuplicateTitles titles that are legitimately in the library more than once, such as "Editorial"
     */
    @Override
    public MatchOutcome runMatch(List<RawPublicationBean> alertRecords, List<RawPublicationBean> libraryRecords,
            KnownPubsLedger ledger, LocalDate today, Set<String> okDuplicateTitles) {
        StopWatch stopWatch = new StopWatch("Publication match");

        stopWatch.start("Library");
        List<PublicationBean> library = normalizeAll(libraryRecords).getPublications();
        int skippedLibraryRecords = libraryRecords.size() - library.size();
        int libraryDuplicates = reportLibraryDuplicates(library, okDuplicateTitles);
        for (PublicationBean publication : library) {
            ledger.upsert(publication, KnownPubState.IN_LIBRARY, today);
        }
        stopWatch.stop();

        stopWatch.start("Alerts");
        NormalizedRecords alerts = normalizeAll(alertRecords);
        int skippedAlertRecords = alertRecords.size() - alerts.getPublications().size();
        List<ClassifiedPublication> batch = deduplicate(alerts);
        List<ClassifiedPublication> classified = classify(batch, ledger, today);
        stopWatch.stop();

        MatchOutcome outcome = new MatchOutcome(classified, ledger, skippedLibraryRecords, skippedAlertRecords,
                libraryDuplicates);
        log.info("Matched " + alertRecords.size() + " alert records (" + classified.size()
                + " distinct publications) against " + library.size() + " library records: " + outcome.getCounts()
                + ", " + outcome.getSkippedRecords() + " records skipped");
        log.info("Match Time taken: " + stopWatch.getTotalTimeSeconds() + "s");
        return outcome;
    }

    private NormalizedRecords normalizeAll(List<RawPublicationBean> records) {
        NormalizedRecords normalized = new NormalizedRecords();
        for (RawPublicationBean raw : records) {
            try {
                normalized.add(this.publicationNormalizer.normalize(raw), raw);
            } catch (InvalidRecordException e) {
                log.warn("Skipping record: " + e.getMessage());
            }
        }
        return normalized;
    }

    private int reportLibraryDuplicates(List<PublicationBean> library, Set<String> okDuplicateTitles) {
        Set<String> okTitles = new HashSet<>();
        for (String title : okDuplicateTitles) {
            okTitles.add(PublicationNormalizer.toComparisonTitle(title));
        }
        int duplicates = 0;
        List<PublicationBean> seen = new ArrayList<>();
        for (PublicationBean publication : library) {
            Optional<MatchResult> match = this.identityMatcher.match(publication, seen);
            if (match.isPresent() && match.get().getTier() != MatchTier.PROBABLE
                    && !okTitles.contains(publication.getTitle())) {
                duplicates++;
                log.warn("Library has more than one copy of '" + publication.getRawTitle() + "' ("
                        + match.get().getTier() + " match with '" + match.get().getMatched().getRawTitle() + "')");
            }
            seen.add(publication);
        }
        return duplicates;
    }

    /**
     * Folds alerts that report the same publication into one item, in order of first report.
     */
    private List<ClassifiedPublication> deduplicate(NormalizedRecords alerts) {
        List<ClassifiedPublication> batch = new ArrayList<>();
        List<PublicationBean> batchPublications = new ArrayList<>();
        for (int i = 0; i < alerts.getPublications().size(); i++) {
            PublicationBean publication = alerts.getPublications().get(i);
            RawPublicationBean raw = alerts.getRecords().get(i);
            Optional<MatchResult> match = this.identityMatcher.match(publication, batchPublications);
            ClassifiedPublication item;
            if (match.isPresent()) {
                item = batch.get(match.get().getIndex());
                item.setPublication(merge(item.getPublication(), publication));
                batchPublications.set(match.get().getIndex(), item.getPublication());
            } else {
                item = new ClassifiedPublication(publication);
                batch.add(item);
                batchPublications.add(publication);
            }
            item.addAlert(raw.getOrigin(), raw.getSearch());
        }
        return batch;
    }

    private List<ClassifiedPublication> classify(List<ClassifiedPublication> batch, KnownPubsLedger ledger,
            LocalDate today) {
        List<ClassifiedPublication> classified = new ArrayList<>();
        Map<KnownPubBean, ClassifiedPublication> createdThisRun = new IdentityHashMap<>();
        for (ClassifiedPublication item : batch) {
            PublicationBean publication = item.getPublication();
            Optional<KnownPubMatch> found = ledger.find(publication);
            if (!found.isPresent()) {
                KnownPubBean entry = ledger.upsert(publication, KnownPubState.NEW, today);
                item.setEntry(entry);
                item.setClassification(Classification.NEWLY_REPORTED);
                createdThisRun.put(entry, item);
                classified.add(item);
                continue;
            }
            KnownPubBean entry = found.get().getEntry();
            ClassifiedPublication earlier = createdThisRun.get(entry);
            if (earlier != null) {
                earlier.absorb(item);
                earlier.setPublication(merge(earlier.getPublication(), publication));
                ledger.upsert(publication, KnownPubState.NEW, today);
                continue;
            }
            item.setEntry(entry);
            item.setTier(found.get().getTier());
            item.setClassification(classificationOf(entry.getState()));
            ledger.upsert(publication, KnownPubState.NEW, today);
            classified.add(item);
        }
        return classified;
    }

    private static Classification classificationOf(KnownPubState state) {
        switch (state) {
        case IN_LIBRARY:
            return Classification.ALREADY_IN_LIBRARY;
        case IGNORE:
            return Classification.PREVIOUSLY_IGNORED;
        default:
            return Classification.REPEAT_NEW;
        }
    }

    /**
     * Keeps the richer of two reports of the same publication, one with a DOI or else the one
     * with the longer title, and fills its gaps from the other.
     */
    static PublicationBean merge(PublicationBean kept, PublicationBean other) {
        PublicationBean richer = kept;
        PublicationBean poorer = other;
        if (other.hasDoi() != kept.hasDoi() ? other.hasDoi()
                : other.getRawTitle().length() > kept.getRawTitle().length()) {
            richer = other;
            poorer = kept;
        }
        PublicationBean.PublicationBeanBuilder merged = richer.toBuilder();
        if (!richer.hasDoi() && poorer.hasDoi()) {
            merged.doi(poorer.getDoi());
        }
        if (richer.getSourceUrl() == null) {
            merged.sourceUrl(poorer.getSourceUrl());
        }
        if (richer.getAuthors().isEmpty()) {
            merged.authors(poorer.getAuthors());
        }
        if (richer.getYear() == null) {
            merged.year(poorer.getYear());
        }
        if (richer.getJournal() == null) {
            merged.journal(poorer.getJournal());
        }
        return merged.build();
    }

    private static class NormalizedRecords {

        private final List<PublicationBean> publications = new ArrayList<>();
        /** Parallel to publications. */
        private final List<RawPublicationBean> records = new ArrayList<>();

        void add(PublicationBean publication, RawPublicationBean raw) {
            this.publications.add(publication);
            this.records.add(raw);
        }

        List<PublicationBean> getPublications() {
            return this.publications;
        }

        List<RawPublicationBean> getRecords() {
            return this.records;
        }
    }
}
