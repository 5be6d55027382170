package pubspork.match.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableSet;

import pubspork.beans.PublicationBean;
import pubspork.beans.RawPublicationBean;
import pubspork.ledger.KnownPubBean;
import pubspork.ledger.KnownPubState;
import pubspork.ledger.KnownPubsLedger;
import pubspork.ledger.service.KnownPubsLedgerServiceImpl;
import pubspork.match.IdentityMatcher;
import pubspork.normalize.PublicationNormalizer;

class MatchServiceImplTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2024, 3, 1);
    private static final LocalDate DAY_TWO = LocalDate.of(2024, 3, 8);

    private IdentityMatcher identityMatcher;
    private MatchServiceImpl matchService;
    private KnownPubsLedger ledger;

    @BeforeEach
    void setUp() {
        identityMatcher = new IdentityMatcher(0.90, 40);
        matchService = new MatchServiceImpl(new PublicationNormalizer(), identityMatcher);
        ledger = new KnownPubsLedger(identityMatcher);
    }

    private static RawPublicationBean alert(String source, String title, String doi, String year) {
        return RawPublicationBean.builder().origin(source).title(title).doi(doi).year(year).search("galaxy").build();
    }

    private static RawPublicationBean libraryPub(String title, String doi, String year) {
        return RawPublicationBean.builder().origin("zotero-csv").title(title).doi(doi).year(year).build();
    }

    @Test
    void alertMatchingLibraryByTitle_isAlreadyInLibraryAndLedgerGetsDoi() {
        MatchOutcome outcome = matchService.runMatch(
                Collections.singletonList(alert("googlescholar-email", "Deep Learning for X", null, "2020")),
                Collections.singletonList(libraryPub("Deep learning for X.", "10.1/abc", "2020")),
                ledger, DAY_ONE);

        assertThat(outcome.getClassified()).hasSize(1);
        assertThat(outcome.getClassified().get(0).getClassification()).isEqualTo(Classification.ALREADY_IN_LIBRARY);
        assertThat(ledger.size()).isEqualTo(1);
        KnownPubBean entry = ledger.getEntries().get(0);
        assertThat(entry.getDoi()).isEqualTo("10.1/abc");
        assertThat(entry.getState()).isEqualTo(KnownPubState.IN_LIBRARY);
    }

    @Test
    void unknownAlert_isNewlyReportedThenRepeatNew() {
        List<RawPublicationBean> alerts = Collections.singletonList(
                alert("myncbi-email", "A brand new method", "10.7/new", "2024"));

        MatchOutcome first = matchService.runMatch(alerts, Collections.<RawPublicationBean>emptyList(), ledger,
                DAY_ONE);
        MatchOutcome second = matchService.runMatch(alerts, Collections.<RawPublicationBean>emptyList(), ledger,
                DAY_TWO);

        assertThat(first.getCount(Classification.NEWLY_REPORTED)).isEqualTo(1);
        assertThat(second.getCount(Classification.NEWLY_REPORTED)).isZero();
        assertThat(second.getCount(Classification.REPEAT_NEW)).isEqualTo(1);
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.getEntries().get(0).getFirstSeenDate()).isEqualTo(DAY_ONE);
        assertThat(ledger.getEntries().get(0).getEntryDate()).isEqualTo(DAY_TWO);
    }

    @Test
    void ignoredEntry_isReportedAsPreviouslyIgnoredAndLeftIgnored() {
        KnownPubBean ignored = KnownPubBean.builder().title("Not for us").year(2023).state(KnownPubState.IGNORE)
                .firstSeenDate(DAY_ONE).entryDate(DAY_ONE).annotation("off topic").build();
        ledger.addLoadedEntry(ignored);

        MatchOutcome outcome = matchService.runMatch(
                Collections.singletonList(alert("wiley-email", "Not for us.", "10.3/nfu", "2023")),
                Collections.<RawPublicationBean>emptyList(), ledger, DAY_TWO);

        assertThat(outcome.getClassified().get(0).getClassification()).isEqualTo(Classification.PREVIOUSLY_IGNORED);
        assertThat(ignored.getState()).isEqualTo(KnownPubState.IGNORE);
        assertThat(ignored.getAnnotation()).isEqualTo("off topic");
        assertThat(ignored.getDoi()).isEqualTo("10.3/nfu");
        assertThat(ignored.getEntryDate()).isEqualTo(DAY_TWO);
    }

    @Test
    void newEntryThatReachedLibrary_isPromoted() {
        List<RawPublicationBean> alerts = Collections.singletonList(
                alert("googlescholar-email", "A brand new method", null, "2024"));
        matchService.runMatch(alerts, Collections.<RawPublicationBean>emptyList(), ledger, DAY_ONE);

        MatchOutcome outcome = matchService.runMatch(alerts,
                Collections.singletonList(libraryPub("A brand new method", "10.7/new", "2024")), ledger, DAY_TWO);

        assertThat(outcome.getClassified().get(0).getClassification()).isEqualTo(Classification.ALREADY_IN_LIBRARY);
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.getEntries().get(0).getState()).isEqualTo(KnownPubState.IN_LIBRARY);
        assertThat(ledger.getEntries().get(0).getDoi()).isEqualTo("10.7/new");
    }

    @Test
    void sameAlertFromSeveralSources_isOneItemKeepingTheRicherRecord() {
        MatchOutcome outcome = matchService.runMatch(Arrays.asList(
                alert("googlescholar-email", "Galaxy: a web-based platform for accessible, reproducible and …", null,
                        "2010"),
                alert("myncbi-email", "Galaxy: a web-based platform for accessible, reproducible and transparent "
                        + "computational research", "10.1186/gb-2010-11-8-r86", "2010"),
                alert("sciencedirect-email", "Some other paper", null, "2010")),
                Collections.<RawPublicationBean>emptyList(), ledger, DAY_ONE);

        assertThat(outcome.getClassified()).hasSize(2);
        ClassifiedPublication galaxy = outcome.getClassified().get(0);
        assertThat(galaxy.getAlertCount()).isEqualTo(2);
        assertThat(galaxy.getOrigins()).containsExactly("googlescholar-email", "myncbi-email");
        assertThat(galaxy.getPublication().getDoi()).isEqualTo("10.1186/gb-2010-11-8-r86");
        assertThat(galaxy.getPublication().isTruncatedTitle()).isFalse();
        assertThat(ledger.size()).isEqualTo(2);
    }

    @Test
    void noFalseNew_everythingSeenBeforeIsKnown() {
        List<RawPublicationBean> alerts = Arrays.asList(
                alert("googlescholar-email", "Paper one", null, "2021"),
                alert("googlescholar-email", "Paper two", "10.2/two", "2022"),
                alert("webofscience-email", "PAPER THREE", null, null));
        matchService.runMatch(alerts, Collections.<RawPublicationBean>emptyList(), ledger, DAY_ONE);

        MatchOutcome again = matchService.runMatch(Arrays.asList(
                alert("myncbi-email", "Paper One.", null, "2021"),
                alert("wiley-email", "Paper 2 with a new title", "10.2/TWO", "2022"),
                alert("googlescholar-email", "Paper three", null, "2023")),
                Collections.<RawPublicationBean>emptyList(), ledger, DAY_TWO);

        assertThat(again.getCount(Classification.NEWLY_REPORTED)).isZero();
        assertThat(again.getCount(Classification.REPEAT_NEW)).isEqualTo(3);
        assertThat(ledger.size()).isEqualTo(3);
    }

    @Test
    void rerunWithSameInputs_leavesLedgerUnchanged() {
        List<RawPublicationBean> alerts = Arrays.asList(
                alert("googlescholar-email", "Deep Learning for X", null, "2020"),
                alert("googlescholar-email", "A brand new method", null, "2024"));
        List<RawPublicationBean> library = Arrays.asList(
                libraryPub("Deep learning for X.", "10.1/abc", "2020"),
                libraryPub("Old favourite", null, "2015"));

        matchService.runMatch(alerts, library, ledger, DAY_ONE);
        List<KnownPubBean> afterFirst = copy(ledger.getEntriesInSaveOrder());
        MatchOutcome second = matchService.runMatch(alerts, library, ledger, DAY_ONE);

        assertThat(ledger.getEntriesInSaveOrder()).isEqualTo(afterFirst);
        assertThat(second.getCount(Classification.ALREADY_IN_LIBRARY)).isEqualTo(1);
        assertThat(second.getCount(Classification.REPEAT_NEW)).isEqualTo(1);
    }

    @Test
    void rerunFromSavedLedger_writesTheSameLedger(@TempDir Path tempDir) throws IOException {
        KnownPubsLedgerServiceImpl ledgerService = new KnownPubsLedgerServiceImpl(identityMatcher);
        List<RawPublicationBean> alerts = Arrays.asList(
                alert("googlescholar-email", "Deep Learning for X", null, "2020"),
                RawPublicationBean.builder().origin("myncbi-email").title("A brand new method")
                        .authors("A Smith, B Jones").doi("10.7/new").year("2024").build(),
                alert("googlescholar-email", "Galaxy: a web-based platform for accessible, reproducible and …",
                        null, "2010"));
        List<RawPublicationBean> library = Arrays.asList(
                RawPublicationBean.builder().origin("zotero-csv").title("Deep learning for X.")
                        .authors("Smith, Ann").doi("10.1/abc").year("2020").build(),
                libraryPub("Old favourite", null, "2015"));
        Path first = tempDir.resolve("first.tsv");
        Path second = tempDir.resolve("second.tsv");

        MatchOutcome firstRun = matchService.runMatch(alerts, library,
                ledgerService.load(tempDir.resolve("none.tsv")), DAY_ONE);
        ledgerService.save(firstRun.getLedger(), first);
        MatchOutcome rerun = matchService.runMatch(alerts, library, ledgerService.load(first), DAY_ONE);
        ledgerService.save(rerun.getLedger(), second);

        assertThat(Files.readAllLines(second, StandardCharsets.UTF_8))
                .isEqualTo(Files.readAllLines(first, StandardCharsets.UTF_8))
                .hasSize(5);
        assertThat(rerun.getCount(Classification.NEWLY_REPORTED)).isZero();
        assertThat(rerun.getCount(Classification.REPEAT_NEW)).isEqualTo(2);
    }

    @Test
    void invalidRecords_areSkippedAndCounted() {
        MatchOutcome outcome = matchService.runMatch(
                Arrays.asList(alert("googlescholar-email", " ", null, "2020"),
                        alert("googlescholar-email", "Real paper", null, "2020")),
                Collections.singletonList(libraryPub(null, null, "2020")), ledger, DAY_ONE);

        assertThat(outcome.getSkippedAlertRecords()).isEqualTo(1);
        assertThat(outcome.getSkippedLibraryRecords()).isEqualTo(1);
        assertThat(outcome.getSkippedRecords()).isEqualTo(2);
        assertThat(outcome.getClassified()).hasSize(1);
    }

    @Test
    void libraryDuplicates_areCountedUnlessOkListed() {
        List<RawPublicationBean> library = Arrays.asList(
                libraryPub("Editorial", null, "2020"),
                libraryPub("Editorial.", null, "2020"),
                libraryPub("Same thing twice", "10.4/st", "2019"),
                libraryPub("Same thing twice, really", "10.4/ST", "2019"));

        MatchOutcome flagged = matchService.runMatch(Collections.<RawPublicationBean>emptyList(), library,
                new KnownPubsLedger(identityMatcher), DAY_ONE);
        MatchOutcome allowed = matchService.runMatch(Collections.<RawPublicationBean>emptyList(), library,
                new KnownPubsLedger(identityMatcher), DAY_ONE, ImmutableSet.of("editorial"));

        assertThat(flagged.getLibraryDuplicates()).isEqualTo(2);
        assertThat(allowed.getLibraryDuplicates()).isEqualTo(1);
    }

    @Test
    void merge_prefersRecordWithDoiAndFillsGaps() {
        PublicationNormalizer normalizer = new PublicationNormalizer();
        RawPublicationBean longTitle = RawPublicationBean.builder().title("A fairly long title for a paper")
                .authors("A One, B Two").journal("Journal").build();
        RawPublicationBean withDoi = RawPublicationBean.builder().title("A fairly long title for a paper")
                .doi("10.5/m").year("2020").build();

        PublicationBean merged = MatchServiceImpl.merge(normalizer.normalize(longTitle),
                normalizer.normalize(withDoi));

        assertThat(merged.getDoi()).isEqualTo("10.5/m");
        assertThat(merged.getYear()).isEqualTo(2020);
        assertThat(merged.getAuthors()).containsExactly("A One", "B Two");
        assertThat(merged.getJournal()).isEqualTo("Journal");
    }

    private static List<KnownPubBean> copy(List<KnownPubBean> entries) {
        KnownPubBean[] copies = new KnownPubBean[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            KnownPubBean entry = entries.get(i);
            copies[i] = KnownPubBean.builder().title(entry.getTitle()).authors(entry.getAuthors()).doi(entry.getDoi())
                    .year(entry.getYear()).journal(entry.getJournal()).state(entry.getState())
                    .firstSeenDate(entry.getFirstSeenDate()).entryDate(entry.getEntryDate())
                    .annotation(entry.getAnnotation()).build();
        }
        return Arrays.asList(copies);
    }
}
