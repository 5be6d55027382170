package pubspork.main;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.apache.commons.lang.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.PropertySource;
import org.springframework.util.StopWatch;

import lombok.extern.slf4j.Slf4j;
import pubspork.alert.AlertRecordReader;
import pubspork.beans.RawPublicationBean;
import pubspork.curation.CurationReportWriter;
import pubspork.ledger.KnownPubsLedger;
import pubspork.ledger.service.KnownPubsLedgerService;
import pubspork.library.LibraryReaders;
import pubspork.match.IdentityMatcher;
import pubspork.match.service.MatchOutcome;
import pubspork.match.service.MatchService;
import pubspork.report.LibraryReportBean;
import pubspork.report.LibraryReportRequest;
import pubspork.report.service.LibraryReportService;

@SpringBootApplication
@PropertySource("classpath:application.properties")
@ComponentScan({ "pubspork" })
@Slf4j
public class Application implements ApplicationRunner {

    private static final String USAGE = "Usage: --match --libtype=zotero-csv|citeulike-json --inputlibpath=<export>"
            + " --alerts=<alert records> [--sources=all|<source>,...] [--since=yyyy-MM-dd] [--before=yyyy-MM-dd]"
            + " [--knownpubsin=<tsv>] [--knownpubsout=<tsv>] [--okduplicatetitles=<txt>] --curationout=<json>"
            + "\n   or: --report --libtype=zotero-csv|citeulike-json --inputlibpath=<export> [--year] [--journal]"
            + " [--tagyear] [--tagcountdaterange --entrystartdate=yyyy-MM-dd --entryenddate=yyyy-MM-dd]"
            + " [--onlythesetags=<txt>] --reportout=<json>";

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MatchService matchService;

    @Autowired
    private KnownPubsLedgerService knownPubsLedgerService;

    @Autowired
    private LibraryReaders libraryReaders;

    @Autowired
    private AlertRecordReader alertRecordReader;

    @Autowired
    private CurationReportWriter curationReportWriter;

    @Autowired
    private LibraryReportService libraryReportService;

    @Bean
    public static Clock getClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper getObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class).web(WebApplicationType.NONE).run(args);
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (args.containsOption(MatchCommandOptions.MATCH)) {
            match(MatchCommandOptions.from(args));
        } else if (args.containsOption(ReportCommandOptions.REPORT)) {
            report(ReportCommandOptions.from(args));
        } else {
            log.info(USAGE);
        }
    }

    private void match(MatchCommandOptions options) {
        log.info("Match run with " + options);
        LocalDate today = LocalDate.now(context.getBean(Clock.class));

        StopWatch stopWatch = new StopWatch("PubSpork match");
        stopWatch.start("Reading inputs");
        KnownPubsLedger ledger = options.getKnownPubsIn() != null
                ? knownPubsLedgerService.load(options.getKnownPubsIn())
                : new KnownPubsLedger(context.getBean(IdentityMatcher.class));
        List<RawPublicationBean> library = libraryReaders.forType(options.getLibraryType())
                .read(options.getInputLibPath());
        List<RawPublicationBean> alerts = alertRecordReader.read(options.getAlertsPath(), options.getAlertSelection());
        Set<String> okDuplicateTitles = options.getOkDuplicateTitles() == null ? Collections.<String>emptySet()
                : readLines(options.getOkDuplicateTitles(), "ok duplicate titles");
        stopWatch.stop();

        stopWatch.start("Matching");
        MatchOutcome outcome = matchService.runMatch(alerts, library, ledger, today, okDuplicateTitles);
        stopWatch.stop();

        stopWatch.start("Writing outputs");
        if (options.getKnownPubsOut() != null) {
            knownPubsLedgerService.save(outcome.getLedger(), options.getKnownPubsOut());
        }
        curationReportWriter.write(outcome, today, options.getCurationOut());
        stopWatch.stop();
        log.info(stopWatch.prettyPrint());
    }

    private void report(ReportCommandOptions options) {
        log.info("Report run with " + options);
        LocalDate today = LocalDate.now(context.getBean(Clock.class));
        List<String> onlyTheseTags = options.getOnlyTheseTags() == null ? null
                : new ArrayList<>(readLines(options.getOnlyTheseTags(), "report tags"));
        LibraryReportRequest request = LibraryReportRequest.builder()
                .year(options.isYear())
                .journal(options.isJournal())
                .tagYear(options.isTagYear())
                .tagCountDateRange(options.isTagCountDateRange())
                .entryStartDate(options.getEntryStartDate())
                .entryEndDate(options.getEntryEndDate())
                .onlyTheseTags(onlyTheseTags)
                .build();
        List<RawPublicationBean> library = libraryReaders.forType(options.getLibraryType())
                .read(options.getInputLibPath());
        LibraryReportBean report = libraryReportService.buildReport(library, options.getLibraryType(), request, today);
        libraryReportService.writeReport(report, options.getReportOut());
    }

    /**
     * @return the non blank lines of a text file, trimmed, in file order
     */
    private static Set<String> readLines(Path path, String what) {
        Set<String> lines = new LinkedHashSet<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (StringUtils.isNotBlank(line)) {
                    lines.add(line.trim());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + what + " " + path, e);
        }
        log.info("Read " + lines.size() + " " + what + " from " + path);
        return lines;
    }
}
