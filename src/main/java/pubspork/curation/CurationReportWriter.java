package pubspork.curation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pubspork.beans.PublicationBean;
import pubspork.match.service.Classification;
import pubspork.match.service.ClassifiedPublication;
import pubspork.match.service.MatchOutcome;

/**
 * Writes the outcome of a match run as JSON for whatever renders the curation page.
 * Previously ignored pubs are counted but left out of the items unless asked for.
 */
@Slf4j
@Component
public class CurationReportWriter {

    private static final Comparator<ClassifiedPublication> CURATION_ORDER = Comparator
            .comparing(ClassifiedPublication::getClassification)
            .thenComparing(item -> item.getPublication().getTitle());

    private final ObjectMapper objectMapper;
    private final CurationLinkBuilder curationLinkBuilder;
    private final boolean includeIgnored;

    @Autowired
    public CurationReportWriter(ObjectMapper objectMapper, CurationLinkBuilder curationLinkBuilder,
            @Value("${pubspork.curation.include-ignored:false}") boolean includeIgnored) {
        this.objectMapper = objectMapper;
        this.curationLinkBuilder = curationLinkBuilder;
        this.includeIgnored = includeIgnored;
    }

    public CurationReportBean toReport(MatchOutcome outcome, LocalDate runDate) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Classification classification : Classification.values()) {
            counts.put(classification.getValue(), outcome.getCount(classification));
        }
        List<ClassifiedPublication> sorted = new ArrayList<>(outcome.getClassified());
        sorted.sort(CURATION_ORDER);
        List<CurationItemBean> items = new ArrayList<>();
        for (ClassifiedPublication item : sorted) {
            if (item.getClassification() == Classification.PREVIOUSLY_IGNORED && !this.includeIgnored) {
                continue;
            }
            items.add(toItem(item));
        }
        return new CurationReportBean(runDate, counts, outcome.getSkippedRecords(), outcome.getLibraryDuplicates(),
                items);
    }

    public void write(MatchOutcome outcome, LocalDate runDate, Path path) {
        CurationReportBean report = toReport(outcome, runDate);
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            this.objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write curation data to " + path, e);
        }
        log.info("Wrote " + report.getItems().size() + " curation items to " + path);
    }

    private CurationItemBean toItem(ClassifiedPublication item) {
        PublicationBean publication = item.getPublication();
        CurationItemBean.CurationItemBeanBuilder builder = CurationItemBean.builder()
                .classification(item.getClassification().getValue())
                .matchTier(item.getTier() == null ? null : item.getTier().getValue())
                .title(publication.getRawTitle())
                .authors(publication.getAuthors())
                .doi(publication.getDoi())
                .year(publication.getYear())
                .journal(publication.getJournal())
                .alertCount(item.getAlertCount())
                .sources(item.getOrigins())
                .searches(item.getSearches())
                .links(this.curationLinkBuilder.build(publication));
        if (item.getEntry() != null) {
            builder.firstSeenDate(item.getEntry().getFirstSeenDate())
                    .annotation(item.getEntry().getAnnotation());
        }
        return builder.build();
    }
}
