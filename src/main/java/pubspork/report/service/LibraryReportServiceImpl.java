package pubspork.report.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import pubspork.beans.PublicationBean;
import pubspork.beans.RawPublicationBean;
import pubspork.library.LibraryType;
import pubspork.model.exception.InvalidRecordException;
import pubspork.normalize.PublicationNormalizer;
import pubspork.report.JournalCountBean;
import pubspork.report.LibraryReportBean;
import pubspork.report.LibraryReportRequest;
import pubspork.report.TagCountBean;
import pubspork.report.TagCountDateRangeBean;
import pubspork.report.YearCountBean;

/**
 * <p><b><i>Counts publications in a library by year, journal and tag.<p><b><i>
 *
 * Journals are grouped by their comparison form and reported under the first name seen,
 * most publications first. Tags are ordered by count, most first, then alphabetically.
 */
@Slf4j
@Service
public class LibraryReportServiceImpl implements LibraryReportService {

    public static final String UNKNOWN_YEAR = "unknown";

    private static final Comparator<TagCountBean> TAG_ORDER = Comparator.comparingInt(TagCountBean::getCount)
            .reversed()
            .thenComparing(tag -> tag.getTag().toLowerCase(Locale.ROOT))
            .thenComparing(TagCountBean::getTag);

    private final PublicationNormalizer publicationNormalizer;
    private final ObjectMapper objectMapper;

    @Autowired
    public LibraryReportServiceImpl(PublicationNormalizer publicationNormalizer, ObjectMapper objectMapper) {
        this.publicationNormalizer = publicationNormalizer;
        this.objectMapper = objectMapper;
    }

    @Override
    public LibraryReportBean buildReport(List<RawPublicationBean> library, LibraryType libraryType,
            LibraryReportRequest request, LocalDate reportDate) {
        StopWatch stopWatch = new StopWatch("Library report");
        stopWatch.start("Library report");
        List<LibraryEntry> entries = new ArrayList<>();
        for (RawPublicationBean raw : library) {
            try {
                entries.add(toEntry(this.publicationNormalizer.normalize(raw), raw));
            } catch (InvalidRecordException e) {
                log.warn("Skipping library record: " + e.getMessage());
            }
        }

        LibraryReportBean report = new LibraryReportBean();
        report.setReportDate(reportDate);
        report.setLibraryType(libraryType.getValue());
        report.setPublicationCount(entries.size());
        report.setSkippedRecords(library.size() - entries.size());
        Map<String, Integer> yearCounts = countByYear(entries);
        if (request.isYear()) {
            List<YearCountBean> years = new ArrayList<>();
            for (Map.Entry<String, Integer> count : yearCounts.entrySet()) {
                years.add(new YearCountBean(count.getKey(), count.getValue()));
            }
            report.setYears(years);
        }
        if (request.isJournal()) {
            report.setJournals(countByJournal(entries));
        }
        if (request.isTagYear()) {
            report.setTagYears(countByTagAndYear(entries, yearCounts.keySet(), request.getOnlyTheseTags()));
        }
        if (request.isTagCountDateRange()) {
            report.setTagCountDateRange(countTagsInDateRange(entries, request));
        }
        stopWatch.stop();
        log.info("Built library report on " + entries.size() + " publications: " + request);
        log.info("Library report Time taken: " + stopWatch.getTotalTimeSeconds() + "s");
        return report;
    }

    @Override
    public void writeReport(LibraryReportBean report, Path path) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            this.objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write library report to " + path, e);
        }
        log.info("Wrote library report to " + path);
    }

    private static LibraryEntry toEntry(PublicationBean publication, RawPublicationBean raw) {
        String year = publication.getYear() == null ? UNKNOWN_YEAR : publication.getYear().toString();
        if (publication.getYear() == null) {
            log.warn("Year unknown: '" + publication.getRawTitle() + "'");
        }
        List<String> tags = raw.getTags() == null ? Collections.<String>emptyList() : raw.getTags();
        if (tags.isEmpty()) {
            log.warn("Publication has no tags: '" + publication.getRawTitle() + "'");
        }
        return new LibraryEntry(year, publication.getJournal(), tags, raw.getEntryDate());
    }

    /**
     * Publications per year, years in order and {@code unknown} last.
     */
    private static Map<String, Integer> countByYear(List<LibraryEntry> entries) {
        Map<String, Integer> counts = new TreeMap<>();
        for (LibraryEntry entry : entries) {
            counts.merge(entry.year, 1, Integer::sum);
        }
        return counts;
    }

    private static List<JournalCountBean> countByJournal(List<LibraryEntry> entries) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (LibraryEntry entry : entries) {
            if (entry.journal == null) {
                continue;
            }
            String canonical = PublicationNormalizer.toComparisonTitle(entry.journal);
            names.putIfAbsent(canonical, entry.journal);
            counts.merge(canonical, 1, Integer::sum);
        }
        List<String> ranked = new ArrayList<>(counts.keySet());
        ranked.sort(Comparator.<String>comparingInt(counts::get).reversed().thenComparing(Comparator.naturalOrder()));
        List<JournalCountBean> journals = new ArrayList<>();
        int rank = 0;
        int previousCount = -1;
        for (int i = 0; i < ranked.size(); i++) {
            int count = counts.get(ranked.get(i));
            if (count != previousCount) {
                rank = i + 1;
                previousCount = count;
            }
            journals.add(new JournalCountBean(rank, names.get(ranked.get(i)), count));
        }
        return journals;
    }

    private static List<TagCountBean> countByTagAndYear(List<LibraryEntry> entries, Collection<String> years,
            List<String> onlyTheseTags) {
        Map<String, Map<String, Integer>> byTag = emptyTagCounts(entries, onlyTheseTags);
        for (Map<String, Integer> byYear : byTag.values()) {
            for (String year : years) {
                byYear.put(year, 0);
            }
        }
        for (LibraryEntry entry : entries) {
            for (String tag : entry.tags) {
                Map<String, Integer> byYear = byTag.get(tag);
                if (byYear != null) {
                    byYear.merge(entry.year, 1, Integer::sum);
                }
            }
        }
        List<TagCountBean> tags = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> tag : byTag.entrySet()) {
            int total = 0;
            for (int count : tag.getValue().values()) {
                total += count;
            }
            tags.add(new TagCountBean(tag.getKey(), total, tag.getValue()));
        }
        tags.sort(TAG_ORDER);
        return tags;
    }

    private static TagCountDateRangeBean countTagsInDateRange(List<LibraryEntry> entries,
            LibraryReportRequest request) {
        LocalDate start = request.getEntryStartDate();
        LocalDate end = request.getEntryEndDate();
        Map<String, Map<String, Integer>> byTag = emptyTagCounts(entries, request.getOnlyTheseTags());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String tag : byTag.keySet()) {
            counts.put(tag, 0);
        }
        int inRange = 0;
        for (LibraryEntry entry : entries) {
            if (entry.entryDate == null || entry.entryDate.isBefore(start) || entry.entryDate.isAfter(end)) {
                continue;
            }
            inRange++;
            for (String tag : entry.tags) {
                if (counts.containsKey(tag)) {
                    counts.merge(tag, 1, Integer::sum);
                }
            }
        }
        List<TagCountBean> tags = new ArrayList<>();
        for (Map.Entry<String, Integer> count : counts.entrySet()) {
            tags.add(new TagCountBean(count.getKey(), count.getValue(), null));
        }
        tags.sort(TAG_ORDER);
        return new TagCountDateRangeBean(start, end, inRange, tags);
    }

    /**
     * Every tag in the library, or just the listed ones even when no publication has them.
     */
    private static Map<String, Map<String, Integer>> emptyTagCounts(List<LibraryEntry> entries,
            List<String> onlyTheseTags) {
        Map<String, Map<String, Integer>> byTag = new TreeMap<>();
        if (onlyTheseTags != null) {
            for (String tag : onlyTheseTags) {
                byTag.put(tag, new LinkedHashMap<>());
            }
            return byTag;
        }
        for (LibraryEntry entry : entries) {
            for (String tag : entry.tags) {
                byTag.putIfAbsent(tag, new LinkedHashMap<>());
            }
        }
        return byTag;
    }

    @AllArgsConstructor
    private static class LibraryEntry {
        private final String year;
        private final String journal;
        private final List<String> tags;
        private final LocalDate entryDate;
    }
}
