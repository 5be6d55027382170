package pubspork.report.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pubspork.beans.RawPublicationBean;
import pubspork.library.LibraryType;
import pubspork.main.Application;
import pubspork.normalize.PublicationNormalizer;
import pubspork.report.JournalCountBean;
import pubspork.report.LibraryReportBean;
import pubspork.report.LibraryReportRequest;
import pubspork.report.TagCountBean;
import pubspork.report.YearCountBean;

class LibraryReportServiceImplTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 8);

    private final ObjectMapper objectMapper = Application.getObjectMapper();
    private final LibraryReportServiceImpl service = new LibraryReportServiceImpl(new PublicationNormalizer(),
            objectMapper);

    @TempDir
    Path tempDir;

    private static RawPublicationBean pub(String title, String year, String journal, String added, String... tags) {
        return RawPublicationBean.builder().origin("zotero-csv").title(title).year(year).journal(journal)
                .entryDate(added == null ? null : LocalDate.parse(added)).tags(Arrays.asList(tags)).build();
    }

    private final List<RawPublicationBean> library = Arrays.asList(
            pub("Paper one", "2019", "Nucleic Acids Research", "2019-06-01", "Methods", "Tools"),
            pub("Paper two", "2020", "nucleic acids research.", "2020-02-01", "Tools"),
            pub("Paper three", "2020", "Bioinformatics", "2020-03-15", "Tools", "Usage"),
            pub("Paper four", null, "GigaScience", "2020-04-01", "usage"),
            pub("Paper five", "2020", null, null),
            pub(null, "2020", null, null));

    private static LibraryReportRequest.LibraryReportRequestBuilder request() {
        return LibraryReportRequest.builder();
    }

    @Test
    void buildReport_countsByYearWithUnknownLast() {
        LibraryReportBean report = service.buildReport(library, LibraryType.ZOTERO_CSV,
                request().year(true).build(), TODAY);

        assertThat(report.getPublicationCount()).isEqualTo(5);
        assertThat(report.getSkippedRecords()).isEqualTo(1);
        assertThat(report.getYears()).extracting(YearCountBean::getYear).containsExactly("2019", "2020", "unknown");
        assertThat(report.getYears()).extracting(YearCountBean::getCount).containsExactly(1, 3, 1);
        assertThat(report.getJournals()).isNull();
        assertThat(report.getTagYears()).isNull();
    }

    @Test
    void buildReport_groupsJournalsAndSharesRanks() {
        LibraryReportBean report = service.buildReport(library, LibraryType.ZOTERO_CSV,
                request().journal(true).build(), TODAY);

        assertThat(report.getJournals()).extracting(JournalCountBean::getJournal)
                .containsExactly("Nucleic Acids Research", "Bioinformatics", "GigaScience");
        assertThat(report.getJournals()).extracting(JournalCountBean::getCount).containsExactly(2, 1, 1);
        assertThat(report.getJournals()).extracting(JournalCountBean::getRank).containsExactly(1, 2, 2);
    }

    @Test
    void buildReport_countsTagsPerYear() {
        LibraryReportBean report = service.buildReport(library, LibraryType.ZOTERO_CSV,
                request().tagYear(true).build(), TODAY);

        List<TagCountBean> tags = report.getTagYears();
        assertThat(tags).extracting(TagCountBean::getTag).containsExactly("Tools", "Methods", "Usage", "usage");
        TagCountBean tools = tags.get(0);
        assertThat(tools.getCount()).isEqualTo(3);
        assertThat(tools.getCountsByYear()).containsExactly(
                entry("2019", 1), entry("2020", 2), entry("unknown", 0));
    }

    @Test
    void buildReport_onlyTheseTags_includesTagsNobodyHas() {
        LibraryReportBean report = service.buildReport(library, LibraryType.ZOTERO_CSV,
                request().tagYear(true).onlyTheseTags(Arrays.asList("Methods", "Training")).build(), TODAY);

        assertThat(report.getTagYears()).extracting(TagCountBean::getTag).containsExactly("Methods", "Training");
        assertThat(report.getTagYears()).extracting(TagCountBean::getCount).containsExactly(1, 0);
    }

    @Test
    void buildReport_countsTagsAddedWithinDateRange() {
        LibraryReportBean report = service.buildReport(library, LibraryType.ZOTERO_CSV,
                request().tagCountDateRange(true).entryStartDate(LocalDate.of(2020, 2, 1))
                        .entryEndDate(LocalDate.of(2020, 3, 15)).build(), TODAY);

        assertThat(report.getTagCountDateRange().getPublicationCount()).isEqualTo(2);
        assertThat(report.getTagCountDateRange().getTags()).extracting(TagCountBean::getTag)
                .containsExactly("Tools", "Usage", "Methods", "usage");
        assertThat(report.getTagCountDateRange().getTags()).extracting(TagCountBean::getCount)
                .containsExactly(2, 1, 0, 0);
    }

    @Test
    void writeReport_writesOnlyRequestedReports() throws IOException {
        LibraryReportBean report = service.buildReport(library, LibraryType.CITEULIKE_JSON,
                request().year(true).build(), TODAY);
        Path out = tempDir.resolve("reports/library.json");

        service.writeReport(report, out);

        JsonNode json = objectMapper.readTree(out.toFile());
        assertThat(json.get("reportDate").asText()).isEqualTo("2024-03-08");
        assertThat(json.get("libraryType").asText()).isEqualTo("citeulike-json");
        assertThat(json.get("years")).hasSize(3);
        assertThat(json.has("journals")).isFalse();
        assertThat(json.has("tagCountDateRange")).isFalse();
    }
}
