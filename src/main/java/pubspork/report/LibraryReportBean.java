package pubspork.report;

import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * <p> Counts about a publication library, for whatever renders the library report. Only
 * the reports that were asked for are filled in. <p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LibraryReportBean {

    private LocalDate reportDate;
    private String libraryType;
    private int publicationCount;
    private int skippedRecords;
    private List<YearCountBean> years;
    private List<JournalCountBean> journals;
    private List<TagCountBean> tagYears;
    private TagCountDateRangeBean tagCountDateRange;
}
