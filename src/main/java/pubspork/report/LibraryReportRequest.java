package pubspork.report;

import java.time.LocalDate;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Which library reports to build.
 */
@Getter
@Builder
@ToString
public class LibraryReportRequest {

    private final boolean year;
    private final boolean journal;
    private final boolean tagYear;
    private final boolean tagCountDateRange;
    /** Inclusive, only for the tag count date range report. */
    private final LocalDate entryStartDate;
    private final LocalDate entryEndDate;
    /** Report on these tags only, in place of every tag in the library. Null for all. */
    private final List<String> onlyTheseTags;
}
