package pubspork.main;

import static pubspork.main.CommandLineOptions.optional;
import static pubspork.main.CommandLineOptions.required;
import static pubspork.main.CommandLineOptions.toDate;
import static pubspork.main.CommandLineOptions.toPath;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;

import org.springframework.boot.ApplicationArguments;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import pubspork.library.LibraryType;

/**
 * <p> Arguments of a {@code --report} run, checked before the library is read. <p>
 *
 * <pre>
 * --report
 * --libtype=zotero-csv|citeulike-json  --inputlibpath=&lt;library export&gt;
 * [--year]  [--journal]  [--tagyear]  [--tagcountdaterange --entrystartdate=yyyy-MM-dd --entryenddate=yyyy-MM-dd]
 * [--onlythesetags=&lt;txt, one tag per line&gt;]
 * --reportout=&lt;json&gt;
 * </pre>
 */
@Getter
@Builder
@ToString
public class ReportCommandOptions {

    public static final String REPORT = "report";
    public static final String LIBTYPE = "libtype";
    public static final String INPUT_LIB_PATH = "inputlibpath";
    public static final String YEAR = "year";
    public static final String JOURNAL = "journal";
    public static final String TAG_YEAR = "tagyear";
    public static final String TAG_COUNT_DATE_RANGE = "tagcountdaterange";
    public static final String ENTRY_START_DATE = "entrystartdate";
    public static final String ENTRY_END_DATE = "entryenddate";
    public static final String ONLY_THESE_TAGS = "onlythesetags";
    public static final String REPORT_OUT = "reportout";

    private final LibraryType libraryType;
    private final Path inputLibPath;
    private final boolean year;
    private final boolean journal;
    private final boolean tagYear;
    private final boolean tagCountDateRange;
    private final LocalDate entryStartDate;
    private final LocalDate entryEndDate;
    private final Path onlyTheseTags;
    private final Path reportOut;

    /**
     * @throws IllegalArgumentException for a missing required option, a value that does not parse,
     *                                  no report selected, or a date range report without its dates
     */
    public static ReportCommandOptions from(ApplicationArguments args) {
        ReportCommandOptions options = ReportCommandOptions.builder()
                .libraryType(LibraryType.fromValue(required(args, LIBTYPE)))
                .inputLibPath(Paths.get(required(args, INPUT_LIB_PATH)))
                .year(args.containsOption(YEAR))
                .journal(args.containsOption(JOURNAL))
                .tagYear(args.containsOption(TAG_YEAR))
                .tagCountDateRange(args.containsOption(TAG_COUNT_DATE_RANGE))
                .entryStartDate(toDate(args, ENTRY_START_DATE))
                .entryEndDate(toDate(args, ENTRY_END_DATE))
                .onlyTheseTags(toPath(optional(args, ONLY_THESE_TAGS)))
                .reportOut(Paths.get(required(args, REPORT_OUT)))
                .build();
        if (!options.year && !options.journal && !options.tagYear && !options.tagCountDateRange) {
            throw new IllegalArgumentException("Nothing to report, give one or more of --" + YEAR + ", --" + JOURNAL
                    + ", --" + TAG_YEAR + ", --" + TAG_COUNT_DATE_RANGE);
        }
        if (options.tagCountDateRange) {
            if (options.entryStartDate == null || options.entryEndDate == null) {
                throw new IllegalArgumentException("--" + TAG_COUNT_DATE_RANGE + " needs --" + ENTRY_START_DATE
                        + " and --" + ENTRY_END_DATE);
            }
            if (options.entryEndDate.isBefore(options.entryStartDate)) {
                throw new IllegalArgumentException("--" + ENTRY_END_DATE + " " + options.entryEndDate
                        + " is before --" + ENTRY_START_DATE + " " + options.entryStartDate);
            }
        }
        return options;
    }
}
