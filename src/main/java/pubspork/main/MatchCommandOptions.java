package pubspork.main;

import static pubspork.main.CommandLineOptions.optional;
import static pubspork.main.CommandLineOptions.required;
import static pubspork.main.CommandLineOptions.toDate;
import static pubspork.main.CommandLineOptions.toPath;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.boot.ApplicationArguments;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import pubspork.alert.AlertSelection;
import pubspork.library.LibraryType;

/**
 * <p> Arguments of a {@code --match} run, checked before any input is read. <p>
 *
 * <pre>
 * --match
 * --libtype=zotero-csv|citeulike-json  --inputlibpath=&lt;library export&gt;
 * --alerts=&lt;alert records json&gt;  [--sources=all|src1,src2]  [--since=yyyy-MM-dd]  [--before=yyyy-MM-dd]
 * [--knownpubsin=&lt;tsv&gt;]  [--knownpubsout=&lt;tsv&gt;]  [--okduplicatetitles=&lt;txt&gt;]
 * --curationout=&lt;json&gt;
 * </pre>
 */
@Getter
@Builder
@ToString
public class MatchCommandOptions {

    public static final String MATCH = "match";
    public static final String LIBTYPE = "libtype";
    public static final String INPUT_LIB_PATH = "inputlibpath";
    public static final String ALERTS = "alerts";
    public static final String SOURCES = "sources";
    public static final String SINCE = "since";
    public static final String BEFORE = "before";
    public static final String KNOWN_PUBS_IN = "knownpubsin";
    public static final String KNOWN_PUBS_OUT = "knownpubsout";
    public static final String OK_DUPLICATE_TITLES = "okduplicatetitles";
    public static final String CURATION_OUT = "curationout";

    private final LibraryType libraryType;
    private final Path inputLibPath;
    private final Path alertsPath;
    private final AlertSelection alertSelection;
    private final Path knownPubsIn;
    private final Path knownPubsOut;
    private final Path okDuplicateTitles;
    private final Path curationOut;

    /**
     * @throws IllegalArgumentException for a missing required option or a value that does not parse
     */
    public static MatchCommandOptions from(ApplicationArguments args) {
        return MatchCommandOptions.builder()
                .libraryType(LibraryType.fromValue(required(args, LIBTYPE)))
                .inputLibPath(Paths.get(required(args, INPUT_LIB_PATH)))
                .alertsPath(Paths.get(required(args, ALERTS)))
                .alertSelection(new AlertSelection(AlertSelection.parseSources(optional(args, SOURCES)),
                        toDate(args, SINCE), toDate(args, BEFORE)))
                .knownPubsIn(toPath(optional(args, KNOWN_PUBS_IN)))
                .knownPubsOut(toPath(optional(args, KNOWN_PUBS_OUT)))
                .okDuplicateTitles(toPath(optional(args, OK_DUPLICATE_TITLES)))
                .curationOut(Paths.get(required(args, CURATION_OUT)))
                .build();
    }
}
