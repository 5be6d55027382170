package pubspork.ledger.service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import pubspork.ledger.KnownPubBean;
import pubspork.ledger.KnownPubState;
import pubspork.ledger.KnownPubsLedger;
import pubspork.match.IdentityMatcher;
import pubspork.model.exception.InvalidRecordException;
import pubspork.model.exception.LedgerLoadException;
import pubspork.normalize.PublicationNormalizer;

/**
 * Reads and writes the known pubs ledger as tab separated text with a header row, the
 * way a spreadsheet exports it. Columns the engine does not manage are carried through,
 * and so is everything a person typed that the engine cannot read.
 */
@Slf4j
@Service
public class KnownPubsLedgerServiceImpl implements KnownPubsLedgerService {

    public static final String TITLE = "title";
    public static final String AUTHORS = "authors";
    public static final String DOI = "doi";
    public static final String YEAR = "year";
    public static final String JOURNAL = "journal";
    public static final String STATE = "state";
    public static final String FIRST_SEEN_DATE = "first_seen_date";
    public static final String ENTRY_DATE = "entry_date";
    public static final String ANNOTATION = "annotation";

    public static final List<String> COLUMNS = ImmutableList.of(TITLE, AUTHORS, DOI, YEAR, JOURNAL, STATE,
            FIRST_SEEN_DATE, ENTRY_DATE, ANNOTATION);

    private static final List<String> REQUIRED_COLUMNS = ImmutableList.of(TITLE, DOI, STATE);
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator('\t').withoutQuoteChar()
            .withLineSeparator("\n");

    private final IdentityMatcher identityMatcher;

    @Autowired
    public KnownPubsLedgerServiceImpl(IdentityMatcher identityMatcher) {
        this.identityMatcher = identityMatcher;
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Rows that are not entries, having neither title nor DOI, are counted and kept for
     * writing back. Cells that cannot be read are kept as found.
     *
     * @throws LedgerLoadException if the file exists but cannot be read as a ledger
     */
    @Override
    public KnownPubsLedger load(Path path) {
        if (!Files.exists(path)) {
            log.info("No known pubs ledger at " + path + ", starting with an empty one");
            return new KnownPubsLedger(this.identityMatcher);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<String[]> rows = this.csvMapper.readerFor(String[].class).with(this.schema)
                        .readValues(reader)) {
            if (!rows.hasNextValue()) {
                throw new LedgerLoadException("Known pubs ledger " + path + " has no header row");
            }
            List<String> header = readHeader(rows.nextValue(), path);
            Map<String, Integer> columnIndex = new HashMap<>();
            List<String> extraColumns = new ArrayList<>();
            for (int i = 0; i < header.size(); i++) {
                columnIndex.put(header.get(i), i);
                if (!COLUMNS.contains(header.get(i))) {
                    extraColumns.add(header.get(i));
                }
            }
            KnownPubsLedger ledger = new KnownPubsLedger(this.identityMatcher, extraColumns);
            int rowNumber = 1;
            while (rows.hasNextValue()) {
                String[] row = decode(rows.nextValue());
                rowNumber++;
                KnownPubBean entry = toEntry(row, header.size(), columnIndex, extraColumns, path, rowNumber);
                try {
                    ledger.addLoadedEntry(entry);
                } catch (InvalidRecordException e) {
                    log.warn("Row " + rowNumber + " of " + path + " is not a known pub, keeping it as is: "
                            + e.getMessage());
                    ledger.keepUnreadableRow(toSaveOrder(row, header.size(), columnIndex, extraColumns));
                }
            }
            log.info("Loaded " + ledger.size() + " known pubs from " + path
                    + (ledger.getSkippedRows() > 0 ? ", " + ledger.getSkippedRows() + " rows kept unread" : ""));
            return ledger;
        } catch (IOException e) {
            throw new LedgerLoadException("Unable to read known pubs ledger " + path + ": " + e.getMessage(), e);
        }
    }

    private List<String> readHeader(String[] headerRow, Path path) {
        List<String> header = new ArrayList<>();
        for (String name : headerRow) {
            header.add(StringUtils.removeStart(StringUtils.trimToEmpty(name), BYTE_ORDER_MARK).trim());
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!header.contains(required)) {
                throw new LedgerLoadException("Known pubs ledger " + path + " has no '" + required
                        + "' column, header is " + header);
            }
        }
        return header;
    }

    private static String[] decode(String[] row) {
        String[] decoded = new String[row.length];
        for (int i = 0; i < row.length; i++) {
            decoded[i] = LedgerCells.fromFileCell(row[i]);
        }
        return decoded;
    }

    private KnownPubBean toEntry(String[] row, int width, Map<String, Integer> columnIndex, List<String> extraColumns,
            Path path, int rowNumber) {
        String where = "row " + rowNumber + " of " + path;
        KnownPubBean entry = new KnownPubBean();
        entry.setTitle(cell(row, columnIndex, TITLE));
        entry.setAuthors(cell(row, columnIndex, AUTHORS));
        entry.setDoi(PublicationNormalizer.toCanonicalDoi(cell(row, columnIndex, DOI)));
        String year = cell(row, columnIndex, YEAR).trim();
        if (!year.isEmpty()) {
            entry.setYear(PublicationNormalizer.extractYear(year));
            if (entry.getYear() == null) {
                log.warn("Unreadable year '" + year + "' in " + where + ", keeping it as is");
                entry.getUnreadCells().put(YEAR, cell(row, columnIndex, YEAR));
            }
        }
        entry.setJournal(StringUtils.trimToNull(cell(row, columnIndex, JOURNAL)));
        entry.setState(toState(row, columnIndex, entry, where));
        entry.setFirstSeenDate(toDate(row, columnIndex, FIRST_SEEN_DATE, entry, where));
        entry.setEntryDate(toDate(row, columnIndex, ENTRY_DATE, entry, where));
        entry.setAnnotation(cell(row, columnIndex, ANNOTATION));
        for (String column : extraColumns) {
            entry.getExtraColumns().put(column, cell(row, columnIndex, column));
        }
        if (row.length > width) {
            log.warn(where + " has " + row.length + " fields but the header has " + width
                    + ", keeping the extra fields as they are");
            entry.getTrailingCells().addAll(Arrays.asList(row).subList(width, row.length));
        }
        return entry;
    }

    /**
     * A state we do not know, such as {@code wait}, is matched like {@code new} and written back as found.
     */
    private static KnownPubState toState(String[] row, Map<String, Integer> columnIndex, KnownPubBean entry,
            String where) {
        String state = cell(row, columnIndex, STATE);
        if (state.trim().isEmpty()) {
            return KnownPubState.NEW;
        }
        try {
            return KnownPubState.fromValue(state);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown state '" + state + "' in " + where + ", treating it as " + KnownPubState.NEW);
            entry.getUnreadCells().put(STATE, state);
            return KnownPubState.NEW;
        }
    }

    private static LocalDate toDate(String[] row, Map<String, Integer> columnIndex, String column,
            KnownPubBean entry, String where) {
        String value = cell(row, columnIndex, column);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            log.warn("Unreadable " + column + " '" + value + "' in " + where + ", keeping it as is");
            entry.getUnreadCells().put(column, value);
            return null;
        }
    }

    private static String cell(String[] row, Map<String, Integer> columnIndex, String column) {
        Integer index = columnIndex.get(column);
        if (index == null || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index];
    }

    private static List<String> toSaveOrder(String[] row, int width, Map<String, Integer> columnIndex,
            List<String> extraColumns) {
        List<String> cells = new ArrayList<>();
        for (String column : COLUMNS) {
            cells.add(cell(row, columnIndex, column));
        }
        for (String column : extraColumns) {
            cells.add(cell(row, columnIndex, column));
        }
        if (row.length > width) {
            cells.addAll(Arrays.asList(row).subList(width, row.length));
        }
        return cells;
    }

    /**
     * Writes the ledger next to its destination and moves it into place, so a failed
     * write leaves the previous file alone.
     */
    @Override
    public void save(KnownPubsLedger ledger, Path path) {
        Path target = path.toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                    SequenceWriter rows = this.csvMapper.writerFor(String[].class).with(this.schema)
                            .writeValues(writer)) {
                List<String> header = new ArrayList<>(COLUMNS);
                header.addAll(ledger.getExtraColumnNames());
                rows.write(encode(header));
                for (KnownPubBean entry : ledger.getEntriesInSaveOrder()) {
                    rows.write(toRow(entry, ledger.getExtraColumnNames()));
                }
                for (List<String> unreadable : ledger.getUnreadableRows()) {
                    rows.write(encode(unreadable));
                }
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for " + target + ", replacing it", e);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved " + ledger.size() + " known pubs to " + target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Unable to write known pubs ledger " + target, e);
        }
    }

    private static String[] toRow(KnownPubBean entry, List<String> extraColumns) {
        Map<String, String> unread = entry.getUnreadCells();
        List<String> row = new ArrayList<>();
        row.add(StringUtils.defaultString(entry.getTitle()));
        row.add(StringUtils.defaultString(entry.getAuthors()));
        row.add(StringUtils.defaultString(entry.getDoi()));
        row.add(entry.getYear() != null ? entry.getYear().toString() : StringUtils.defaultString(unread.get(YEAR)));
        row.add(StringUtils.defaultString(entry.getJournal()));
        row.add(entry.getState() == KnownPubState.NEW && unread.containsKey(STATE) ? unread.get(STATE)
                : entry.getState().getValue());
        row.add(entry.getFirstSeenDate() != null ? entry.getFirstSeenDate().toString()
                : StringUtils.defaultString(unread.get(FIRST_SEEN_DATE)));
        row.add(entry.getEntryDate() != null ? entry.getEntryDate().toString()
                : StringUtils.defaultString(unread.get(ENTRY_DATE)));
        row.add(StringUtils.defaultString(entry.getAnnotation()));
        for (String column : extraColumns) {
            row.add(StringUtils.defaultString(entry.getExtraColumns().get(column)));
        }
        row.addAll(entry.getTrailingCells());
        return encode(row);
    }

    private static String[] encode(List<String> cells) {
        String[] row = new String[cells.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = LedgerCells.toFileCell(StringUtils.defaultString(cells.get(i)));
        }
        return row;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Unable to remove temporary ledger file " + temp, e);
        }
    }
}
