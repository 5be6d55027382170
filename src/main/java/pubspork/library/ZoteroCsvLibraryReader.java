package pubspork.library;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Splitter;

import org.apache.commons.lang.StringUtils;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pubspork.beans.RawPublicationBean;
import pubspork.model.exception.LibraryReadException;

/**
 * <p> Reads the CSV export of a Zotero user or group library. Authors come as
 * "Last, First; Last, First". The journal is only taken from journal articles, for
 * everything else the Publication Title column is a book or proceedings title. <p>
 */
@Slf4j
@Component
public class ZoteroCsvLibraryReader implements LibraryReader {

    static final String KEY = "Key";
    static final String ITEM_TYPE = "Item Type";
    static final String TITLE = "Title";
    static final String AUTHOR = "Author";
    static final String DOI = "DOI";
    static final String URL = "Url";
    static final String PUBLICATION_YEAR = "Publication Year";
    static final String PUBLICATION_TITLE = "Publication Title";
    static final String DATE = "Date";
    static final String MANUAL_TAGS = "Manual Tags";
    static final String DATE_ADDED = "Date Added";

    private static final String JOURNAL_ARTICLE = "journalArticle";
    private static final Splitter TAGS = Splitter.on(';').trimResults().omitEmptyStrings();

    private final CsvMapper csvMapper = new CsvMapper();

    public ZoteroCsvLibraryReader() {
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public LibraryType getType() {
        return LibraryType.ZOTERO_CSV;
    }

    @Override
    public List<RawPublicationBean> read(Path path) {
        List<RawPublicationBean> publications = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows = this.csvMapper.readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader()).readValues(reader)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = cleanKeys(rows.nextValue());
                publications.add(toRawPublication(row));
            }
        } catch (IOException e) {
            throw new LibraryReadException("Unable to read Zotero library export " + path, e);
        }
        log.info("Read " + publications.size() + " publications from Zotero library " + path);
        return publications;
    }

    private RawPublicationBean toRawPublication(Map<String, String> row) {
        String title = row.get(TITLE);
        if (StringUtils.isBlank(row.get(AUTHOR))) {
            log.warn("Zotero pub " + row.get(KEY) + " '" + title + "' does not have any authors");
        }
        if (StringUtils.isBlank(row.get(PUBLICATION_YEAR))) {
            log.warn("Zotero pub " + row.get(KEY) + " '" + title + "' does not have a publication year");
        }
        return RawPublicationBean.builder()
                .origin(getType().getValue())
                .title(title)
                .authors(row.get(AUTHOR))
                .doi(row.get(DOI))
                .url(row.get(URL))
                .year(row.get(PUBLICATION_YEAR))
                .date(row.get(DATE))
                .journal(JOURNAL_ARTICLE.equals(row.get(ITEM_TYPE)) ? row.get(PUBLICATION_TITLE) : null)
                .tags(row.get(MANUAL_TAGS) == null ? new ArrayList<>() : TAGS.splitToList(row.get(MANUAL_TAGS)))
                .entryDate(EntryDates.parse(row.get(DATE_ADDED), "Zotero pub " + row.get(KEY)))
                .build();
    }

    /**
     * Zotero starts the file with a byte order mark, which ends up glued to the first
     * column name along with its quotes.
     */
    private static Map<String, String> cleanKeys(Map<String, String> row) {
        Map<String, String> cleaned = new HashMap<>();
        for (Map.Entry<String, String> column : row.entrySet()) {
            String key = StringUtils.strip(StringUtils.remove(column.getKey(), '\uFEFF'), "\" ");
            cleaned.put(key, column.getValue());
        }
        return cleaned;
    }
}
