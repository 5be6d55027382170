package pubspork.library;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import pubspork.beans.RawPublicationBean;
import pubspork.model.exception.LibraryReadException;

/**
 * Reads the JSON export of a CiteULike user or group library.
 */
@Slf4j
@Component
public class CiteULikeJsonLibraryReader implements LibraryReader {

    private static final Joiner AUTHOR_JOINER = Joiner.on("; ").skipNulls();

    private final ObjectMapper objectMapper;

    @Autowired
    public CiteULikeJsonLibraryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public LibraryType getType() {
        return LibraryType.CITEULIKE_JSON;
    }

    @Override
    public List<RawPublicationBean> read(Path path) {
        List<CiteULikePub> pubs;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            pubs = this.objectMapper.readValue(reader, new TypeReference<List<CiteULikePub>>() {});
        } catch (IOException e) {
            throw new LibraryReadException("Unable to read CiteULike library export " + path, e);
        }
        List<RawPublicationBean> publications = new ArrayList<>();
        for (CiteULikePub pub : pubs) {
            publications.add(RawPublicationBean.builder()
                    .origin(getType().getValue())
                    .title(pub.getTitle())
                    .authors(pub.getAuthors() == null ? null : AUTHOR_JOINER.join(pub.getAuthors()))
                    .doi(pub.getDoi())
                    .url(pub.getHref())
                    .journal(pub.getJournal())
                    .year(pub.getPublished() == null || pub.getPublished().isEmpty() ? null : pub.getPublished().get(0))
                    .tags(pub.getTags() == null ? new ArrayList<>() : pub.getTags())
                    .entryDate(EntryDates.parse(pub.getDate(), "CiteULike pub '" + pub.getTitle() + "'"))
                    .build());
        }
        log.info("Read " + publications.size() + " publications from CiteULike library " + path);
        return publications;
    }

    /**
     * One article of the export. Authors are "First M. Last", published is [year, month, day].
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CiteULikePub {
        private String title;
        private String doi;
        private String href;
        private List<String> authors;
        private String journal;
        private List<String> published;
        private List<String> tags;
        /** When the article was added, "2017-01-29 18:23:07". */
        private String date;
    }
}
