package pubspork.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pubspork.beans.RawPublicationBean;
import pubspork.main.Application;
import pubspork.model.exception.LibraryReadException;

class CiteULikeJsonLibraryReaderTest {

    private final CiteULikeJsonLibraryReader reader = new CiteULikeJsonLibraryReader(Application.getObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void read_mapsArticleFields() throws IOException {
        Path export = tempDir.resolve("cul.json");
        Files.write(export, Collections.singletonList("[{\"article_id\": \"13920853\", \"title\": \"Deep learning for X\","
                + " \"doi\": \"10.1/abc\", \"href\": \"http://www.citeulike.org/article/13920853\","
                + " \"authors\": [\"Ann Smith\", \"Bob Jones\"], \"journal\": \"J X\", \"published\": [\"2020\", \"05\"],"
                + " \"tags\": [\"methods\"], \"date\": \"2016-12-22 00:18:58\"},"
                + " {\"title\": \"No authors here\"}]"), StandardCharsets.UTF_8);

        List<RawPublicationBean> pubs = reader.read(export);

        assertThat(pubs).hasSize(2);
        RawPublicationBean pub = pubs.get(0);
        assertThat(pub.getOrigin()).isEqualTo("citeulike-json");
        assertThat(pub.getAuthors()).isEqualTo("Ann Smith; Bob Jones");
        assertThat(pub.getYear()).isEqualTo("2020");
        assertThat(pub.getUrl()).isEqualTo("http://www.citeulike.org/article/13920853");
        assertThat(pub.getJournal()).isEqualTo("J X");
        assertThat(pub.getTags()).containsExactly("methods");
        assertThat(pub.getEntryDate()).isEqualTo(LocalDate.of(2016, 12, 22));
        assertThat(pubs.get(1).getTags()).isEmpty();
        assertThat(pubs.get(1).getAuthors()).isNull();
        assertThat(pubs.get(1).getYear()).isNull();
    }

    @Test
    void read_malformedJson_throws() throws IOException {
        Path export = tempDir.resolve("cul.json");
        Files.write(export, Collections.singletonList("[{\"title\": "), StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(export)).isInstanceOf(LibraryReadException.class);
    }

    @Test
    void libraryReaders_selectByType() {
        LibraryReaders readers = new LibraryReaders(Arrays.<LibraryReader>asList(reader,
                new ZoteroCsvLibraryReader()));

        assertThat(readers.forType(LibraryType.CITEULIKE_JSON)).isSameAs(reader);
        assertThat(readers.forType(LibraryType.ZOTERO_CSV)).isInstanceOf(ZoteroCsvLibraryReader.class);
        assertThatThrownBy(() -> LibraryType.fromValue("mendeley")).isInstanceOf(IllegalArgumentException.class);
    }
}
