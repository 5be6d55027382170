package pubspork.main;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Paths;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import pubspork.library.LibraryType;

class ReportCommandOptionsTest {

    @Test
    void from_parsesFullCommandLine() {
        ReportCommandOptions options = ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib.csv", "--year", "--journal", "--tagyear",
                "--tagcountdaterange", "--entrystartdate=2024-01-01", "--entryenddate=2024-03-31",
                "--onlythesetags=tags.txt", "--reportout=library.json"));

        assertThat(options.getLibraryType()).isEqualTo(LibraryType.ZOTERO_CSV);
        assertThat(options.getInputLibPath()).isEqualTo(Paths.get("lib.csv"));
        assertThat(options.isYear()).isTrue();
        assertThat(options.isJournal()).isTrue();
        assertThat(options.isTagYear()).isTrue();
        assertThat(options.isTagCountDateRange()).isTrue();
        assertThat(options.getEntryStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(options.getEntryEndDate()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(options.getOnlyTheseTags()).isEqualTo(Paths.get("tags.txt"));
        assertThat(options.getReportOut()).isEqualTo(Paths.get("library.json"));
    }

    @Test
    void from_singleReport() {
        ReportCommandOptions options = ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=citeulike-json", "--inputlibpath=lib.json", "--journal",
                "--reportout=library.json"));

        assertThat(options.isJournal()).isTrue();
        assertThat(options.isYear()).isFalse();
        assertThat(options.getOnlyTheseTags()).isNull();
    }

    @Test
    void from_nothingToReport_fails() {
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib.csv", "--reportout=library.json")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Nothing to report");
    }

    @Test
    void from_dateRangeReportNeedsBothDates() {
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib.csv", "--tagcountdaterange",
                "--entrystartdate=2024-01-01", "--reportout=library.json")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--entryenddate");
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib.csv", "--tagcountdaterange",
                "--entrystartdate=2024-03-01", "--entryenddate=2024-01-01", "--reportout=library.json")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("is before");
    }

    @Test
    void from_failsFastOnBadValues() {
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=endnote", "--inputlibpath=lib", "--year", "--reportout=r")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("endnote");
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib", "--tagcountdaterange",
                "--entrystartdate=Jan 2024", "--entryenddate=2024-03-31", "--reportout=r")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("yyyy-MM-dd");
        assertThatThrownBy(() -> ReportCommandOptions.from(new DefaultApplicationArguments(
                "--report", "--libtype=zotero-csv", "--inputlibpath=lib", "--year")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--reportout");
    }
}
