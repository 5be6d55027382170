package pubspork.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LedgerCellsTest {

    @Test
    void toFileCell_escapesTabsLineBreaksAndBackslashes() {
        assertThat(LedgerCells.toFileCell("a\tb\nc\\d")).isEqualTo("a\\tb\\nc\\\\d");
    }

    @Test
    void fromFileCell_unescapes() {
        assertThat(LedgerCells.fromFileCell("a\\tb\\nc\\\\d")).isEqualTo("a\tb\nc\\d");
    }

    @Test
    void fromFileCell_leavesUnknownEscapesAndStrayQuotesAlone() {
        assertThat(LedgerCells.fromFileCell("C:\\data")).isEqualTo("C:\\data");
        assertThat(LedgerCells.fromFileCell("\"Omics\" approaches")).isEqualTo("\"Omics\" approaches");
        assertThat(LedgerCells.fromFileCell("\"a\" and \"b\"")).isEqualTo("\"a\" and \"b\"");
    }

    @Test
    void fromFileCell_unwrapsSpreadsheetQuoting() {
        assertThat(LedgerCells.fromFileCell("\"says \"\"hi\"\"\"")).isEqualTo("says \"hi\"");
    }

    @Test
    void valueThatLooksWrapped_survivesWriteAndRead() {
        String value = "\"Quoted title\"";

        assertThat(LedgerCells.fromFileCell(LedgerCells.toFileCell(value))).isEqualTo(value);
    }
}
