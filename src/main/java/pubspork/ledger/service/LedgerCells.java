package pubspork.ledger.service;

/**
 * <p> Cell text of the ledger file. The file is read without quote processing, so a
 * title that starts with a quote is just a title. Tabs, line breaks and backslashes in a
 * value are written as {@code \t}, {@code \n}, {@code \r} and {@code \\}. A cell that a
 * spreadsheet wrapped in quotes, with inner quotes doubled, is unwrapped on read. <p>
 */
final class LedgerCells {

    private static final char QUOTE = '"';
    private static final String DOUBLED_QUOTE = "\"\"";
    private static final char ESCAPE = '\\';

    private LedgerCells() {
    }

    static String toFileCell(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
            case ESCAPE:
                escaped.append("\\\\");
                break;
            case '\t':
                escaped.append("\\t");
                break;
            case '\n':
                escaped.append("\\n");
                break;
            case '\r':
                escaped.append("\\r");
                break;
            default:
                escaped.append(c);
            }
        }
        String cell = escaped.toString();
        if (isWrapped(cell)) {
            // would be unwrapped on read
            return QUOTE + cell.replace("\"", DOUBLED_QUOTE) + QUOTE;
        }
        return cell;
    }

    static String fromFileCell(String cell) {
        if (cell == null) {
            return "";
        }
        String text = cell;
        if (isWrapped(text)) {
            String inner = text.substring(1, text.length() - 1);
            if (inner.replace(DOUBLED_QUOTE, "").indexOf(QUOTE) < 0) {
                text = inner.replace(DOUBLED_QUOTE, "\"");
            }
        }
        if (text.indexOf(ESCAPE) < 0) {
            return text;
        }
        StringBuilder value = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == ESCAPE || next == 't' || next == 'n' || next == 'r') {
                    value.append(next == 't' ? '\t' : next == 'n' ? '\n' : next == 'r' ? '\r' : ESCAPE);
                    i++;
                    continue;
                }
            }
            value.append(c);
        }
        return value.toString();
    }

    private static boolean isWrapped(String cell) {
        return cell.length() >= 2 && cell.charAt(0) == QUOTE && cell.charAt(cell.length() - 1) == QUOTE;
    }
}
