package pubspork.library;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import org.apache.commons.lang.StringUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Date a publication was added to a library. Both exports write a timestamp that starts
 * with the ISO date.
 */
@Slf4j
final class EntryDates {

    private static final int ISO_DATE_LENGTH = 10;

    private EntryDates() {
    }

    static LocalDate parse(String value, String publication) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return LocalDate.parse(StringUtils.left(trimmed, ISO_DATE_LENGTH));
        } catch (DateTimeParseException e) {
            log.warn(publication + " has an unreadable date added '" + value + "'");
            return null;
        }
    }
}
