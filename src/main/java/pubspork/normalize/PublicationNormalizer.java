package pubspork.normalize;

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;

import org.apache.commons.lang.StringUtils;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pubspork.beans.PublicationBean;
import pubspork.beans.RawPublicationBean;
import pubspork.library.LibraryType;
import pubspork.model.exception.InvalidRecordException;

/**
 * <p><b><i>Turns raw records from any alert or library adapter into {@link PublicationBean}s.
 * Titles are cleaned up for comparison, DOIs are pulled out of whatever form they were
 * given in, and years are taken from a year field or the front of a date.<p><b><i>
 */
@Slf4j
@Component
public class PublicationNormalizer {

    public static final String DOI_RESOLVER_URL = "https://doi.org/";

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern TRUNCATION_MARKER = Pattern.compile("[\\s\\u00A0]*…$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:]+$");
    private static final String QUOTES = "\"'“”‘’«»`";
    private static final Pattern DOI = Pattern.compile("\\b(10\\.\\d+(?:\\.\\d+)*/\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI_TRAILING_JUNK = Pattern.compile("[.,;)\\]>\"']+$");
    private static final Pattern LEADING_YEAR = Pattern.compile("^\\s*(\\d{4})(?!\\d)");

    private static final Splitter SEMICOLON = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter AND = Splitter.on(Pattern.compile("\\s+and\\s+")).trimResults().omitEmptyStrings();

    /**
     * @param raw record as handed over by an adapter
     * @return the canonical publication
     * @throws InvalidRecordException if the record has neither a title nor a DOI
     */
    public PublicationBean normalize(RawPublicationBean raw) {
        String rawTitle = StringUtils.trimToNull(raw.getTitle());
        String doi = toCanonicalDoi(raw.getDoi());
        if (doi == null) {
            doi = extractDoiFromUrl(raw.getUrl());
        }
        Integer year = extractYear(raw.getYear());
        if (year == null) {
            year = extractYear(raw.getDate());
        }
        String url = StringUtils.trimToNull(raw.getUrl());

        return PublicationBean.builder()
                .title(toComparisonTitle(rawTitle))
                .rawTitle(rawTitle)
                .authors(splitAuthors(raw.getAuthors(), LibraryType.isLibraryOrigin(raw.getOrigin())))
                .doi(doi)
                .year(year)
                .journal(collapseWhitespace(raw.getJournal()))
                .sourceUrl(doi != null ? DOI_RESOLVER_URL + doi : url)
                .origin(raw.getOrigin())
                .truncatedTitle(isTruncatedTitle(rawTitle))
                .build();
    }

    /**
     * Comparison form of a title: truncation marker removed, whitespace collapsed,
     * surrounding quotes and trailing punctuation stripped, lower case.
     * The comparison title of null is the empty string.
     */
    public static String toComparisonTitle(String title) {
        if (title == null) {
            return "";
        }
        String cleaned = TRUNCATION_MARKER.matcher(title.trim()).replaceFirst("");
        cleaned = collapseWhitespace(cleaned);
        if (cleaned == null) {
            return "";
        }
        String previous;
        do {
            previous = cleaned;
            cleaned = TRAILING_PUNCTUATION.matcher(cleaned).replaceFirst("");
            cleaned = StringUtils.strip(cleaned, QUOTES).trim();
        } while (!cleaned.equals(previous));
        return cleaned.toLowerCase(Locale.ROOT);
    }

    /**
     * Google Scholar shortens long titles and ends them with an ellipsis.
     */
    public static boolean isTruncatedTitle(String title) {
        return title != null && TRUNCATION_MARKER.matcher(title.trim()).find();
    }

    /**
     * Reduce any of
     * <ul>
     * <li>10.1016/j.iheduc.2008.03.001</li>
     * <li>doi:10.1016/J.IHEDUC.2008.03.001</li>
     * <li>http://dx.doi.org/10.1016/j.iheduc.2008.03.001</li>
     * <li>https://doi.org/10.1016/j.iheduc.2008.03.001</li>
     * </ul>
     * to {@code 10.1016/j.iheduc.2008.03.001}.
     *
     * @return the DOI, or null when the value is blank or holds no DOI
     */
    public static String toCanonicalDoi(String given) {
        if (StringUtils.isBlank(given)) {
            return null;
        }
        String doi = findDoi(given);
        if (doi == null) {
            log.warn("DOI value is not empty but holds no DOI, dropping it: '" + given + "'");
        }
        return doi;
    }

    /**
     * Publisher and resolver links often carry the DOI in their path, either after
     * {@code doi.org/} or after a {@code /doi/} segment.
     */
    public static String extractDoiFromUrl(String url) {
        if (StringUtils.isBlank(url)) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.contains("doi.org/") && !lower.contains("/doi/")) {
            return null;
        }
        return findDoi(StringUtils.substringBefore(StringUtils.substringBefore(url, "?"), "#"));
    }

    private static String findDoi(String text) {
        String decoded = text.trim();
        if (decoded.contains("%")) {
            try {
                decoded = URLDecoder.decode(decoded, "UTF-8");
            } catch (UnsupportedEncodingException | IllegalArgumentException e) {
                log.debug("Leaving DOI text undecoded: " + text, e);
            }
        }
        Matcher matcher = DOI.matcher(decoded);
        if (!matcher.find()) {
            return null;
        }
        String doi = DOI_TRAILING_JUNK.matcher(matcher.group(1)).replaceFirst("");
        return doi.toLowerCase(Locale.ROOT);
    }

    /**
     * @return the leading four digit year of a year field or date string, or null
     */
    public static Integer extractYear(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        Matcher matcher = LEADING_YEAR.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        return Integer.valueOf(matcher.group(1));
    }

    /**
     * Alerts separate authors with commas, or with semicolons when they have them.
     * Source order is kept since first author position matters.
     */
    public static List<String> splitAuthors(String authors) {
        return splitAuthors(authors, false);
    }

    /**
     * @param semicolonsOnly for library exports and the ledger, where a single author is
     *                       "Last, First" and authors are separated by semicolons
     */
    public static List<String> splitAuthors(String authors, boolean semicolonsOnly) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(authors)) {
            return result;
        }
        Splitter splitter = semicolonsOnly || authors.indexOf(';') >= 0 ? SEMICOLON : COMMA;
        for (String part : splitter.split(authors)) {
            for (String name : AND.split(part)) {
                String author = collapseWhitespace(name);
                if (author != null && !StringUtils.containsOnly(author, ".… ")) {
                    result.add(author);
                }
            }
        }
        return result;
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return null;
        }
        return StringUtils.trimToNull(WHITESPACE.matcher(text).replaceAll(" "));
    }
}
