package pubspork.curation;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.base.Splitter;

import org.apache.commons.lang.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import pubspork.beans.PublicationBean;

/**
 * <p><b><i>Builds the links that go with each publication on the curation page.<p><b><i>
 *
 * A proxy such as {@code .proxy1.library.jhu.edu} is appended to the host of the pub link.
 * Some proxies also want the dots in the original host replaced with dashes, which is what
 * separator {@code dash} does.
 */
@Component
public class CurationLinkBuilder {

    public static final String GOOGLE_SEARCH_URL = "https://www.google.com/search?q=";
    public static final String GOOGLE_SCHOLAR_SEARCH_URL = "https://scholar.google.com/scholar?q=";
    public static final String PUBMED_SEARCH_URL = "https://www.ncbi.nlm.nih.gov/pubmed/?term=";

    private static final String DOT_SEPARATOR = "dot";
    private static final String DASH_SEPARATOR = "dash";
    private static final Splitter URL_PARTS = Splitter.on('/').limit(4);

    private final String proxy;
    private final String proxySeparator;
    private final String customSearchUrl;

    @Autowired
    public CurationLinkBuilder(@Value("${pubspork.curation.proxy:}") String proxy,
            @Value("${pubspork.curation.proxy-separator:dot}") String proxySeparator,
            @Value("${pubspork.curation.custom-search-url:}") String customSearchUrl) {
        this.proxy = StringUtils.trimToNull(proxy);
        if (DOT_SEPARATOR.equals(proxySeparator)) {
            this.proxySeparator = ".";
        } else if (DASH_SEPARATOR.equals(proxySeparator)) {
            this.proxySeparator = "-";
        } else {
            throw new IllegalArgumentException("Proxy separator must be '" + DOT_SEPARATOR + "' or '"
                    + DASH_SEPARATOR + "', not '" + proxySeparator + "'");
        }
        this.customSearchUrl = StringUtils.trimToNull(customSearchUrl);
    }

    public CurationLinks build(PublicationBean publication) {
        String title = searchTitle(publication);
        return CurationLinks.builder()
                .pubUrl(publication.getSourceUrl())
                .proxyUrl(toProxyUrl(publication.getSourceUrl()))
                .librarySearchUrl(this.customSearchUrl == null ? null : this.customSearchUrl + "q=" + encode(title))
                .googleSearchUrl(GOOGLE_SEARCH_URL + encode(title))
                .googleScholarSearchUrl(GOOGLE_SCHOLAR_SEARCH_URL + encode(title))
                .pubmedSearchUrl(PUBMED_SEARCH_URL + encode(title))
                .build();
    }

    /**
     * @return {@code scheme://host<proxy>/path}, or null without a proxy or a usable URL
     */
    public String toProxyUrl(String pubUrl) {
        if (this.proxy == null || StringUtils.isBlank(pubUrl)) {
            return null;
        }
        List<String> parts = URL_PARTS.splitToList(pubUrl.trim());
        if (parts.size() < 3 || !parts.get(0).endsWith(":") || !parts.get(1).isEmpty() || parts.get(2).isEmpty()) {
            return null;
        }
        String host = parts.get(2).replace(".", this.proxySeparator);
        String path = parts.size() > 3 ? parts.get(3) : "";
        return parts.get(0) + "//" + host + this.proxy + "/" + path;
    }

    private static String searchTitle(PublicationBean publication) {
        String title = StringUtils.removeEnd(publication.getRawTitle().trim(), "…").trim();
        if (title.isEmpty()) {
            return StringUtils.defaultString(publication.getDoi());
        }
        return title;
    }

    private static String encode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8);
    }
}
