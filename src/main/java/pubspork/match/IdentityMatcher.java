package pubspork.match;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import pubspork.beans.PublicationBean;

/**
 * <p><b><i>Decides whether two publications are the same one.<p><b><i>
 *
 * Comparison runs in tiers and the strongest tier that hits wins, even if a weaker tier
 * would also match a different member of the population:
 * <ol>
 * <li>{@link MatchTier#CERTAIN}: equal DOIs. Titles are not looked at.</li>
 * <li>{@link MatchTier#HIGH}: equal comparison titles, years no more than one apart when both are known.</li>
 * <li>{@link MatchTier#PROBABLE}: title similarity at or above the configured threshold, or a
 * truncated title that is a long enough prefix of the other, with equal years when both are known.</li>
 * </ol>
 * Within a tier the highest score wins and ties go to the earliest population member.
 */
@Component
public class IdentityMatcher {

    private static final String DOI_KEY_PREFIX = "doi:";
    private static final String TITLE_KEY_PREFIX = "title:";

    private final double fuzzyTitleThreshold;
    private final int minTruncatedTitleLength;

    @Autowired
    public IdentityMatcher(@Value("${pubspork.match.fuzzy-title-threshold:0.90}") double fuzzyTitleThreshold,
            @Value("${pubspork.match.min-truncated-title-length:40}") int minTruncatedTitleLength) {
        if (fuzzyTitleThreshold <= 0.0 || fuzzyTitleThreshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy title threshold must be in (0, 1]: " + fuzzyTitleThreshold);
        }
        this.fuzzyTitleThreshold = fuzzyTitleThreshold;
        this.minTruncatedTitleLength = minTruncatedTitleLength;
    }

    /**
     * @param candidate the publication to look for
     * @param population publications to look in, in a stable order
     * @return the best match, or empty when nothing matches
     */
    public Optional<MatchResult> match(PublicationBean candidate, List<PublicationBean> population) {
        MatchResult high = null;
        MatchResult probable = null;
        for (int i = 0; i < population.size(); i++) {
            PublicationBean other = population.get(i);
            if (candidate.hasDoi() && candidate.getDoi().equals(other.getDoi())) {
                return Optional.of(new MatchResult(other, i, MatchTier.CERTAIN, 1.0));
            }
            if (high != null || !candidate.hasTitle() || !other.hasTitle()) {
                continue;
            }
            if (candidate.getTitle().equals(other.getTitle())) {
                if (yearsWithin(candidate.getYear(), other.getYear(), 1)) {
                    high = new MatchResult(other, i, MatchTier.HIGH, 1.0);
                }
                continue;
            }
            if (!yearsWithin(candidate.getYear(), other.getYear(), 0)) {
                continue;
            }
            double score = probableScore(candidate, other);
            if (score >= this.fuzzyTitleThreshold && (probable == null || score > probable.getScore())) {
                probable = new MatchResult(other, i, MatchTier.PROBABLE, score);
            }
        }
        if (high != null) {
            return Optional.of(high);
        }
        return Optional.ofNullable(probable);
    }

    /**
     * Tier at which two single publications match, if any.
     */
    public Optional<MatchTier> compare(PublicationBean first, PublicationBean second) {
        return match(first, Collections.singletonList(second)).map(MatchResult::getTier);
    }

    private double probableScore(PublicationBean candidate, PublicationBean other) {
        if (isTruncatedPrefix(candidate, other) || isTruncatedPrefix(other, candidate)) {
            return 1.0;
        }
        String a = candidate.getTitle();
        String b = other.getTitle();
        int longest = Math.max(a.length(), b.length());
        // length difference alone caps the achievable similarity
        if (1.0 - (double) Math.abs(a.length() - b.length()) / longest < this.fuzzyTitleThreshold) {
            return 0.0;
        }
        return titleSimilarity(a, b);
    }

    private boolean isTruncatedPrefix(PublicationBean truncated, PublicationBean full) {
        return truncated.isTruncatedTitle()
                && truncated.getTitle().length() >= this.minTruncatedTitleLength
                && full.getTitle().length() > truncated.getTitle().length()
                && full.getTitle().startsWith(truncated.getTitle());
    }

    /**
     * Edit-distance ratio of two strings: 1 for identical, 0 for nothing in common.
     */
    public static double titleSimilarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) StringUtils.getLevenshteinDistance(a, b) / longest;
    }

    private static boolean yearsWithin(Integer first, Integer second, int tolerance) {
        if (first == null || second == null) {
            return true;
        }
        return Math.abs(first - second) <= tolerance;
    }

    /**
     * Key identifying a publication across runs: the DOI when there is one, otherwise
     * the comparison title and year. Depends on nothing but the record itself.
     */
    public static String identityKey(PublicationBean publication) {
        if (publication.hasDoi()) {
            return DOI_KEY_PREFIX + publication.getDoi();
        }
        return TITLE_KEY_PREFIX + publication.getTitle() + "|" + Objects.toString(publication.getYear(), "");
    }

    public static boolean isDoiKey(String identityKey) {
        return identityKey.startsWith(DOI_KEY_PREFIX);
    }
}
