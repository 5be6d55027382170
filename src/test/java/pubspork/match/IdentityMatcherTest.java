package pubspork.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import pubspork.beans.PublicationBean;
import pubspork.beans.RawPublicationBean;
import pubspork.normalize.PublicationNormalizer;

class IdentityMatcherTest {

    private final PublicationNormalizer normalizer = new PublicationNormalizer();
    private final IdentityMatcher matcher = new IdentityMatcher(0.90, 40);

    private PublicationBean pub(String title, String doi, String year) {
        return normalizer.normalize(RawPublicationBean.builder().title(title).doi(doi).year(year).build());
    }

    @Test
    void compare_isReflexive() {
        PublicationBean a = pub("Deep learning for X", null, "2020");
        PublicationBean b = pub("Deep learning for X", "10.1/abc", "2020");

        assertThat(matcher.compare(a, a)).contains(MatchTier.HIGH);
        assertThat(matcher.compare(b, b)).contains(MatchTier.CERTAIN);
    }

    @Test
    void match_equalDoiWinsRegardlessOfTitleAndYear() {
        PublicationBean a = pub("Completely different", "10.1/abc", "2001");
        PublicationBean b = pub("Deep learning for X", "10.1/ABC", "2020");

        assertThat(matcher.compare(a, b)).contains(MatchTier.CERTAIN);
    }

    @Test
    void match_equalTitlesWithinOneYear_isHigh() {
        assertThat(matcher.compare(pub("Deep Learning for X", null, "2020"), pub("Deep learning for X.", null, "2021")))
                .contains(MatchTier.HIGH);
        assertThat(matcher.compare(pub("Deep Learning for X", null, "2020"), pub("Deep learning for X.", null, "2022")))
                .isEmpty();
    }

    @Test
    void match_missingYearDoesNotBlockTitleMatch() {
        assertThat(matcher.compare(pub("Deep Learning for X", null, null), pub("Deep learning for X", null, "2022")))
                .contains(MatchTier.HIGH);
    }

    @Test
    void match_nearIdenticalTitles_isProbable() {
        Optional<MatchResult> result = matcher.match(
                pub("A benchmark of genome assemblers for long reads", null, "2019"),
                Collections.singletonList(pub("A benchmark of genome assemblers for long-reads", null, "2019")));

        assertThat(result).isPresent();
        assertThat(result.get().getTier()).isEqualTo(MatchTier.PROBABLE);
        assertThat(result.get().getScore()).isGreaterThanOrEqualTo(0.90).isLessThan(1.0);
    }

    @Test
    void match_probableRequiresEqualYears() {
        assertThat(matcher.compare(pub("A benchmark of genome assemblers for long reads", null, "2019"),
                pub("A benchmark of genome assemblers for long-reads", null, "2020"))).isEmpty();
    }

    @Test
    void match_differentTitles_noMatch() {
        assertThat(matcher.compare(pub("Deep learning for X", null, "2020"), pub("Shallow learning for Y", null, "2020")))
                .isEmpty();
    }

    @Test
    void match_truncatedTitlePrefix_isProbableWithFullScore() {
        PublicationBean truncated = pub("Galaxy: a web-based platform for accessible, reproducible and …", null, "2010");
        PublicationBean full = pub("Galaxy: a web-based platform for accessible, reproducible and transparent "
                + "computational research", null, "2010");

        Optional<MatchResult> result = matcher.match(truncated, Collections.singletonList(full));

        assertThat(result).isPresent();
        assertThat(result.get().getTier()).isEqualTo(MatchTier.PROBABLE);
        assertThat(result.get().getScore()).isEqualTo(1.0);
        assertThat(matcher.compare(full, truncated)).contains(MatchTier.PROBABLE);
    }

    @Test
    void match_shortTruncatedTitle_isNotAPrefixMatch() {
        assertThat(matcher.compare(pub("Galaxy: a web …", null, "2010"),
                pub("Galaxy: a web-based platform for accessible research", null, "2010"))).isEmpty();
    }

    @Test
    void match_strongerTierWinsOverEarlierWeakerMember() {
        PublicationBean candidate = pub("A benchmark of genome assemblers for long reads", "10.5/x", "2019");
        PublicationBean fuzzy = pub("A benchmark of genome assemblers for long-reads", null, "2019");
        PublicationBean exactTitle = pub("A benchmark of genome assemblers for long reads", null, "2019");
        PublicationBean sameDoi = pub("Something else", "10.5/x", "2019");

        assertThat(matcher.match(candidate, Arrays.asList(fuzzy, exactTitle, sameDoi)).get().getIndex()).isEqualTo(2);
        assertThat(matcher.match(candidate, Arrays.asList(fuzzy, exactTitle)).get().getIndex()).isEqualTo(1);
    }

    @Test
    void match_tiesGoToEarliestMember() {
        PublicationBean candidate = pub("A benchmark of genome assemblers for long reads", null, "2019");
        PublicationBean first = pub("A benchmark of genome assemblers for long-reads", null, "2019");
        PublicationBean second = pub("A benchmark of genome assemblers for long_reads", null, "2019");

        assertThat(matcher.match(candidate, Arrays.asList(first, second)).get().getIndex()).isEqualTo(0);
    }

    @Test
    void identityKey_dependsOnlyOnRecord() {
        assertThat(IdentityMatcher.identityKey(pub("Deep learning for X", "10.1/ABC", "2020")))
                .isEqualTo("doi:10.1/abc");
        assertThat(IdentityMatcher.identityKey(pub("Deep Learning for X.", null, "2020")))
                .isEqualTo("title:deep learning for x|2020");
        assertThat(IdentityMatcher.identityKey(pub("Deep Learning for X.", null, null)))
                .isEqualTo("title:deep learning for x|");
    }

    @Test
    void constructor_rejectsThresholdOutOfRange() {
        assertThatThrownBy(() -> new IdentityMatcher(0.0, 40)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IdentityMatcher(1.5, 40)).isInstanceOf(IllegalArgumentException.class);
    }
}
