package pubspork.ledger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang.StringUtils;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import pubspork.beans.PublicationBean;
import pubspork.match.IdentityMatcher;
import pubspork.match.MatchResult;
import pubspork.match.MatchTier;

/**
 * <p><b><i>Every publication ever processed, one entry per identity.<p><b><i>
 *
 * Entries are only ever added, never removed. Rows that could not be read as entries
 * are kept as they were and written back. The automated changes to an existing entry are
 * refreshing its entry date, promoting it from {@code new} to {@code in_library}, filling in a
 * missing DOI and replacing an empty, truncated or (for the library) outdated title. State
 * {@code ignore}, the annotation and any extra columns are left exactly as they were read.
 */
@Slf4j
public class KnownPubsLedger {

    private static final Comparator<LocalDate> DATES_NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private final IdentityMatcher identityMatcher;

    private final List<KnownPubBean> entries = new ArrayList<>();
    /** Parallel to entries. */
    private final List<String> keys = new ArrayList<>();
    /** Parallel to entries, what the identity matcher compares against. */
    private final List<PublicationBean> population = new ArrayList<>();
    private final Map<String, Integer> indexByKey = new HashMap<>();

    @Getter
    private final List<String> extraColumnNames;

    /** Rows that could not be read as entries, cells in save column order. */
    private final List<List<String>> unreadableRows = new ArrayList<>();

    public KnownPubsLedger(IdentityMatcher identityMatcher) {
        this(identityMatcher, Collections.<String>emptyList());
    }

    public KnownPubsLedger(IdentityMatcher identityMatcher, List<String> extraColumnNames) {
        this.identityMatcher = identityMatcher;
        this.extraColumnNames = new ArrayList<>(extraColumnNames);
    }

    /**
     * Adds an entry read from a ledger file. A second row with the same identity key is
     * folded into the first.
     *
     * @throws pubspork.model.exception.InvalidRecordException if the row has neither title nor DOI
     */
    public void addLoadedEntry(KnownPubBean entry) {
        PublicationBean publication = entry.toPublication();
        String key = IdentityMatcher.identityKey(publication);
        Integer existingIndex = this.indexByKey.get(key);
        if (existingIndex != null) {
            KnownPubBean existing = this.entries.get(existingIndex);
            log.warn("Ledger has more than one row for " + key + ", keeping the first: '" + existing.getTitle() + "'");
            if (StringUtils.isEmpty(existing.getAnnotation()) && StringUtils.isNotEmpty(entry.getAnnotation())) {
                existing.setAnnotation(entry.getAnnotation());
            }
            return;
        }
        append(entry, publication, key);
    }

    /**
     * Keeps a row that is not an entry, so saving writes it back untouched.
     *
     * @param cells the row in save column order
     */
    public void keepUnreadableRow(List<String> cells) {
        this.unreadableRows.add(new ArrayList<>(cells));
    }

    public List<List<String>> getUnreadableRows() {
        return Collections.unmodifiableList(this.unreadableRows);
    }

    public int getSkippedRows() {
        return this.unreadableRows.size();
    }

    /**
     * Identity lookup without changing anything.
     */
    public Optional<KnownPubMatch> find(PublicationBean publication) {
        return locate(publication)
                .map(located -> new KnownPubMatch(this.entries.get(located.index), located.tier));
    }

    /**
     * Records having seen a publication.
     *
     * @param publication what was seen
     * @param state state for a new entry; an existing {@code new} entry is promoted when this is {@code in_library}
     * @param today entry date to stamp
     * @return the created or updated entry
     */
    public KnownPubBean upsert(PublicationBean publication, KnownPubState state, LocalDate today) {
        Optional<Located> found = locate(publication);
        if (!found.isPresent()) {
            KnownPubBean entry = KnownPubBean.fromPublication(publication, state, today);
            append(entry, publication, IdentityMatcher.identityKey(publication));
            log.debug("Added " + state + " ledger entry: '" + publication.getRawTitle() + "'");
            return entry;
        }
        int index = found.get().index;
        KnownPubBean entry = this.entries.get(index);
        entry.setEntryDate(today);
        if (state == KnownPubState.IN_LIBRARY && entry.getState() == KnownPubState.NEW) {
            entry.setState(KnownPubState.IN_LIBRARY);
        }
        updateIdentity(index, publication, shouldRefreshTitle(index, publication, state, found.get().tier));
        return entry;
    }

    public void touch(KnownPubBean entry, LocalDate today) {
        entry.setEntryDate(today);
    }

    public int size() {
        return this.entries.size();
    }

    public List<KnownPubBean> getEntries() {
        return Collections.unmodifiableList(this.entries);
    }

    /**
     * Entries by entry date, oldest first and undated before dated, then by identity key.
     */
    public List<KnownPubBean> getEntriesInSaveOrder() {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < this.entries.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer, LocalDate>comparing(i -> this.entries.get(i).getEntryDate(), DATES_NULLS_FIRST)
                .thenComparing(i -> this.keys.get(i)));
        List<KnownPubBean> sorted = new ArrayList<>();
        for (Integer i : order) {
            sorted.add(this.entries.get(i));
        }
        return sorted;
    }

    private Optional<Located> locate(PublicationBean publication) {
        String key = IdentityMatcher.identityKey(publication);
        Integer index = this.indexByKey.get(key);
        if (index != null) {
            return Optional.of(new Located(index, IdentityMatcher.isDoiKey(key) ? MatchTier.CERTAIN : MatchTier.HIGH));
        }
        Optional<MatchResult> result = this.identityMatcher.match(publication, this.population);
        return result.map(match -> new Located(match.getIndex(), match.getTier()));
    }

    private boolean shouldRefreshTitle(int index, PublicationBean publication, KnownPubState state, MatchTier tier) {
        if (!publication.hasTitle()) {
            return false;
        }
        PublicationBean stored = this.population.get(index);
        if (!stored.hasTitle()) {
            return true;
        }
        if (state == KnownPubState.IN_LIBRARY && tier == MatchTier.CERTAIN
                && !stored.getRawTitle().equals(publication.getRawTitle())) {
            return true;
        }
        return stored.isTruncatedTitle() && !publication.isTruncatedTitle()
                && publication.getTitle().length() > stored.getTitle().length();
    }

    private void updateIdentity(int index, PublicationBean publication, boolean refreshTitle) {
        KnownPubBean entry = this.entries.get(index);
        boolean backfillDoi = entry.getDoi() == null && publication.hasDoi();
        if (!backfillDoi && !refreshTitle) {
            return;
        }
        String oldTitle = entry.getTitle();
        String oldDoi = entry.getDoi();
        if (backfillDoi) {
            entry.setDoi(publication.getDoi());
        }
        if (refreshTitle) {
            entry.setTitle(publication.getRawTitle());
        }
        PublicationBean updated = entry.toPublication();
        String oldKey = this.keys.get(index);
        String newKey = IdentityMatcher.identityKey(updated);
        if (!newKey.equals(oldKey)) {
            if (this.indexByKey.containsKey(newKey)) {
                log.warn("Not updating ledger entry '" + oldTitle + "' to " + newKey
                        + ", another entry already has that identity");
                entry.setTitle(oldTitle);
                entry.setDoi(oldDoi);
                return;
            }
            this.indexByKey.remove(oldKey);
            this.indexByKey.put(newKey, index);
            this.keys.set(index, newKey);
        }
        this.population.set(index, updated);
        if (backfillDoi) {
            log.info("Filled in DOI " + updated.getDoi() + " for '" + entry.getTitle() + "'");
        }
        if (refreshTitle) {
            log.info("Replaced title '" + oldTitle + "' with '" + entry.getTitle() + "'");
        }
    }

    private void append(KnownPubBean entry, PublicationBean publication, String key) {
        this.indexByKey.put(key, this.entries.size());
        this.entries.add(entry);
        this.keys.add(key);
        this.population.add(publication);
    }

    @AllArgsConstructor
    private static class Located {
        private final int index;
        private final MatchTier tier;
    }
}
