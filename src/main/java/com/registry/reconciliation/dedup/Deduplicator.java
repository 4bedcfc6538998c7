package com.registry.reconciliation.dedup;

import com.registry.reconciliation.api.ReconciliationOptions;
import com.registry.reconciliation.core.AttributeValues;
import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.normalize.NormalizedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses all normalized rows sharing one identifier into a single canonical record.
 *
 * <p>Precedence, applied in order:</p>
 * <ol>
 *   <li>the row from the source with the highest {@link SourceRanking rank};</li>
 *   <li>on a tie, the row with fewer absent canonical fields;</li>
 *   <li>on a further tie, the row encountered last in input order.</li>
 * </ol>
 *
 * <p>The winner's attributes are taken wholesale. Absent fields are not filled from losing
 * rows, so conflicting sources are never blended into one record.</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final ReconciliationOptions options;

    public Deduplicator(ReconciliationOptions options) {
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Picks the authoritative record for one identifier, ranking sources by the configured
     * priority and then by the order in which they first occur among the rows.
     */
    public DeduplicationResult deduplicate(String identifier, List<NormalizedRecord> rows) {
        List<String> appearance = rows == null ? List.of() : rows.stream()
                .map(NormalizedRecord::sourceTag)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        return deduplicate(identifier, rows, SourceRanking.of(options.getSourcePriority(), appearance));
    }

    /**
     * Picks the authoritative record for one identifier.
     *
     * @param identifier the shared identifier
     * @param rows       all normalized rows carrying it, in input order
     * @param ranking    source precedence
     * @throws DuplicateIdentifierConflictException in strict mode, when two rows disagree on an identity field
     */
    public DeduplicationResult deduplicate(String identifier, List<NormalizedRecord> rows, SourceRanking ranking) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("no rows for identifier " + identifier);
        }
        for (NormalizedRecord row : rows) {
            if (!identifier.equals(row.identifier())) {
                throw new IllegalArgumentException("row of " + row.identifier()
                        + " passed for identifier " + identifier);
            }
        }

        NormalizedRecord winner = rows.get(0);
        for (int i = 1; i < rows.size(); i++) {
            NormalizedRecord candidate = rows.get(i);
            if (beats(candidate, winner, ranking)) {
                winner = candidate;
            }
        }

        List<IdentityConflict> conflicts = rows.size() > 1 ? findConflicts(identifier, rows) : List.of();
        for (IdentityConflict conflict : conflicts) {
            if (options.isStrictMode()) {
                throw new DuplicateIdentifierConflictException(conflict);
            }
            log.warn("dedup.conflict {} winner={}", conflict.describe(), winner.sourceTag());
        }

        if (rows.size() > 1) {
            log.debug("dedup.collapsed identifier={} rows={} winner={} line={}",
                    identifier, rows.size(), winner.sourceTag(), winner.lineNumber());
        }
        return new DeduplicationResult(winner.toCanonical(), rows.size() - 1, conflicts);
    }

    private static boolean beats(NormalizedRecord candidate, NormalizedRecord current, SourceRanking ranking) {
        int candidateRank = ranking.rankOf(candidate.sourceTag());
        int currentRank = ranking.rankOf(current.sourceTag());
        if (candidateRank != currentRank) {
            return candidateRank > currentRank;
        }
        // Later rows win remaining ties
        return candidate.absentFieldCount() <= current.absentFieldCount();
    }

    private List<IdentityConflict> findConflicts(String identifier, List<NormalizedRecord> rows) {
        List<IdentityConflict> conflicts = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            if (!options.getIdentityFields().contains(field)) {
                continue;
            }
            for (int i = 0; i < rows.size(); i++) {
                Object first = rows.get(i).attributes().get(field);
                if (first == null) {
                    continue;
                }
                for (int j = i + 1; j < rows.size(); j++) {
                    Object second = rows.get(j).attributes().get(field);
                    if (second != null && disagree(first, second)) {
                        conflicts.add(new IdentityConflict(identifier, field,
                                first, rows.get(i).sourceTag(), second, rows.get(j).sourceTag()));
                    }
                }
            }
        }
        return conflicts;
    }

    private boolean disagree(Object first, Object second) {
        if (first instanceof LocalDate a && second instanceof LocalDate b) {
            return Math.abs(ChronoUnit.DAYS.between(a, b)) > options.getDateToleranceDays();
        }
        return !AttributeValues.equal(first, second);
    }
}
