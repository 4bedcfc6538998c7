package com.registry.reconciliation.api;

import com.registry.reconciliation.core.model.CanonicalField;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Options for snapshot building.
 * Configures source precedence, conflict handling and build parallelism.
 */
public class ReconciliationOptions {

    private static final int DEFAULT_PARALLELISM = 1;
    private static final int DEFAULT_DATE_TOLERANCE_DAYS = 0;
    private static final int DEFAULT_PROGRESS_INTERVAL = 100_000;

    private final List<String> sourcePriority;
    private final boolean strictMode;
    private final Set<CanonicalField> identityFields;
    private final int dateToleranceDays;
    private final int parallelism;
    private final int progressInterval;

    private ReconciliationOptions(Builder builder) {
        this.sourcePriority = List.copyOf(builder.sourcePriority);
        this.strictMode = builder.strictMode;
        this.identityFields = Set.copyOf(builder.identityFields);
        this.dateToleranceDays = builder.dateToleranceDays;
        this.parallelism = builder.parallelism;
        this.progressInterval = builder.progressInterval;
    }

    /**
     * Source tags in ascending precedence: the last listed source wins a duplicate.
     * Empty means the order of the batches handed to the builder.
     */
    public List<String> getSourcePriority() {
        return sourcePriority;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    /**
     * Fields on which duplicates of one identifier must agree.
     */
    public Set<CanonicalField> getIdentityFields() {
        return identityFields;
    }

    /**
     * Maximum distance in days between two dates still considered the same identity value.
     */
    public int getDateToleranceDays() {
        return dateToleranceDays;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Options that fail the build on conflicting duplicates.
     */
    public static ReconciliationOptions strict() {
        return builder().strictMode(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> sourcePriority = new ArrayList<>();
        private boolean strictMode = false;
        private Set<CanonicalField> identityFields = EnumSet.of(CanonicalField.REGISTRATION_DATE);
        private int dateToleranceDays = DEFAULT_DATE_TOLERANCE_DAYS;
        private int parallelism = DEFAULT_PARALLELISM;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder sourcePriority(List<String> sourcePriority) {
            if (sourcePriority == null) {
                throw new IllegalArgumentException("sourcePriority must not be null");
            }
            if (sourcePriority.stream().distinct().count() != sourcePriority.size()) {
                throw new IllegalArgumentException("sourcePriority must not contain duplicates");
            }
            this.sourcePriority = new ArrayList<>(sourcePriority);
            return this;
        }

        public Builder sourcePriority(String... sourceTags) {
            return sourcePriority(Arrays.asList(sourceTags));
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder identityFields(Set<CanonicalField> identityFields) {
            if (identityFields == null) {
                throw new IllegalArgumentException("identityFields must not be null");
            }
            this.identityFields = identityFields.isEmpty()
                    ? EnumSet.noneOf(CanonicalField.class) : EnumSet.copyOf(identityFields);
            return this;
        }

        public Builder dateToleranceDays(int dateToleranceDays) {
            if (dateToleranceDays < 0) {
                throw new IllegalArgumentException("dateToleranceDays must be >= 0");
            }
            this.dateToleranceDays = dateToleranceDays;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be positive");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "sourcePriority=" + sourcePriority +
                ", strictMode=" + strictMode +
                ", identityFields=" + identityFields +
                ", dateToleranceDays=" + dateToleranceDays +
                ", parallelism=" + parallelism +
                '}';
    }
}
