package docbro.audit;

import java.time.Instant;
import java.util.List;

/**
 * Recurring problems across the whole audit trail: the most frequent
 * failures, projects recreated more than once, and recreation durations
 * per version transition.
 */
public final class MigrationPatterns {

    private final List<ErrorPattern> commonErrors;
    private final List<FrequentRecreation> frequentRecreations;
    private final List<VersionTransition> durationByVersion;

    MigrationPatterns(List<ErrorPattern> commonErrors, List<FrequentRecreation> frequentRecreations,
                      List<VersionTransition> durationByVersion) {
        this.commonErrors = List.copyOf(commonErrors);
        this.frequentRecreations = List.copyOf(frequentRecreations);
        this.durationByVersion = List.copyOf(durationByVersion);
    }

    public List<ErrorPattern> getCommonErrors() { return commonErrors; }
    public List<FrequentRecreation> getFrequentRecreations() { return frequentRecreations; }

    /**
     * @return Successful recreations grouped by version transition
     */
    public List<VersionTransition> getDurationByVersion() { return durationByVersion; }

    public static final class ErrorPattern {
        private final String errorMessage;
        private final MigrationOperation operation;
        private final int frequency;

        ErrorPattern(String errorMessage, MigrationOperation operation, int frequency) {
            this.errorMessage = errorMessage;
            this.operation = operation;
            this.frequency = frequency;
        }

        public String getErrorMessage() { return errorMessage; }
        public MigrationOperation getOperation() { return operation; }
        public int getFrequency() { return frequency; }

        @Override
        public String toString() {
            return operation + ": " + errorMessage + " x" + frequency;
        }
    }

    public static final class FrequentRecreation {
        private final String projectName;
        private final int recreationCount;
        private final Instant lastRecreation;

        FrequentRecreation(String projectName, int recreationCount, Instant lastRecreation) {
            this.projectName = projectName;
            this.recreationCount = recreationCount;
            this.lastRecreation = lastRecreation;
        }

        public String getProjectName() { return projectName; }
        public int getRecreationCount() { return recreationCount; }
        public Instant getLastRecreation() { return lastRecreation; }

        @Override
        public String toString() {
            return projectName + " x" + recreationCount;
        }
    }
}
