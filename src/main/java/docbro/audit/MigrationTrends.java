package docbro.audit;

import java.time.LocalDate;
import java.util.List;

/**
 * Day-by-day activity of the audit trail over a look-back window.
 */
public final class MigrationTrends {

    private final int periodDays;
    private final List<DailyCount> daily;
    private final List<VersionTransition> recreationTransitions;

    MigrationTrends(int periodDays, List<DailyCount> daily, List<VersionTransition> recreationTransitions) {
        this.periodDays = periodDays;
        this.daily = List.copyOf(daily);
        this.recreationTransitions = List.copyOf(recreationTransitions);
    }

    public int getPeriodDays() { return periodDays; }

    /**
     * @return One entry per UTC day with activity, oldest first
     */
    public List<DailyCount> getDaily() { return daily; }

    /**
     * @return Recreations grouped by source and target version, most frequent first
     */
    public List<VersionTransition> getRecreationTransitions() { return recreationTransitions; }

    @Override
    public String toString() {
        return "MigrationTrends{days=" + periodDays + ", daily=" + daily + ", transitions=" + recreationTransitions + '}';
    }

    public static final class DailyCount {
        private final LocalDate date;
        private final int total;
        private final int successful;
        private final int recreations;

        DailyCount(LocalDate date, int total, int successful, int recreations) {
            this.date = date;
            this.total = total;
            this.successful = successful;
            this.recreations = recreations;
        }

        public LocalDate getDate() { return date; }
        public int getTotal() { return total; }
        public int getSuccessful() { return successful; }
        public int getRecreations() { return recreations; }

        @Override
        public String toString() {
            return date + ": " + total + " (" + successful + " ok, " + recreations + " recreations)";
        }
    }
}
