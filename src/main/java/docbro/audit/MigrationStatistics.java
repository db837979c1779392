package docbro.audit;

/**
 * Aggregate of the audit trail over a look-back window.
 */
public final class MigrationStatistics {

    private final int periodDays;
    private final int total;
    private final int successful;
    private final int failed;
    private final int inProgress;
    private final int recreations;
    private final int upgrades;
    private final int validations;
    private final long averageDurationMillis;
    private final int uniqueProjects;

    MigrationStatistics(int periodDays, int total, int successful, int failed, int inProgress,
                        int recreations, int upgrades, int validations,
                        long averageDurationMillis, int uniqueProjects) {
        this.periodDays = periodDays;
        this.total = total;
        this.successful = successful;
        this.failed = failed;
        this.inProgress = inProgress;
        this.recreations = recreations;
        this.upgrades = upgrades;
        this.validations = validations;
        this.averageDurationMillis = averageDurationMillis;
        this.uniqueProjects = uniqueProjects;
    }

    public int getPeriodDays() { return periodDays; }
    public int getTotal() { return total; }
    public int getSuccessful() { return successful; }
    public int getFailed() { return failed; }
    public int getInProgress() { return inProgress; }
    public int getRecreations() { return recreations; }
    public int getUpgrades() { return upgrades; }
    public int getValidations() { return validations; }
    public long getAverageDurationMillis() { return averageDurationMillis; }
    public int getUniqueProjects() { return uniqueProjects; }

    /**
     * @return Successful share of all attempts in percent, rounded to one decimal
     */
    public double getSuccessRate() {
        return total == 0 ? 0.0 : Math.round(successful * 1000.0 / total) / 10.0;
    }

    @Override
    public String toString() {
        return "MigrationStatistics{days=" + periodDays + ", total=" + total + ", successful=" + successful
                + ", failed=" + failed + ", inProgress=" + inProgress + '}';
    }
}
