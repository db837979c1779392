package docbro.audit;

import java.util.Objects;

/**
 * How often projects moved from one schema version to another, and how long
 * it took on average.
 */
public final class VersionTransition {

    private final int fromVersion;
    private final int toVersion;
    private final int count;
    private final long averageDurationMillis;

    VersionTransition(int fromVersion, int toVersion, int count, long averageDurationMillis) {
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.count = count;
        this.averageDurationMillis = averageDurationMillis;
    }

    public int getFromVersion() { return fromVersion; }
    public int getToVersion() { return toVersion; }
    public int getCount() { return count; }

    /**
     * @return Mean duration of the sealed attempts, 0 when none was sealed
     */
    public long getAverageDurationMillis() { return averageDurationMillis; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionTransition that = (VersionTransition) o;
        return fromVersion == that.fromVersion && toVersion == that.toVersion
                && count == that.count && averageDurationMillis == that.averageDurationMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromVersion, toVersion, count, averageDurationMillis);
    }

    @Override
    public String toString() {
        return "v" + fromVersion + " -> v" + toVersion + " x" + count;
    }
}
