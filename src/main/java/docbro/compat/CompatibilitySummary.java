package docbro.compat;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate over many compatibility reports.
 */
public final class CompatibilitySummary {

    private final int total;
    private final int compatible;
    private final int incompatible;
    private final int needsRecreation;
    private final int canMigrate;
    private final Map<Integer, Integer> versionDistribution;

    CompatibilitySummary(int total, int compatible, int incompatible, int needsRecreation, int canMigrate,
                         Map<Integer, Integer> versionDistribution) {
        this.total = total;
        this.compatible = compatible;
        this.incompatible = incompatible;
        this.needsRecreation = needsRecreation;
        this.canMigrate = canMigrate;
        this.versionDistribution = Collections.unmodifiableMap(new TreeMap<>(versionDistribution));
    }

    public int getTotal() { return total; }
    public int getCompatible() { return compatible; }
    public int getIncompatible() { return incompatible; }
    public int getNeedsRecreation() { return needsRecreation; }
    public int getCanMigrate() { return canMigrate; }

    /**
     * Project count per stamped schema version, ascending by version.
     */
    public Map<Integer, Integer> getVersionDistribution() { return versionDistribution; }

    /**
     * @return Compatible share in percent, 0 for an empty set
     */
    public double getCompatibilityRate() {
        return total == 0 ? 0.0 : compatible * 100.0 / total;
    }

    @Override
    public String toString() {
        return String.format("%d project(s): %d compatible, %d incompatible (%.1f%%), %d need recreation",
                total, compatible, incompatible, getCompatibilityRate(), needsRecreation);
    }
}
