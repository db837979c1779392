package docbro.export;

import docbro.project.ProjectType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a project rebuilt from an export would look like, computed without
 * touching the registry.
 */
public final class RecreationPreview {

    private final String projectName;
    private final ProjectType projectType;
    private final int fromSchemaVersion;
    private final int toSchemaVersion;
    private final Map<String, Object> settings;
    private final Map<String, Object> metadata;
    private final String sourceUrl;
    private final List<String> addedDefaults;
    private final ExportValidation validation;

    RecreationPreview(ProjectExport export, int toSchemaVersion, Map<String, Object> settings,
                      List<String> addedDefaults, ExportValidation validation) {
        this.projectName = export.getProjectName();
        this.projectType = export.getProjectType();
        this.fromSchemaVersion = export.getSchemaVersion();
        this.toSchemaVersion = toSchemaVersion;
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        this.metadata = export.getMetadata();
        this.sourceUrl = export.getSourceUrl();
        this.addedDefaults = List.copyOf(addedDefaults);
        this.validation = validation;
    }

    public String getProjectName() { return projectName; }
    public ProjectType getProjectType() { return projectType; }
    public int getFromSchemaVersion() { return fromSchemaVersion; }
    public int getToSchemaVersion() { return toSchemaVersion; }

    /**
     * @return Exported settings with the type's defaults filled in for absent keys
     */
    public Map<String, Object> getSettings() { return settings; }

    public Map<String, Object> getMetadata() { return metadata; }
    public String getSourceUrl() { return sourceUrl; }

    /**
     * @return Keys taken from the type's defaults, sorted
     */
    public List<String> getAddedDefaults() { return addedDefaults; }

    public ExportValidation getValidation() { return validation; }

    public boolean isSettingsUpdated() {
        return !addedDefaults.isEmpty();
    }

    public boolean isSchemaVersionChange() {
        return fromSchemaVersion != toSchemaVersion;
    }

    @Override
    public String toString() {
        return "RecreationPreview{project=" + projectName + ", v" + fromSchemaVersion + " -> v" + toSchemaVersion
                + ", addedDefaults=" + addedDefaults + ", valid=" + validation.isValid() + '}';
    }
}
