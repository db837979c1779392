package docbro.project.settings;

import docbro.project.ProjectType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of file storage projects.
 */
public final class StorageSettings extends AbstractProjectSettings {

    public static final String ENABLE_COMPRESSION = "enable_compression";

    private static final Map<String, Object> DEFAULTS;

    static {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(ENABLE_COMPRESSION, true);
        defaults.put("auto_tagging", true);
        defaults.put("full_text_indexing", true);
        defaults.put("max_file_size", 104857600L);
        defaults.put("allowed_formats", List.of("*"));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    StorageSettings(Map<String, ?> values) {
        super(values);
    }

    @Override
    public ProjectType type() {
        return ProjectType.STORAGE;
    }

    @Override
    public Set<String> requiredKeys() {
        return Set.of(ENABLE_COMPRESSION);
    }

    @Override
    public Map<String, Object> defaults() {
        return DEFAULTS;
    }

    @Override
    protected void validateRanges(List<String> problems) {
        checkBoolean(problems, ENABLE_COMPRESSION);
    }

    @Override
    protected ProjectSettings create(Map<String, ?> values) {
        return new StorageSettings(values);
    }

    public Boolean isCompressionEnabled() {
        return booleanValue(ENABLE_COMPRESSION);
    }
}
