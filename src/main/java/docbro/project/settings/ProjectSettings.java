package docbro.project.settings;

import docbro.project.ProjectType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Type-specific project configuration.
 * One variant per {@link ProjectType}; unknown keys are kept verbatim.
 */
public interface ProjectSettings {

    /**
     * @return The type this variant belongs to, or null for legacy untyped settings
     */
    ProjectType type();

    /**
     * @return Every setting, known and unknown, as an unmodifiable map
     */
    Map<String, Object> asMap();

    /**
     * @return Human-readable problems; empty when the settings are valid
     */
    List<String> validate();

    Set<String> requiredKeys();

    Map<String, Object> defaults();

    /**
     * @return A new variant of the same type with the given keys overriding these
     */
    ProjectSettings merge(Map<String, ?> overrides);

    default Object get(String key) {
        return asMap().get(key);
    }

    default boolean isEmpty() {
        return asMap().isEmpty();
    }

    /**
     * Decode a settings map into the variant selected by the type.
     *
     * @param type Project type, or null for legacy untyped rows
     * @param values Stored settings, may be null
     */
    static ProjectSettings of(ProjectType type, Map<String, ?> values) {
        if (type == null) {
            return new UntypedSettings(values);
        }
        switch (type) {
            case CRAWLING:
                return new CrawlingSettings(values);
            case DATA:
                return new DataSettings(values);
            case STORAGE:
                return new StorageSettings(values);
            default:
                throw new IllegalArgumentException("Unhandled project type " + type);
        }
    }

    /**
     * Settings holding only the type's defaults.
     */
    static ProjectSettings defaultsFor(ProjectType type) {
        ProjectSettings empty = of(type, Map.of());
        return empty.merge(empty.defaults());
    }

    /**
     * Defaults of the type overlaid with the given values.
     */
    static ProjectSettings withDefaults(ProjectType type, Map<String, ?> values) {
        return defaultsFor(type).merge(values == null ? Map.of() : values);
    }
}
