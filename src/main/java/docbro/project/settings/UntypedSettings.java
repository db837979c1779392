package docbro.project.settings;

import docbro.project.ProjectType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of legacy rows written before projects carried a type.
 * Nothing is required and nothing is range-checked.
 */
public final class UntypedSettings extends AbstractProjectSettings {

    UntypedSettings(Map<String, ?> values) {
        super(values);
    }

    @Override
    public ProjectType type() {
        return null;
    }

    @Override
    public Set<String> requiredKeys() {
        return Set.of();
    }

    @Override
    public Map<String, Object> defaults() {
        return Map.of();
    }

    @Override
    protected void validateRanges(List<String> problems) {
    }

    @Override
    protected ProjectSettings create(Map<String, ?> values) {
        return new UntypedSettings(values);
    }
}
