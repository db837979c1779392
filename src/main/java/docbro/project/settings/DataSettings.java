package docbro.project.settings;

import docbro.project.ProjectType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of data (document import) projects.
 */
public final class DataSettings extends AbstractProjectSettings {

    public static final String CHUNK_SIZE = "chunk_size";
    public static final String CHUNK_OVERLAP = "chunk_overlap";
    public static final String EMBEDDING_MODEL = "embedding_model";

    private static final Map<String, Object> DEFAULTS;

    static {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(CHUNK_SIZE, 500L);
        defaults.put(CHUNK_OVERLAP, 50L);
        defaults.put(EMBEDDING_MODEL, "mxbai-embed-large");
        defaults.put("vector_store_type", "sqlite_vec");
        defaults.put("max_file_size", 52428800L);
        defaults.put("allowed_formats", List.of("pdf", "docx", "txt", "md", "html", "json"));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    DataSettings(Map<String, ?> values) {
        super(values);
    }

    @Override
    public ProjectType type() {
        return ProjectType.DATA;
    }

    @Override
    public Set<String> requiredKeys() {
        return Set.of(CHUNK_SIZE, EMBEDDING_MODEL);
    }

    @Override
    public Map<String, Object> defaults() {
        return DEFAULTS;
    }

    @Override
    protected void validateRanges(List<String> problems) {
        checkIntegerRange(problems, CHUNK_SIZE, 100, 5000);
        checkNonEmptyString(problems, EMBEDDING_MODEL);
    }

    @Override
    protected ProjectSettings create(Map<String, ?> values) {
        return new DataSettings(values);
    }

    public Integer getChunkSize() {
        Long size = integerValue(CHUNK_SIZE);
        return size == null ? null : size.intValue();
    }

    public Integer getChunkOverlap() {
        Long overlap = integerValue(CHUNK_OVERLAP);
        return overlap == null ? null : overlap.intValue();
    }

    public String getEmbeddingModel() {
        return stringValue(EMBEDDING_MODEL);
    }
}
