package docbro.project.settings;

import docbro.project.ProjectType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of crawling projects.
 */
public final class CrawlingSettings extends AbstractProjectSettings {

    public static final String CRAWL_DEPTH = "crawl_depth";
    public static final String RATE_LIMIT = "rate_limit";
    public static final String USER_AGENT = "user_agent";

    private static final Map<String, Object> DEFAULTS;

    static {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(CRAWL_DEPTH, 3L);
        defaults.put(RATE_LIMIT, 1.0);
        defaults.put(USER_AGENT, "DocBro/1.0");
        defaults.put("max_file_size", 10485760L);
        defaults.put("allowed_formats", List.of("html", "pdf", "txt", "md"));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    CrawlingSettings(Map<String, ?> values) {
        super(values);
    }

    @Override
    public ProjectType type() {
        return ProjectType.CRAWLING;
    }

    @Override
    public Set<String> requiredKeys() {
        return Set.of(CRAWL_DEPTH);
    }

    @Override
    public Map<String, Object> defaults() {
        return DEFAULTS;
    }

    @Override
    protected void validateRanges(List<String> problems) {
        checkIntegerRange(problems, CRAWL_DEPTH, 1, 10);
        checkPositiveNumber(problems, RATE_LIMIT);
    }

    @Override
    protected ProjectSettings create(Map<String, ?> values) {
        return new CrawlingSettings(values);
    }

    public Integer getCrawlDepth() {
        Long depth = integerValue(CRAWL_DEPTH);
        return depth == null ? null : depth.intValue();
    }

    public Double getRateLimit() {
        Number rate = numberValue(RATE_LIMIT);
        return rate == null ? null : rate.doubleValue();
    }

    public String getUserAgent() {
        return stringValue(USER_AGENT);
    }
}
