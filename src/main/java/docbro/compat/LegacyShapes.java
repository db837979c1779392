package docbro.compat;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of legacy shape detectors; the first match wins.
 * Typed-settings rows are checked before crawler rows because a typed row
 * may still carry a crawler column such as source_url.
 */
public final class LegacyShapes {

    private static final List<LegacyShape> SHAPES = List.of(new TypedSettingsShape(), new CrawlerShape());

    private LegacyShapes() {
    }

    public static List<LegacyShape> all() {
        return SHAPES;
    }

    public static Optional<LegacyShape> detect(Set<String> columns) {
        for (LegacyShape shape : SHAPES) {
            if (shape.matches(columns)) {
                return Optional.of(shape);
            }
        }
        return Optional.empty();
    }
}
