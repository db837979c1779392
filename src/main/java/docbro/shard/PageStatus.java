package docbro.shard;

import docbro.errors.ValidationException;

/**
 * Lifecycle of one crawled page.
 */
public enum PageStatus {
    DISCOVERED("discovered"),
    CRAWLING("crawling"),
    PROCESSED("processed"),
    INDEXED("indexed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    PageStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PageStatus fromValue(String value) {
        for (PageStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown page status: '" + value + "'");
    }
}
