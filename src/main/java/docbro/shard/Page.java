package docbro.shard;

import java.time.Instant;
import java.util.Objects;

/**
 * One discovered or crawled page of a session.
 */
public final class Page {

    private final String id;
    private final String sessionId;
    private final String url;
    private final PageStatus status;
    private final String title;
    private final int crawlDepth;
    private final String parentUrl;
    private final Integer responseCode;
    private final long sizeBytes;
    private final Instant discoveredAt;
    private final Instant crawledAt;
    private final String errorMessage;

    Page(String id, String sessionId, String url, PageStatus status, String title, int crawlDepth,
         String parentUrl, Integer responseCode, long sizeBytes, Instant discoveredAt, Instant crawledAt,
         String errorMessage) {
        this.id = id;
        this.sessionId = sessionId;
        this.url = url;
        this.status = status;
        this.title = title;
        this.crawlDepth = crawlDepth;
        this.parentUrl = parentUrl;
        this.responseCode = responseCode;
        this.sizeBytes = sizeBytes;
        this.discoveredAt = discoveredAt;
        this.crawledAt = crawledAt;
        this.errorMessage = errorMessage;
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public String getUrl() { return url; }
    public PageStatus getStatus() { return status; }
    public String getTitle() { return title; }
    public int getCrawlDepth() { return crawlDepth; }
    public String getParentUrl() { return parentUrl; }
    public Integer getResponseCode() { return responseCode; }
    public long getSizeBytes() { return sizeBytes; }
    public Instant getDiscoveredAt() { return discoveredAt; }
    public Instant getCrawledAt() { return crawledAt; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Page) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Page{url='" + url + "', status=" + status.getValue() + '}';
    }
}
