package docbro.shard;

import java.time.Instant;
import java.util.Objects;

/**
 * One crawl run of a project, as stored in its shard.
 */
public final class CrawlSession {

    private final String id;
    private final String projectId;
    private final SessionStatus status;
    private final int crawlDepth;
    private final String userAgent;
    private final double rateLimit;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;
    private final long pagesDiscovered;
    private final long pagesCrawled;
    private final long pagesFailed;
    private final long totalSizeBytes;
    private final String errorMessage;
    private final boolean archived;

    private CrawlSession(Builder builder) {
        this.id = builder.id;
        this.projectId = builder.projectId;
        this.status = builder.status;
        this.crawlDepth = builder.crawlDepth;
        this.userAgent = builder.userAgent;
        this.rateLimit = builder.rateLimit;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
        this.pagesDiscovered = builder.pagesDiscovered;
        this.pagesCrawled = builder.pagesCrawled;
        this.pagesFailed = builder.pagesFailed;
        this.totalSizeBytes = builder.totalSizeBytes;
        this.errorMessage = builder.errorMessage;
        this.archived = builder.archived;
    }

    static Builder builder() {
        return new Builder();
    }

    // ==================== Getters ====================

    public String getId() { return id; }
    public String getProjectId() { return projectId; }
    public SessionStatus getStatus() { return status; }
    public int getCrawlDepth() { return crawlDepth; }
    public String getUserAgent() { return userAgent; }
    public double getRateLimit() { return rateLimit; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getPagesDiscovered() { return pagesDiscovered; }
    public long getPagesCrawled() { return pagesCrawled; }
    public long getPagesFailed() { return pagesFailed; }
    public long getTotalSizeBytes() { return totalSizeBytes; }
    public String getErrorMessage() { return errorMessage; }
    public boolean isArchived() { return archived; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((CrawlSession) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CrawlSession{id='" + id + "', status=" + status.getValue()
                + ", crawled=" + pagesCrawled + "/" + pagesDiscovered
                + (archived ? ", archived" : "") + '}';
    }

    static class Builder {
        private String id;
        private String projectId;
        private SessionStatus status = SessionStatus.CREATED;
        private int crawlDepth;
        private String userAgent;
        private double rateLimit;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private long pagesDiscovered;
        private long pagesCrawled;
        private long pagesFailed;
        private long totalSizeBytes;
        private String errorMessage;
        private boolean archived;

        Builder id(String id) { this.id = id; return this; }
        Builder projectId(String projectId) { this.projectId = projectId; return this; }
        Builder status(SessionStatus status) { this.status = status; return this; }
        Builder crawlDepth(int crawlDepth) { this.crawlDepth = crawlDepth; return this; }
        Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        Builder rateLimit(double rateLimit) { this.rateLimit = rateLimit; return this; }
        Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        Builder pagesDiscovered(long pagesDiscovered) { this.pagesDiscovered = pagesDiscovered; return this; }
        Builder pagesCrawled(long pagesCrawled) { this.pagesCrawled = pagesCrawled; return this; }
        Builder pagesFailed(long pagesFailed) { this.pagesFailed = pagesFailed; return this; }
        Builder totalSizeBytes(long totalSizeBytes) { this.totalSizeBytes = totalSizeBytes; return this; }
        Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        Builder archived(boolean archived) { this.archived = archived; return this; }

        CrawlSession build() {
            return new CrawlSession(this);
        }
    }
}
