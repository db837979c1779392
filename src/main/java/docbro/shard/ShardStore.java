package docbro.shard;

import docbro.db.SqliteDatabase;
import docbro.db.Timestamps;
import docbro.db.TransactionManager;
import docbro.errors.NotFoundException;
import docbro.errors.ValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Crawl sessions and pages of one project, kept in the project's own file.
 * All access goes through the shard's single connection.
 */
public class ShardStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ShardStore.class);

    private static final String SESSION_COLUMNS = "id, project_id, status, crawl_depth, user_agent, rate_limit, "
            + "created_at, started_at, completed_at, updated_at, pages_discovered, pages_crawled, pages_failed, "
            + "total_size_bytes, error_message, archived";
    private static final String PAGE_COLUMNS = "id, session_id, url, status, title, crawl_depth, parent_url, "
            + "response_code, size_bytes, discovered_at, crawled_at, error_message";

    private final String projectName;
    private final SqliteDatabase database;
    private final TransactionManager transactionManager;
    private final Clock clock;

    public ShardStore(String projectName, SqliteDatabase database, Clock clock) {
        this.projectName = projectName;
        this.database = database;
        this.transactionManager = database.getTransactionManager();
        this.clock = clock;
    }

    public String getProjectName() {
        return projectName;
    }

    public Path getFile() {
        return database.getFile();
    }

    // ==================== Sessions ====================

    public CrawlSession createCrawlSession(String projectId, int crawlDepth, String userAgent, double rateLimit) {
        if (crawlDepth < 1 || crawlDepth > 10) {
            throw new ValidationException("Crawl depth must be between 1 and 10, got " + crawlDepth);
        }
        String id = UUID.randomUUID().toString();
        String now = Timestamps.format(Timestamps.now(clock));
        transactionManager.executeInTransaction(conn -> {
            String sql = "INSERT INTO crawl_sessions (id, project_id, status, crawl_depth, user_agent, rate_limit, "
                    + "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setString(2, projectId);
                stmt.setString(3, SessionStatus.CREATED.getValue());
                stmt.setInt(4, crawlDepth);
                stmt.setString(5, userAgent);
                stmt.setDouble(6, rateLimit);
                stmt.setString(7, now);
                stmt.setString(8, now);
                return stmt.executeUpdate();
            }
        });
        LOG.debug("Created crawl session {} for project {}", id, projectName);
        return findCrawlSession(id).orElseThrow();
    }

    public Optional<CrawlSession> findCrawlSession(String sessionId) {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + SESSION_COLUMNS + " FROM crawl_sessions WHERE id = ?")) {
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapSession(rs)) : Optional.<CrawlSession>empty();
                }
            }
        });
    }

    /**
     * Sessions, newest first.
     *
     * @param includeArchived Whether sessions archived by a recreation are listed
     */
    public List<CrawlSession> listCrawlSessions(boolean includeArchived) {
        String sql = "SELECT " + SESSION_COLUMNS + " FROM crawl_sessions"
                + (includeArchived ? "" : " WHERE archived = 0")
                + " ORDER BY created_at DESC, id ASC";
        return transactionManager.execute(conn -> {
            List<CrawlSession> sessions = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sessions.add(mapSession(rs));
                }
            }
            return sessions;
        });
    }

    /**
     * Record progress counters; the first update moves a created session to running.
     */
    public CrawlSession updateSessionProgress(String sessionId, long pagesDiscovered, long pagesCrawled,
                                             long pagesFailed, long totalSizeBytes) {
        String now = Timestamps.format(Timestamps.now(clock));
        int updated = transactionManager.executeInTransaction(conn -> {
            String sql = "UPDATE crawl_sessions SET pages_discovered = ?, pages_crawled = ?, pages_failed = ?, "
                    + "total_size_bytes = ?, updated_at = ?, started_at = COALESCE(started_at, ?), "
                    + "status = CASE WHEN status = 'created' THEN 'running' ELSE status END "
                    + "WHERE id = ? AND archived = 0";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setLong(1, pagesDiscovered);
                stmt.setLong(2, pagesCrawled);
                stmt.setLong(3, pagesFailed);
                stmt.setLong(4, totalSizeBytes);
                stmt.setString(5, now);
                stmt.setString(6, now);
                stmt.setString(7, sessionId);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Active crawl session '" + sessionId + "' not found in " + projectName);
        }
        return findCrawlSession(sessionId).orElseThrow();
    }

    /**
     * Move a session to a terminal state.
     */
    public CrawlSession completeSession(String sessionId, SessionStatus finalStatus, String errorMessage) {
        if (!finalStatus.isTerminal()) {
            throw new ValidationException("Session can only complete as completed, failed or cancelled");
        }
        String now = Timestamps.format(Timestamps.now(clock));
        int updated = transactionManager.executeInTransaction(conn -> {
            String sql = "UPDATE crawl_sessions SET status = ?, error_message = ?, completed_at = ?, updated_at = ? "
                    + "WHERE id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, finalStatus.getValue());
                stmt.setString(2, errorMessage);
                stmt.setString(3, now);
                stmt.setString(4, now);
                stmt.setString(5, sessionId);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Crawl session '" + sessionId + "' not found in " + projectName);
        }
        return findCrawlSession(sessionId).orElseThrow();
    }

    /**
     * Archive every session, hiding them from the active listing.
     *
     * @return Number of sessions newly archived
     */
    public int archiveAllSessions() {
        String now = Timestamps.format(Timestamps.now(clock));
        int archived = transactionManager.executeInTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE crawl_sessions SET archived = 1, updated_at = ? WHERE archived = 0")) {
                stmt.setString(1, now);
                return stmt.executeUpdate();
            }
        });
        LOG.info("Archived {} crawl session(s) of project {}", archived, projectName);
        return archived;
    }

    // ==================== Pages ====================

    /**
     * Record a discovered page.
     *
     * @throws docbro.errors.AlreadyExistsException if the session already has the URL
     */
    public Page addPage(String sessionId, String url, int crawlDepth, String parentUrl) {
        CrawlSession session = findCrawlSession(sessionId).orElseThrow(() ->
                new NotFoundException("Crawl session '" + sessionId + "' not found in " + projectName));
        String id = UUID.randomUUID().toString();
        String now = Timestamps.format(Timestamps.now(clock));
        transactionManager.executeInTransaction(conn -> {
            String sql = "INSERT INTO pages (id, project_id, session_id, url, status, crawl_depth, parent_url, "
                    + "discovered_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setString(2, session.getProjectId());
                stmt.setString(3, sessionId);
                stmt.setString(4, url);
                stmt.setString(5, PageStatus.DISCOVERED.getValue());
                stmt.setInt(6, crawlDepth);
                stmt.setString(7, parentUrl);
                stmt.setString(8, now);
                return stmt.executeUpdate();
            }
        });
        return findPage(id).orElseThrow();
    }

    public Page markPageCrawled(String pageId, String title, String contentText, int responseCode, long sizeBytes) {
        String now = Timestamps.format(Timestamps.now(clock));
        int updated = transactionManager.executeInTransaction(conn -> {
            String sql = "UPDATE pages SET status = ?, title = ?, content_text = ?, response_code = ?, "
                    + "size_bytes = ?, crawled_at = ?, error_message = NULL WHERE id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, PageStatus.PROCESSED.getValue());
                stmt.setString(2, title);
                stmt.setString(3, contentText);
                stmt.setInt(4, responseCode);
                stmt.setLong(5, sizeBytes);
                stmt.setString(6, now);
                stmt.setString(7, pageId);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Page '" + pageId + "' not found in " + projectName);
        }
        return findPage(pageId).orElseThrow();
    }

    public Page markPageFailed(String pageId, String errorMessage) {
        int updated = transactionManager.executeInTransaction(conn -> {
            String sql = "UPDATE pages SET status = ?, error_message = ?, retry_count = retry_count + 1 WHERE id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, PageStatus.FAILED.getValue());
                stmt.setString(2, errorMessage);
                stmt.setString(3, pageId);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new NotFoundException("Page '" + pageId + "' not found in " + projectName);
        }
        return findPage(pageId).orElseThrow();
    }

    public Optional<Page> findPage(String pageId) {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + PAGE_COLUMNS + " FROM pages WHERE id = ?")) {
                stmt.setString(1, pageId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapPage(rs)) : Optional.<Page>empty();
                }
            }
        });
    }

    /**
     * Pages of a session in discovery order.
     */
    public List<Page> listPages(String sessionId) {
        return transactionManager.execute(conn -> {
            List<Page> pages = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + PAGE_COLUMNS
                    + " FROM pages WHERE session_id = ? ORDER BY discovered_at ASC, url ASC")) {
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        pages.add(mapPage(rs));
                    }
                }
            }
            return pages;
        });
    }

    /**
     * @param status Filter, or null for every page of the session
     */
    public long countPages(String sessionId, PageStatus status) {
        String sql = "SELECT COUNT(*) FROM pages WHERE session_id = ?" + (status == null ? "" : " AND status = ?");
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, sessionId);
                if (status != null) {
                    stmt.setString(2, status.getValue());
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    // ==================== Mapping ====================

    private CrawlSession mapSession(ResultSet rs) throws SQLException {
        return CrawlSession.builder()
                .id(rs.getString("id"))
                .projectId(rs.getString("project_id"))
                .status(SessionStatus.fromValue(rs.getString("status")))
                .crawlDepth(rs.getInt("crawl_depth"))
                .userAgent(rs.getString("user_agent"))
                .rateLimit(rs.getDouble("rate_limit"))
                .createdAt(Timestamps.parse(rs.getString("created_at")))
                .startedAt(Timestamps.parse(rs.getString("started_at")))
                .completedAt(Timestamps.parse(rs.getString("completed_at")))
                .updatedAt(Timestamps.parse(rs.getString("updated_at")))
                .pagesDiscovered(rs.getLong("pages_discovered"))
                .pagesCrawled(rs.getLong("pages_crawled"))
                .pagesFailed(rs.getLong("pages_failed"))
                .totalSizeBytes(rs.getLong("total_size_bytes"))
                .errorMessage(rs.getString("error_message"))
                .archived(rs.getInt("archived") != 0)
                .build();
    }

    private Page mapPage(ResultSet rs) throws SQLException {
        Integer responseCode = rs.getInt("response_code");
        if (rs.wasNull()) {
            responseCode = null;
        }
        return new Page(
                rs.getString("id"),
                rs.getString("session_id"),
                rs.getString("url"),
                PageStatus.fromValue(rs.getString("status")),
                rs.getString("title"),
                rs.getInt("crawl_depth"),
                rs.getString("parent_url"),
                responseCode,
                rs.getLong("size_bytes"),
                Timestamps.parse(rs.getString("discovered_at")),
                Timestamps.parse(rs.getString("crawled_at")),
                rs.getString("error_message"));
    }

    @Override
    public void close() {
        database.close();
    }
}
