package docbro.shard;

import docbro.MutableClock;
import docbro.config.RegistryConfig;
import docbro.errors.AlreadyExistsException;
import docbro.errors.NotFoundException;
import docbro.errors.ValidationException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ProjectShards shards;
    private ShardStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-04-01T10:00:00Z");
        shards = new ProjectShards(RegistryConfig.builder().dataDirectory(tempDir).build(), clock);
        store = shards.get("docs");
    }

    @AfterEach
    void tearDown() {
        shards.close();
    }

    @Test
    void sessionMovesFromCreatedToRunningToCompleted() {
        CrawlSession session = store.createCrawlSession("p1", 3, "DocBro/1.0", 1.5);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.CREATED);
        assertThat(session.getStartedAt()).isNull();
        assertThat(session.getRateLimit()).isEqualTo(1.5);

        clock.advance(Duration.ofSeconds(10));
        CrawlSession running = store.updateSessionProgress(session.getId(), 20, 5, 1, 4096);
        assertThat(running.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(running.getStartedAt()).isEqualTo(clock.instant());
        assertThat(running.getPagesDiscovered()).isEqualTo(20);
        assertThat(running.getPagesCrawled()).isEqualTo(5);

        CrawlSession done = store.completeSession(session.getId(), SessionStatus.COMPLETED, null);
        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getCompletedAt()).isEqualTo(clock.instant());
    }

    @Test
    void invalidSessionArgumentsAreRejected() {
        assertThatThrownBy(() -> store.createCrawlSession("p1", 0, "ua", 1.0))
                .isInstanceOf(ValidationException.class);
        CrawlSession session = store.createCrawlSession("p1", 2, "ua", 1.0);
        assertThatThrownBy(() -> store.completeSession(session.getId(), SessionStatus.PAUSED, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.updateSessionProgress("missing", 1, 1, 0, 1))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void archivedSessionsLeaveTheActiveListing() {
        CrawlSession first = store.createCrawlSession("p1", 2, "ua", 1.0);
        clock.advance(Duration.ofMinutes(1));
        CrawlSession second = store.createCrawlSession("p1", 2, "ua", 1.0);

        assertThat(store.listCrawlSessions(false)).extracting(CrawlSession::getId)
                .containsExactly(second.getId(), first.getId());

        assertThat(store.archiveAllSessions()).isEqualTo(2);
        assertThat(store.archiveAllSessions()).isZero();
        assertThat(store.listCrawlSessions(false)).isEmpty();
        assertThat(store.listCrawlSessions(true)).allMatch(CrawlSession::isArchived).hasSize(2);
        assertThatThrownBy(() -> store.updateSessionProgress(first.getId(), 1, 1, 0, 1))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void pagesAreTrackedPerSession() {
        CrawlSession session = store.createCrawlSession("p1", 2, "ua", 1.0);
        Page root = store.addPage(session.getId(), "https://docs.example.com/", 0, null);
        clock.advance(Duration.ofSeconds(1));
        Page child = store.addPage(session.getId(), "https://docs.example.com/intro", 1, root.getUrl());

        assertThat(root.getStatus()).isEqualTo(PageStatus.DISCOVERED);
        assertThat(root.getResponseCode()).isNull();

        Page crawled = store.markPageCrawled(root.getId(), "Docs", "Welcome", 200, 1234);
        assertThat(crawled.getStatus()).isEqualTo(PageStatus.PROCESSED);
        assertThat(crawled.getResponseCode()).isEqualTo(200);
        assertThat(crawled.getSizeBytes()).isEqualTo(1234);

        Page failed = store.markPageFailed(child.getId(), "timeout");
        assertThat(failed.getStatus()).isEqualTo(PageStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("timeout");

        assertThat(store.listPages(session.getId())).extracting(Page::getId)
                .containsExactly(root.getId(), child.getId());
        assertThat(store.countPages(session.getId(), null)).isEqualTo(2);
        assertThat(store.countPages(session.getId(), PageStatus.PROCESSED)).isEqualTo(1);
    }

    @Test
    void duplicateUrlInOneSessionIsRejected() {
        CrawlSession session = store.createCrawlSession("p1", 2, "ua", 1.0);
        store.addPage(session.getId(), "https://docs.example.com/", 0, null);

        assertThatThrownBy(() -> store.addPage(session.getId(), "https://docs.example.com/", 0, null))
                .isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> store.addPage("missing", "https://docs.example.com/", 0, null))
                .isInstanceOf(NotFoundException.class);
    }
}
