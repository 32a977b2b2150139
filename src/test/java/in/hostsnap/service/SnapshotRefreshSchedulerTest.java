package in.hostsnap.service;

import in.hostsnap.snapshot.RefreshReport;
import in.hostsnap.snapshot.RootSnapshot;
import in.hostsnap.source.Category;
import in.hostsnap.source.FailureReason;
import in.hostsnap.testutil.ScriptedInventorySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotRefreshScheduler.
 *
 * Tests:
 * - Periodic refresh
 * - Manual trigger
 * - Change notification with diff
 * - Failing listeners and categories do not stop the schedule
 * - Lifecycle management
 */
class SnapshotRefreshSchedulerTest {

    private static final Category<String> USERS = Category.of("users", String.class);
    private static final Category<Integer> PORTS = Category.of("ports", Integer.class);

    private final ScriptedInventorySource source = new ScriptedInventorySource();
    private RootSnapshot root;
    private SnapshotRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        source.rows("users", List.of("alice", "bob")).rows("ports", List.of(22, 80));
        root = RootSnapshot.builder(source).register(USERS).register(PORTS).build();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
        root.close();
    }

    @Test
    void testInitialState() {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofSeconds(10));

        assertFalse(scheduler.isRunning());
        assertNull(scheduler.getLastReport());
        assertEquals(0, scheduler.getCompletedRefreshes());
        assertEquals(0, source.queryCount("users"), "No query before start");
    }

    @Test
    void testPeriodicRefresh() throws Exception {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofMillis(50));
        CountDownLatch threeRefreshes = new CountDownLatch(3);
        scheduler.onRefreshCompleted(report -> threeRefreshes.countDown());

        scheduler.start();

        assertTrue(threeRefreshes.await(5, TimeUnit.SECONDS), "Expected at least 3 periodic refreshes");
        assertTrue(scheduler.isRunning());
        assertTrue(source.queryCount("users") >= 3);
    }

    @Test
    void testManualTrigger() throws Exception {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofHours(1));

        RefreshReport report = scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);

        assertTrue(report.isComplete());
        assertSame(report, scheduler.getLastReport());
        assertEquals(1, scheduler.getCompletedRefreshes());
    }

    @Test
    void testChangeNotificationCarriesDiff() throws Exception {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofHours(1));
        List<CategoryChange> changes = new CopyOnWriteArrayList<>();
        scheduler.onCategoryChanged(changes::add);

        scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);
        assertTrue(changes.isEmpty(), "First refresh is not a change by default");

        source.rows("users", List.of("alice", "carol"));
        scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);

        assertEquals(1, changes.size());
        CategoryChange change = changes.get(0);
        assertEquals("users", change.category());
        assertEquals(List.of("carol"), change.diff().added());
        assertEquals(List.of("bob"), change.diff().removed());
    }

    @Test
    void testChangeNotificationUsesCommittedStateNotLiveState() throws Exception {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofHours(1));
        scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);

        List<CategoryChange> changes = new CopyOnWriteArrayList<>();
        scheduler.onCategoryChanged(change -> {
            changes.add(change);
            if (change.category().equals("users")) {
                // A refresh from another caller commits before "ports" is published
                source.rows("ports", List.of(22, 80, 8080));
                root.refresh();
            }
        });

        source.rows("users", List.of("alice", "carol")).rows("ports", List.of(22, 443));
        RefreshReport report = scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);

        assertEquals(2, changes.size());
        CategoryChange ports = changes.get(1);
        assertEquals("ports", ports.category());
        assertSame(report.committed().get("ports"), ports.state());
        assertEquals(List.of(443), ports.diff().added());
        assertEquals(List.of(80), ports.diff().removed());
        assertEquals(List.of(22, 80, 8080), root.category(PORTS).records(), "Live state belongs to the later refresh");
    }

    @Test
    void testFailingListenerDoesNotBreakRefresh() throws Exception {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofHours(1));
        List<RefreshReport> seen = new CopyOnWriteArrayList<>();
        scheduler.onRefreshCompleted(report -> {
            throw new IllegalStateException("listener bug");
        });
        scheduler.onRefreshCompleted(seen::add);

        scheduler.triggerRefresh().get(5, TimeUnit.SECONDS);

        assertEquals(1, seen.size(), "Second listener still notified");
    }

    @Test
    void testCategoryFailureKeepsSchedulerRunning() throws Exception {
        source.fail("ports", FailureReason.CONNECTIVITY);
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofMillis(50));
        CountDownLatch twoRefreshes = new CountDownLatch(2);
        scheduler.onRefreshCompleted(report -> twoRefreshes.countDown());

        scheduler.start();

        assertTrue(twoRefreshes.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.getLastReport().failures().containsKey("ports"));
        assertEquals(List.of("users"), scheduler.getLastReport().succeeded());
    }

    @Test
    void testStop() {
        scheduler = new SnapshotRefreshScheduler(root, Duration.ofMillis(50));
        scheduler.start();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
    }

    @Test
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotRefreshScheduler(root, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new SnapshotRefreshScheduler(root, null));
    }
}
