package de.bsommerfeld.marketscope.research.maintenance;

import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.domain.BulkDeleteResult;
import de.bsommerfeld.marketscope.core.domain.DeleteScope;
import de.bsommerfeld.marketscope.core.domain.StoreTable;
import de.bsommerfeld.marketscope.core.event.ApplicationEventBus;
import de.bsommerfeld.marketscope.core.event.StoreEvents;
import de.bsommerfeld.marketscope.db.MaintenanceService;
import de.bsommerfeld.marketscope.research.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * MaintenanceService is mocked; only the confirmation protocol is under test.
 */
@ExtendWith(MockitoExtension.class)
class DestructiveActionGuardTest {

    @Mock
    private MaintenanceService maintenance;

    @Mock
    private ApplicationEventBus eventBus;

    private MutableClock clock;
    private DestructiveActionGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResearchConfig config = new ResearchConfig();
        config.setConfirmationWindowSeconds(30);
        guard = new DestructiveActionGuard(maintenance, eventBus, clock, config);
    }

    private static BulkDeleteResult cacheCleared(int rows) {
        return new BulkDeleteResult(DeleteScope.CACHE, Map.of(StoreTable.CACHE_ENTRIES, rows));
    }

    // -- Arm / Commit --

    @Test
    void commit_shouldExecuteWhenArmedWithinWindow() {
        when(maintenance.bulkDelete(DeleteScope.CACHE)).thenReturn(cacheCleared(4));

        guard.arm("session-1", DeleteScope.CACHE);
        clock.advance(Duration.ofSeconds(10));
        Optional<BulkDeleteResult> result = guard.commit("session-1", DeleteScope.CACHE);

        assertTrue(result.isPresent());
        assertEquals(4, result.get().total());
        verify(eventBus).post(new StoreEvents.BulkDeleteCompleted(DeleteScope.CACHE, 4));
    }

    @Test
    void commit_shouldDoNothingWithoutArm() {
        assertTrue(guard.commit("session-1", DeleteScope.EVERYTHING).isEmpty());
        verifyNoInteractions(maintenance);
    }

    @Test
    void commit_shouldDoNothingAfterWindowExpired() {
        guard.arm("session-1", DeleteScope.CACHE);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(guard.commit("session-1", DeleteScope.CACHE).isEmpty());
        verifyNoInteractions(maintenance);
        verifyNoInteractions(eventBus);
    }

    @Test
    void commit_shouldDisarmOnScopeMismatch() {
        guard.arm("session-1", DeleteScope.CACHE);

        assertTrue(guard.commit("session-1", DeleteScope.EVERYTHING).isEmpty());
        assertFalse(guard.isArmed("session-1", DeleteScope.CACHE));
        assertTrue(guard.commit("session-1", DeleteScope.CACHE).isEmpty());
        verifyNoInteractions(maintenance);
    }

    @Test
    void commit_shouldConsumeArm() {
        when(maintenance.bulkDelete(DeleteScope.CACHE)).thenReturn(cacheCleared(1));
        guard.arm("session-1", DeleteScope.CACHE);

        guard.commit("session-1", DeleteScope.CACHE);
        Optional<BulkDeleteResult> again = guard.commit("session-1", DeleteScope.CACHE);

        assertTrue(again.isEmpty());
        verify(maintenance, times(1)).bulkDelete(DeleteScope.CACHE);
    }

    @Test
    void commit_shouldKeepSessionsApart() {
        guard.arm("session-1", DeleteScope.CACHE);

        assertTrue(guard.commit("session-2", DeleteScope.CACHE).isEmpty());
        assertTrue(guard.isArmed("session-1", DeleteScope.CACHE));
        verifyNoInteractions(maintenance);
    }

    @Test
    void arm_shouldReplaceEarlierScope() {
        guard.arm("session-1", DeleteScope.CACHE);
        guard.arm("session-1", DeleteScope.SEARCHES);

        assertFalse(guard.isArmed("session-1", DeleteScope.CACHE));
        assertTrue(guard.isArmed("session-1", DeleteScope.SEARCHES));
    }

    @Test
    void disarm_shouldCancelPendingConfirmation() {
        guard.arm("session-1", DeleteScope.CACHE);
        guard.disarm("session-1");

        assertTrue(guard.commit("session-1", DeleteScope.CACHE).isEmpty());
        verifyNoInteractions(maintenance);
    }

    @Test
    void arm_shouldDropExpiredArmsOfOtherSessions() {
        guard.arm("abandoned-1", DeleteScope.CACHE);
        guard.arm("abandoned-2", DeleteScope.EVERYTHING);
        clock.advance(Duration.ofMinutes(5));

        guard.arm("session-1", DeleteScope.SEARCHES);

        assertEquals(1, guard.pendingCount());
        assertTrue(guard.isArmed("session-1", DeleteScope.SEARCHES));
    }

    @Test
    void isArmed_shouldDropExpiredArms() {
        guard.arm("abandoned", DeleteScope.CACHE);
        clock.advance(Duration.ofSeconds(30));

        assertFalse(guard.isArmed("someone-else", DeleteScope.CACHE));
        assertEquals(0, guard.pendingCount());
    }

    // -- Request --

    @Test
    void request_shouldArmFirstAndExecuteSecond() {
        when(maintenance.bulkDelete(DeleteScope.CACHE)).thenReturn(cacheCleared(2));

        Optional<BulkDeleteResult> first = guard.request("session-1", DeleteScope.CACHE);
        Optional<BulkDeleteResult> second = guard.request("session-1", DeleteScope.CACHE);

        assertTrue(first.isEmpty());
        assertTrue(second.isPresent());
        assertFalse(guard.isArmed("session-1", DeleteScope.CACHE));
    }

    @Test
    void request_shouldRearmAfterExpiry() {
        guard.request("session-1", DeleteScope.EVERYTHING);
        clock.advance(Duration.ofMinutes(1));

        assertTrue(guard.request("session-1", DeleteScope.EVERYTHING).isEmpty());
        assertTrue(guard.isArmed("session-1", DeleteScope.EVERYTHING));
        verify(maintenance, never()).bulkDelete(any());
    }
}
