package de.bsommerfeld.marketscope.research.maintenance;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.domain.BulkDeleteResult;
import de.bsommerfeld.marketscope.core.domain.DeleteScope;
import de.bsommerfeld.marketscope.core.event.ApplicationEventBus;
import de.bsommerfeld.marketscope.core.event.StoreEvents;
import de.bsommerfeld.marketscope.db.MaintenanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Two-step confirmation in front of {@link MaintenanceService#bulkDelete}.
 *
 * <p>
 * A session first {@link #arm arms} a scope, then {@link #commit commits} the
 * same scope within the confirmation window. An arm is consumed by the
 * commit attempt whether or not it executes, so a stale or mismatched
 * confirmation never deletes anything and the user has to start over.
 * Sessions are independent of each other.
 */
@Singleton
public class DestructiveActionGuard {

    private static final Logger LOG = LoggerFactory.getLogger(DestructiveActionGuard.class);

    private record Arm(DeleteScope scope, Instant expiresAt) {
    }

    private final MaintenanceService maintenance;
    private final ApplicationEventBus eventBus;
    private final Clock clock;
    private final ResearchConfig config;
    private final Map<String, Arm> armed = new HashMap<>();

    @Inject
    public DestructiveActionGuard(MaintenanceService maintenance, ApplicationEventBus eventBus,
            Clock clock, ResearchConfig config) {
        this.maintenance = maintenance;
        this.eventBus = eventBus;
        this.clock = clock;
        this.config = config;
    }

    /** Flags intent; replaces any earlier arm of the same session. */
    public synchronized void arm(String sessionToken, DeleteScope scope) {
        dropExpired();
        Instant expiresAt = clock.instant().plus(window());
        armed.put(sessionToken, new Arm(scope, expiresAt));
        LOG.info("Session {} armed bulk delete of {} until {}.", sessionToken, scope, expiresAt);
    }

    /**
     * Executes the delete if this session armed exactly {@code scope} and the
     * window has not passed.
     *
     * @return the delete result, or empty if nothing was executed
     */
    public synchronized Optional<BulkDeleteResult> commit(String sessionToken, DeleteScope scope) {
        Arm arm = armed.remove(sessionToken);
        if (arm == null) {
            LOG.warn("Session {} tried to commit {} without arming.", sessionToken, scope);
            return Optional.empty();
        }
        if (arm.scope() != scope) {
            LOG.warn("Session {} armed {} but committed {}; disarmed.", sessionToken, arm.scope(), scope);
            return Optional.empty();
        }
        if (!clock.instant().isBefore(arm.expiresAt())) {
            LOG.info("Confirmation of {} for session {} expired.", scope, sessionToken);
            return Optional.empty();
        }

        BulkDeleteResult result = maintenance.bulkDelete(scope);
        eventBus.post(new StoreEvents.BulkDeleteCompleted(scope, result.total()));
        return Optional.of(result);
    }

    /**
     * Click-twice convenience: the first request arms, a second request for
     * the same scope within the window executes.
     *
     * @return the delete result on the executing call, empty when this call
     *         only armed
     */
    public synchronized Optional<BulkDeleteResult> request(String sessionToken, DeleteScope scope) {
        if (isArmed(sessionToken, scope)) {
            return commit(sessionToken, scope);
        }
        arm(sessionToken, scope);
        return Optional.empty();
    }

    public synchronized boolean isArmed(String sessionToken, DeleteScope scope) {
        dropExpired();
        Arm arm = armed.get(sessionToken);
        return arm != null && arm.scope() == scope;
    }

    public synchronized void disarm(String sessionToken) {
        armed.remove(sessionToken);
    }

    /** Arms of sessions that never came back to commit. */
    private void dropExpired() {
        Instant now = clock.instant();
        armed.values().removeIf(arm -> !now.isBefore(arm.expiresAt()));
    }

    synchronized int pendingCount() {
        return armed.size();
    }

    private Duration window() {
        return Duration.ofSeconds(config.getConfirmationWindowSeconds());
    }
}
