package de.bsommerfeld.marketscope.research.maintenance;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.CleanupReport;
import de.bsommerfeld.marketscope.core.domain.StoreHealth;
import de.bsommerfeld.marketscope.core.event.ApplicationEventBus;
import de.bsommerfeld.marketscope.core.event.StoreEvents;
import de.bsommerfeld.marketscope.db.MaintenanceService;

/**
 * Non-destructive maintenance triggered from the settings view. Runs only
 * when called; there is no schedule.
 */
@Singleton
public class HousekeepingService {

    private final MaintenanceService maintenance;
    private final ApplicationEventBus eventBus;

    @Inject
    public HousekeepingService(MaintenanceService maintenance, ApplicationEventBus eventBus) {
        this.maintenance = maintenance;
        this.eventBus = eventBus;
    }

    public CleanupReport cleanup() {
        CleanupReport report = maintenance.fullCleanup();
        eventBus.post(new StoreEvents.CleanupCompleted(report));
        return report;
    }

    public StoreHealth health() {
        return maintenance.health();
    }
}
