package de.bsommerfeld.marketscope.research.deal;

import de.bsommerfeld.marketscope.core.domain.SearchRecord;
import de.bsommerfeld.marketscope.db.ResearchDatabase;
import de.bsommerfeld.marketscope.db.SearchHistoryLog;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import de.bsommerfeld.marketscope.research.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DealSearchServiceTest {

    private static final String DEALS = """
            Recent transactions:

            | Acquirer | Target | Value |
            |----------|:------:|------:|
            | Acme     | Widgets Inc | $1.2B |
            | Globex   | Initech | $300M |
            | Umbrella | Hooli | undisclosed |

            Source: press releases
            """;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SearchHistoryLog searches;
    private TelemetryLog telemetry;
    private DealSearchService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResearchDatabase database = new ResearchDatabase(tempDir.resolve("research.db"));
        searches = new SearchHistoryLog(database, clock);
        telemetry = new TelemetryLog(database, clock);
        service = new DealSearchService(searches, telemetry);
    }

    // -- Deal counting --

    @Test
    void countDeals_shouldCountTableDataRows() {
        assertEquals(3, DealSearchService.countDeals(DEALS));
    }

    @Test
    void countDeals_shouldBeZeroWithoutTable() {
        assertEquals(0, DealSearchService.countDeals("No transactions were found in this period."));
        assertEquals(0, DealSearchService.countDeals(""));
    }

    @Test
    void countDeals_shouldBeZeroForHeaderOnlyTable() {
        assertEquals(0, DealSearchService.countDeals("| Acquirer | Target |\n| --- | --- |"));
    }

    // -- Search --

    @Test
    void search_shouldStoreEverySearch() {
        AtomicInteger calls = new AtomicInteger();
        DealSearchProvider provider = (subject, timeframe) -> {
            calls.incrementAndGet();
            return DEALS;
        };

        DealSearchResult first = service.search("Fintech", "2023", provider, "session-1");
        clock.advance(Duration.ofMinutes(5));
        DealSearchResult second = service.search("Fintech", "2023", provider, "session-1");

        assertEquals(2, calls.get());
        assertNotEquals(first.searchId(), second.searchId());
        assertEquals(3, second.dealsFound());

        List<SearchRecord> history = service.history("Fintech");
        assertEquals(2, history.size());
        assertEquals(second.searchId(), history.get(0).id());
        assertEquals(DEALS, history.get(0).payload());
    }

    @Test
    void search_shouldStoreEmptyPayloadForNullResult() {
        DealSearchResult result = service.search("Fintech", "2023", (subject, timeframe) -> null, null);

        assertEquals("", result.payload());
        assertEquals(0, result.dealsFound());
        assertEquals(1, service.history("Fintech").size());
    }

    @Test
    void search_shouldLogTelemetry() {
        service.search("Fintech", "last 12 months", (subject, timeframe) -> DEALS, "session-1");

        assertEquals(DealSearchService.EVENT_KIND, telemetry.recent(1).get(0).eventKind());
        assertTrue(telemetry.recent(1).get(0).eventPayload().contains("\"deals_found\":3"));
    }

    @Test
    void delete_shouldDropOneSearchAndKeepTheRest() {
        DealSearchResult first = service.search("Fintech", "2023", (subject, timeframe) -> DEALS, null);
        clock.advance(Duration.ofMinutes(5));
        DealSearchResult second = service.search("Fintech", "2024", (subject, timeframe) -> DEALS, null);

        assertTrue(service.delete(first.searchId()));
        assertFalse(service.delete(first.searchId()));

        List<SearchRecord> history = service.history("Fintech");
        assertEquals(1, history.size());
        assertEquals(second.searchId(), history.get(0).id());
    }
}
