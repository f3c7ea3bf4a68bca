package de.bsommerfeld.marketscope.research.deal;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.SearchRecord;
import de.bsommerfeld.marketscope.db.SearchHistoryLog;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs deal searches. Results are never cached: each search goes to the
 * provider and is appended to the search history.
 */
@Singleton
public class DealSearchService {

    private static final Logger LOG = LoggerFactory.getLogger(DealSearchService.class);
    static final String EVENT_KIND = "ma_search";

    private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\|[\\s:|-]*\\|$");

    private final SearchHistoryLog searches;
    private final TelemetryLog telemetry;

    @Inject
    public DealSearchService(SearchHistoryLog searches, TelemetryLog telemetry) {
        this.searches = searches;
        this.telemetry = telemetry;
    }

    /**
     * Asks the provider, stores the search with the number of deals in the
     * returned table and logs a telemetry event.
     */
    public DealSearchResult search(String subject, String timeframe, DealSearchProvider provider,
            String sessionToken) {
        String result = provider.findDeals(subject, timeframe);
        String payload = result != null ? result : "";
        int deals = countDeals(payload);
        long id = searches.append(subject, timeframe, payload, deals);
        telemetry.log(EVENT_KIND, Map.of(
                "market", subject,
                "timeframe", timeframe,
                "deals_found", deals), sessionToken);
        LOG.info("Deal search for '{}' ({}) found {} deal(s).", subject, timeframe, deals);
        return new DealSearchResult(id, payload, deals);
    }

    /** Earlier searches for the subject, newest first. */
    public List<SearchRecord> history(String subject) {
        return searches.forSubject(subject);
    }

    /** Drops one search from the history; false if it was already gone. */
    public boolean delete(long searchId) {
        boolean removed = searches.delete(searchId) > 0;
        LOG.info("Search {} {}.", searchId, removed ? "deleted" : "not found");
        return removed;
    }

    /**
     * Data rows of a markdown table: lines starting with {@code |}, minus
     * the header and separator rows.
     */
    static int countDeals(String table) {
        int rows = 0;
        boolean headerSeen = false;
        for (String line : table.split("\\R")) {
            String row = line.strip();
            if (!row.startsWith("|")) {
                continue;
            }
            if (SEPARATOR_ROW.matcher(row).matches()) {
                continue;
            }
            if (!headerSeen) {
                headerSeen = true;
                continue;
            }
            rows++;
        }
        return rows;
    }
}
