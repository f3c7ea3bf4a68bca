/**
 * The research store: a single SQLite file holding cached analyses,
 * ingested documents and the interaction, search and telemetry logs.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [research workflows / presentation layer]
 *        │
 *        ▼
 *   AnalysisCache  DocumentStore  InteractionLog  SearchHistoryLog  TelemetryLog
 *        │               │               │               │               │
 *        └───────────────┴──────┬────────┴───────────────┴───────────────┘
 *                               ▼
 *                      ResearchDatabase   ← schema, connections, transactions
 *                               ▲
 *                      MaintenanceService ← stats, bulk delete, VACUUM, backup
 * </pre>
 *
 * Every component receives the {@link de.bsommerfeld.marketscope.db.ResearchDatabase}
 * and a {@link java.time.Clock} through its constructor. Nothing is held in
 * static state, so a test can open as many isolated stores as it likes.
 *
 * <h2>Database Schema</h2>
 * All timestamps are UTC epoch milliseconds.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ cache_entries                                                     │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Stable across upserts of the same fingerprint │
 * │ subject          │ e.g. "EV Batteries" (indexed)                 │
 * │ query_kind       │ global, vertical, metrics, ...                │
 * │ fingerprint (UQ) │ SHA-256 of subject, kind and parameters       │
 * │ payload          │ Generated analysis text                       │
 * │ created_at       │ Time of the last write                        │
 * │ expires_at       │ NULL = never expires                          │
 * │ source           │ Producing service, default 'openai'           │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ documents                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Surrogate key                                 │
 * │ display_name     │ Original file name                            │
 * │ content_hash     │ SHA-256 of the bytes (indexed, not unique)    │
 * │ byte_size        │ Size of the raw bytes                         │
 * │ page_count       │ Pages covered by all chunks                   │
 * │ chunk_count      │ Number of external chunks                     │
 * │ chunk_handles    │ JSON array of opaque handles, chunk order     │
 * │ chunk_ranges     │ JSON array of exact page ranges, or NULL      │
 * │ processed_at     │ Ingestion time                                │
 * │ status           │ processed | failed | archived                 │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ interactions                                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Surrogate key                                 │
 * │ document_id (FK) │ → documents.id, ON DELETE CASCADE (indexed)   │
 * │ question, answer │ Text                                          │
 * │ query_tokens     │ Token estimate of the question                │
 * │ response_tokens  │ Token estimate of the answer                  │
 * │ cost_estimate    │ USD, fixed at write time                      │
 * │ created_at       │                                               │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * searches         (id, subject, timeframe, payload, deals_found, created_at)
 * telemetry_events (id, event_kind, event_payload JSON, session_token, created_at)
 * </pre>
 *
 * <h2>Expiry</h2>
 * An entry is live while {@code expires_at IS NULL OR expires_at > now}.
 * Reads filter, {@code AnalysisCache.sweepExpired()} deletes. An entry whose
 * expiry equals the current instant is therefore already expired.
 *
 * <h2>Cascades</h2>
 * Document deletes remove interactions explicitly inside the same
 * transaction; the foreign key's {@code ON DELETE CASCADE} backs this up.
 * Foreign keys are switched on for every connection.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql} and are loaded through
 * {@link de.bsommerfeld.marketscope.db.SqlLoader}. The DDL is in
 * {@code schema.sql}. Only the table-wide statements of
 * {@link de.bsommerfeld.marketscope.db.MaintenanceService} are built in code,
 * from the fixed table names of
 * {@link de.bsommerfeld.marketscope.core.domain.StoreTable}.
 */
package de.bsommerfeld.marketscope.db;
