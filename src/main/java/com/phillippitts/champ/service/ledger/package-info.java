/**
 * Append-only, hash-chained persistence of round records.
 *
 * <h2>Entry format</h2>
 * <p>Each {@link com.phillippitts.champ.domain.RoundRecord RoundRecord} is serialized by
 * {@link com.phillippitts.champ.service.ledger.CanonicalJson CanonicalJson} (snake_case keys, sorted
 * properties and map keys, ISO-8601 instants). The lowercase hex SHA-256 of those bytes is the
 * content hash, and the entry is written to {@code <data-root>/<content-hash>.json}.</p>
 *
 * <h2>Chain</h2>
 * <pre>
 * root_0 = ""
 * root_n = sha256_hex(root_{n-1} + content_hash_n)
 * </pre>
 * <p>The root only advances after the entry is on disk. A failed write surfaces as
 * {@link com.phillippitts.champ.exception.LedgerException LedgerException} and leaves the root
 * unchanged. {@link com.phillippitts.champ.service.ledger.ChainedRoundLog#replay ChainedRoundLog.replay}
 * recomputes a root from entries in write order.</p>
 *
 * <h2>Retention</h2>
 * <p>At most {@code archive-cap} entries are kept. Every write stamps a strictly increasing
 * modification time; the oldest entries by (modification time, name) are evicted first. Eviction
 * never rewrites the root: the chain covers every round ever logged, not only the retained ones.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code logRound} is serialized on the log instance. Identical records map to the same file,
 * so re-logging one rewrites its entry and still advances the root.</p>
 *
 * @see com.phillippitts.champ.service.ledger.ArchiveManager
 */
package com.phillippitts.champ.service.ledger;
