/**
 * Service layer: feed ingestion, ensemble dispatch and the round ledger.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.resilience} - circuit breaker shared by the feed and the endpoint clients</li>
 *   <li>{@code service.stream} - resilient inbound stream connection and market state</li>
 *   <li>{@code service.ensemble} - model endpoint clients and the parallel round orchestrator</li>
 *   <li>{@code service.ledger} - hash-chained persistence of round records</li>
 *   <li>{@code service.round} - periodic round trigger</li>
 *   <li>{@code service.alert}, {@code service.health}, {@code service.metrics} - operational surface</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions) and use constructor injection.
 *
 * @see com.phillippitts.champ.service.stream.StreamManager
 * @see com.phillippitts.champ.service.ensemble.EnsembleOrchestrator
 * @see com.phillippitts.champ.service.ledger.ChainedRoundLog
 */
package com.phillippitts.champ.service;
