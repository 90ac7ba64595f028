/**
 * Immutable value types flowing through a round: the market context a prompt is built from,
 * per-endpoint results, and the record persisted to the chained ledger.
 */
package com.phillippitts.champ.domain;
