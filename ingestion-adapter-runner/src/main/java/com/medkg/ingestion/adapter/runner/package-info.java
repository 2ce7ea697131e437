/**
 * Runtime adapters: the streaming orchestrator and the ledger housekeeping tasks.
 *
 * <ul>
 *   <li>{@link com.medkg.ingestion.adapter.runner.StreamingIngestionRunner}: one producer
 *       thread per run feeding a bounded queue that the caller drains.</li>
 *   <li>{@link com.medkg.ingestion.adapter.runner.StuckDocumentMonitor}: periodic scan for
 *       documents that stopped moving, optionally marking them FAILED.</li>
 *   <li>{@link com.medkg.ingestion.adapter.runner.LedgerCompactor}: snapshots the ledger
 *       once its auto-snapshot interval has elapsed.</li>
 * </ul>
 *
 * <p>Scheduling of the housekeeping tasks is left to the caller, for example a
 * {@code ScheduledExecutorService} driven by {@code intervalMs()}.</p>
 */
package com.medkg.ingestion.adapter.runner;
