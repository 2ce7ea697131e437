/**
 * Contract test support for the ingestion ledger and streaming orchestrator.
 *
 * <p>Extend {@link com.medkg.ingestion.testkit.contract.AbstractContractTest} to run scenarios
 * against a real durable ledger and runner with scripted adapters.</p>
 */
package com.medkg.ingestion.testkit.contract;
