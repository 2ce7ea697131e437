/**
 * Value types exchanged between adapters and the orchestrator.
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.model;
