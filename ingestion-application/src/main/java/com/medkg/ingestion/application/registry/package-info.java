/**
 * Adapter registry implementations.
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.application.registry;
