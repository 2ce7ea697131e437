/**
 * Ledger state machine package.
 *
 * <p>This package defines the closed set of document processing stages and the
 * single edge table that every ledger write and every log replay is validated against.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.medkg.ingestion.core.statemachine.LedgerState} - Document processing stages (enum)</li>
 *   <li>{@link com.medkg.ingestion.core.statemachine.StateTransition} - Edge table, validation and execution</li>
 *   <li>{@link com.medkg.ingestion.core.statemachine.StateAliases} - Legacy label decoding</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * LedgerState state = LedgerState.PENDING;
 * state = StateTransition.transition(state, LedgerState.FETCHING);
 * state = StateTransition.transition(state, LedgerState.FETCHED);
 *
 * // This will throw InvalidStateTransitionException
 * StateTransition.validate(LedgerState.COMPLETED, LedgerState.FETCHING);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Single source of truth:</strong> the edge table is never duplicated elsewhere</li>
 *   <li><strong>No implicit no-ops:</strong> X → X is legal only where the table lists it</li>
 *   <li><strong>Fail-Fast:</strong> invalid transitions throw immediately</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.statemachine;
