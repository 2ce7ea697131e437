/**
 * Housekeeping runtime port.
 *
 * <p>이 패키지는 Ledger 유지보수 작업을 위한 {@link com.medkg.ingestion.application.runtime.HousekeepingTask}
 * 인터페이스를 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.medkg.ingestion.application.runtime;
