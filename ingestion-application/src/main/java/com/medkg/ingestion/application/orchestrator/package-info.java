/**
 * Streaming orchestrator ports.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.medkg.ingestion.application.orchestrator.StreamingOrchestrator} - 수집 실행 진입점</li>
 *   <li>{@link com.medkg.ingestion.application.orchestrator.EventStream} - 닫을 수 있는 이벤트 스트림</li>
 *   <li>{@link com.medkg.ingestion.application.orchestrator.StreamRequest} - 요청 파라미터</li>
 *   <li>{@link com.medkg.ingestion.application.orchestrator.StreamConfig} - 큐와 진행률 설정</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code StreamingIngestionRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.medkg.ingestion.application.orchestrator;
