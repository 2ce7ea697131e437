package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.model.Document;

/**
 * 스트리밍 수집 오케스트레이터.
 *
 * <p>어댑터 결과 스트림을 유계 큐를 통해 소비자에게 이벤트로 전달합니다.
 * 큐가 가득 차면 생산자가 대기하며(backpressure), 대기 시간은
 * {@code BatchProgress.backpressureWaitSeconds}로 보고됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * streamEvents(request)
 *   ↓ (알 수 없는 소스면 즉시 IllegalArgumentException)
 * 생산자 스레드:
 *   1. HttpTransport, Adapter 획득
 *   2. 호출마다 adapter.iterResults(params, resume)
 *      - completedIds에 있으면 건너뜀
 *      - DocumentStarted → DocumentCompleted
 *      - progressInterval마다 BatchProgress, checkpointInterval마다 체크포인트
 *   3. 어댑터 오류 → DocumentFailed + AdapterStateChange(FAILED) 후 종료
 *   4. 종료 시 마지막 체크포인트, 자원 해제
 * 소비자:
 *   EventStream 반복 (close() 시 생산자 취소)
 * </pre>
 *
 * <p><strong>전달 보장:</strong> at-least-once. 소비자가 체크포인트의 문서 ID를 저장해
 * 다음 실행의 {@code completedIds}로 넘겨 중복을 제거합니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface StreamingOrchestrator {

    /**
     * 이벤트 스트림 시작.
     *
     * @param request 수집 요청
     * @return 이벤트 스트림 (반드시 닫아야 함)
     * @throws IllegalArgumentException 소스가 등록되지 않은 경우
     */
    EventStream streamEvents(StreamRequest request);

    /**
     * 스트림을 끝까지 소비하고 결과를 모아 반환.
     *
     * @param request 수집 요청
     * @return 실행 결과
     * @throws IllegalArgumentException 소스가 등록되지 않은 경우
     */
    PipelineRunResult run(StreamRequest request);

    /**
     * 완료된 문서만 지연 스트림으로 반환.
     *
     * @param request 수집 요청
     * @return 문서 스트림 (반드시 닫아야 함)
     * @throws IllegalArgumentException 소스가 등록되지 않은 경우
     */
    ResultStream<Document> iterResults(StreamRequest request);
}
