package com.medkg.ingestion.application.orchestrator;

/**
 * 스트리밍 수집 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>bufferSize: 생산자와 소비자 사이 이벤트 큐 용량 (기본 100)</li>
 *   <li>progressInterval: 가벼운 진행률 이벤트 주기, 완료 문서 수 기준 (기본 100)</li>
 *   <li>checkpointInterval: 체크포인트 이벤트 주기, 완료 문서 수 기준 (기본 1000)</li>
 * </ul>
 *
 * <p>스트림 종료 시에는 주기와 무관하게 마지막 체크포인트가 항상 만들어집니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param bufferSize 큐 용량 (1 이상)
 * @param progressInterval 진행률 주기 (1 이상)
 * @param checkpointInterval 체크포인트 주기 (1 이상)
 */
public record StreamConfig(
    int bufferSize,
    int progressInterval,
    int checkpointInterval
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: bufferSize=100, progressInterval=100, checkpointInterval=1000</p>
     */
    public StreamConfig() {
        this(100, 100, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StreamConfig {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive (current: " + bufferSize + ")");
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive (current: " + progressInterval + ")");
        }
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be positive (current: " + checkpointInterval + ")");
        }
    }

    /**
     * bufferSize만 변경한 새 인스턴스 생성.
     */
    public StreamConfig withBufferSize(int bufferSize) {
        return new StreamConfig(bufferSize, progressInterval, checkpointInterval);
    }

    /**
     * progressInterval만 변경한 새 인스턴스 생성.
     */
    public StreamConfig withProgressInterval(int progressInterval) {
        return new StreamConfig(bufferSize, progressInterval, checkpointInterval);
    }

    /**
     * checkpointInterval만 변경한 새 인스턴스 생성.
     */
    public StreamConfig withCheckpointInterval(int checkpointInterval) {
        return new StreamConfig(bufferSize, progressInterval, checkpointInterval);
    }
}
