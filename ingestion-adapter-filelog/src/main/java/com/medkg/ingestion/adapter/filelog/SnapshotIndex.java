package com.medkg.ingestion.adapter.filelog;

import com.medkg.ingestion.core.ledger.LedgerAuditRecord;
import com.medkg.ingestion.core.ledger.LedgerCorruptionException;
import com.medkg.ingestion.core.ledger.LedgerIOException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 현재 스냅샷을 가리키는 인덱스 파일.
 *
 * <p>인덱스가 유일한 권위입니다. 인덱스가 가리키지 않는 스냅샷 파일은
 * 중단된 스냅샷으로 간주되어 무시됩니다.</p>
 *
 * <p><strong>커밋 순서 (createSnapshot):</strong></p>
 * <pre>
 * 1. snapshot-N.json 기록 (임시 파일 + 원자적 이동)
 * 2. index = {snapshot-N, log_offset = 현재 로그 크기}
 * 3. 로그 truncate
 * 4. index = {snapshot-N, log_offset = 0}
 * </pre>
 *
 * <p>2와 4 사이에 중단되면 로그 앞부분 {@code log_offset} 바이트는 스냅샷에 이미
 * 반영된 것이므로 건너뜁니다. 3 이후 4 이전에 중단되면 로그가 offset보다 짧으므로
 * offset을 0으로 보고 인덱스를 다시 커밋합니다.</p>
 *
 * @param snapshot 스냅샷 파일 이름 (스냅샷 디렉터리 기준)
 * @param logOffset 스냅샷에 이미 반영된 로그 바이트 수
 * @param committedAt 커밋 시각
 */
record SnapshotIndex(String snapshot, long logOffset, Instant committedAt) {

    SnapshotIndex {
        if (snapshot == null || snapshot.isBlank()) {
            throw new IllegalArgumentException("snapshot cannot be null or blank");
        }
        if (logOffset < 0) {
            throw new IllegalArgumentException("logOffset must be non-negative (current: " + logOffset + ")");
        }
    }

    SnapshotIndex withLogOffset(long logOffset, Instant committedAt) {
        return new SnapshotIndex(snapshot, logOffset, committedAt);
    }

    static Optional<SnapshotIndex> read(Path indexPath) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(indexPath);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new LedgerIOException("Cannot read snapshot index " + indexPath, e);
        }
        Map<String, Object> map = LedgerJson.readObject(bytes, "snapshot index " + indexPath);
        Object snapshot = map.get("snapshot");
        Object offset = map.get("log_offset");
        if (!(snapshot instanceof String) || !(offset instanceof Number)) {
            throw new LedgerCorruptionException("snapshot index " + indexPath + " is missing snapshot or log_offset");
        }
        Object committed = map.get("committed_at");
        Instant committedAt = committed instanceof Number n
            ? LedgerAuditRecord.toInstant(n.doubleValue())
            : Instant.EPOCH;
        return Optional.of(new SnapshotIndex((String) snapshot, ((Number) offset).longValue(), committedAt));
    }

    void write(Path indexPath, boolean fsync) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("snapshot", snapshot);
        map.put("log_offset", logOffset);
        map.put("committed_at", LedgerAuditRecord.toEpochSeconds(committedAt));
        try {
            AtomicFiles.write(indexPath, LedgerJson.writeBytes(map), fsync);
        } catch (IOException e) {
            throw new LedgerIOException("Cannot write snapshot index " + indexPath, e);
        }
    }
}
