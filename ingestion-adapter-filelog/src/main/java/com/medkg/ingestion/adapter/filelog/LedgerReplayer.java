package com.medkg.ingestion.adapter.filelog;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.InvalidStateTransitionException;
import com.medkg.ingestion.core.ledger.LedgerAuditRecord;
import com.medkg.ingestion.core.ledger.LedgerCorruptionException;
import com.medkg.ingestion.core.ledger.LedgerIOException;
import com.medkg.ingestion.core.statemachine.StateTransition;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 스냅샷 기준선 위에 로그를 재생하는 순수 fold.
 *
 * <p><strong>재생 규칙:</strong></p>
 * <ul>
 *   <li>처음 보는 문서: old == new인 시드 레코드는 그대로 수용, 그 외에는 old → new 전이 검증</li>
 *   <li>이미 본 문서: 레코드의 old가 현재 상태와 같아야 하고 old → new 전이가 허용되어야 함</li>
 *   <li>빈 줄은 무시, 읽을 수 없는 줄은 줄 번호와 함께 {@link LedgerCorruptionException}</li>
 * </ul>
 *
 * <p>같은 입력에 대해 항상 같은 결과를 만들며, 파일을 수정하지 않습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class LedgerReplayer {

    // Utility class - prevent instantiation
    private LedgerReplayer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 재생 결과.
     *
     * @param entries 문서별 최종 엔트리
     * @param history 문서별 재생된 레코드 (기록 순)
     * @param recordCount 재생된 레코드 수
     */
    public record Result(
        Map<String, DocumentLedgerEntry> entries,
        Map<String, List<LedgerAuditRecord>> history,
        long recordCount
    ) {
    }

    /**
     * 기준선 위에 로그의 {@code offset} 바이트 이후를 재생.
     *
     * @param baseline 스냅샷에서 읽은 엔트리 (없으면 빈 Map)
     * @param logPath 로그 파일 (없으면 기준선만 반환)
     * @param offset 건너뛸 바이트 수
     * @return 재생 결과 (entries와 history는 호출자가 소유하는 가변 Map)
     * @throws LedgerCorruptionException 손상되었거나 모순된 레코드가 있는 경우
     */
    public static Result replay(Map<String, DocumentLedgerEntry> baseline, Path logPath, long offset) {
        Map<String, DocumentLedgerEntry> entries = new HashMap<>(baseline);
        Map<String, List<LedgerAuditRecord>> history = new HashMap<>();
        if (logPath == null || !Files.exists(logPath)) {
            return new Result(entries, history, 0);
        }

        long count = 0;
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.READ)) {
            channel.position(offset);
            BufferedReader reader = new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8));
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String origin = logPath + " line " + lineNumber;
                LedgerAuditRecord record = decodeLine(line, origin);
                apply(entries, record, origin);
                history.computeIfAbsent(record.docId(), id -> new ArrayList<>()).add(record);
                count++;
            }
        } catch (IOException e) {
            throw new LedgerIOException("Cannot read ledger log " + logPath, e);
        }
        return new Result(entries, history, count);
    }

    /**
     * 스냅샷과 델타 로그로부터 상태 Map을 복원 (부수 효과 없음).
     *
     * @param snapshotPath 스냅샷 파일 (null이면 빈 기준선)
     * @param deltaPath 스냅샷 이후의 로그 (null이거나 없으면 재생하지 않음)
     * @return 문서별 엔트리 (변경 불가)
     */
    public static Map<String, DocumentLedgerEntry> loadWithCompaction(Path snapshotPath, Path deltaPath) {
        Map<String, DocumentLedgerEntry> baseline = snapshotPath == null
            ? Map.of()
            : SnapshotCodec.read(snapshotPath).entries();
        return Collections.unmodifiableMap(replay(baseline, deltaPath, 0).entries());
    }

    static LedgerAuditRecord decodeLine(String line, String origin) {
        try {
            return LedgerAuditRecord.fromMap(LedgerJson.readObject(line, origin));
        } catch (LedgerCorruptionException e) {
            throw e.getMessage().startsWith(origin) ? e : new LedgerCorruptionException(origin + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new LedgerCorruptionException(origin + ": " + e.getMessage(), e);
        }
    }

    static void apply(Map<String, DocumentLedgerEntry> entries, LedgerAuditRecord record, String origin) {
        DocumentLedgerEntry current = entries.get(record.docId());
        if (current == null) {
            if (record.oldState() != record.newState()) {
                validate(record, origin);
            }
        } else {
            if (current.state() != record.oldState()) {
                throw new LedgerCorruptionException(String.format(
                    "%s: record for %s starts from %s but ledger state is %s",
                    origin, record.docId(), record.oldState(), current.state()
                ));
            }
            validate(record, origin);
        }
        entries.put(record.docId(), DocumentLedgerEntry.apply(current, record));
    }

    private static void validate(LedgerAuditRecord record, String origin) {
        try {
            StateTransition.validate(record.oldState(), record.newState());
        } catch (InvalidStateTransitionException e) {
            throw new LedgerCorruptionException(origin + ": " + record.docId() + " " + e.getMessage(), e);
        }
    }
}
