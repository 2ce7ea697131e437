package com.medkg.ingestion.adapter.filelog;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.LedgerAuditRecord;
import com.medkg.ingestion.core.ledger.LedgerCorruptionException;
import com.medkg.ingestion.core.ledger.LedgerIOException;
import com.medkg.ingestion.core.statemachine.StateAliases;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 스냅샷 파일 인코딩/디코딩.
 *
 * <p><strong>파일 형식:</strong></p>
 * <pre>
 * {
 *   "version": "1.0",
 *   "created_at": 1700000000.0,
 *   "document_count": 2,
 *   "cut": {"timestamp": 1700000000.0, "log_offset": 4096},
 *   "states": {
 *     "doc-1": {"state": "COMPLETED", "updated_at": ..., "adapter": ..., "metadata": {...}, "retry_count": 0}
 *   }
 * }
 * </pre>
 *
 * <p>파일 이름은 {@code snapshot-<10자리 순번>-<UTC 시각>.json}이며 순번 순서가 생성 순서입니다.</p>
 */
final class SnapshotCodec {

    static final String VERSION = "1.0";

    private static final Pattern FILE_NAME = Pattern.compile("snapshot-(\\d{10})-[0-9TZ]+\\.json");
    private static final DateTimeFormatter NAME_TIME =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private SnapshotCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 디코딩된 스냅샷.
     *
     * @param createdAt 생성 시각
     * @param logOffset 생성 시점의 로그 크기
     * @param entries 문서별 엔트리
     */
    record Snapshot(Instant createdAt, long logOffset, Map<String, DocumentLedgerEntry> entries) {
    }

    static Path write(
        Path directory,
        Instant createdAt,
        long logOffset,
        Collection<DocumentLedgerEntry> entries,
        boolean fsync
    ) {
        try {
            Files.createDirectories(directory);
            String fileName = String.format("snapshot-%010d-%s.json", nextSequence(directory), NAME_TIME.format(createdAt));
            Path target = directory.resolve(fileName);
            AtomicFiles.write(target, LedgerJson.writeBytes(encode(createdAt, logOffset, entries)), fsync);
            return target;
        } catch (IOException e) {
            throw new LedgerIOException("Cannot write snapshot in " + directory, e);
        }
    }

    static Snapshot read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new LedgerCorruptionException("Snapshot referenced by index does not exist: " + file, e);
        } catch (IOException e) {
            throw new LedgerIOException("Cannot read snapshot " + file, e);
        }
        return decode(LedgerJson.readObject(bytes, "snapshot " + file), file.toString());
    }

    /**
     * 디렉터리의 스냅샷 파일 목록 (오래된 순).
     */
    static List<Path> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> snapshots = new ArrayList<>();
            files.filter(path -> FILE_NAME.matcher(path.getFileName().toString()).matches())
                .forEach(snapshots::add);
            snapshots.sort(Comparator.comparingLong(SnapshotCodec::sequenceOf));
            return snapshots;
        } catch (IOException e) {
            throw new LedgerIOException("Cannot list snapshots in " + directory, e);
        }
    }

    static long sequenceOf(Path file) {
        Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a snapshot file: " + file);
        }
        return Long.parseLong(matcher.group(1));
    }

    private static long nextSequence(Path directory) {
        List<Path> existing = list(directory);
        return existing.isEmpty() ? 1 : sequenceOf(existing.get(existing.size() - 1)) + 1;
    }

    static Map<String, Object> encode(Instant createdAt, long logOffset, Collection<DocumentLedgerEntry> entries) {
        double created = LedgerAuditRecord.toEpochSeconds(createdAt);

        Map<String, Object> cut = new LinkedHashMap<>();
        cut.put("timestamp", created);
        cut.put("log_offset", logOffset);

        Map<String, Object> states = new LinkedHashMap<>();
        for (DocumentLedgerEntry entry : entries) {
            Map<String, Object> state = new LinkedHashMap<>();
            state.put("state", entry.state().name());
            state.put("updated_at", LedgerAuditRecord.toEpochSeconds(entry.updatedAt()));
            state.put("adapter", entry.adapter());
            state.put("metadata", entry.metadata());
            state.put("retry_count", entry.retryCount());
            states.put(entry.docId(), state);
        }

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("version", VERSION);
        snapshot.put("created_at", created);
        snapshot.put("document_count", entries.size());
        snapshot.put("cut", cut);
        snapshot.put("states", states);
        return snapshot;
    }

    @SuppressWarnings("unchecked")
    static Snapshot decode(Map<String, Object> map, String origin) {
        if (!VERSION.equals(map.get("version"))) {
            throw new LedgerCorruptionException(origin + ": unsupported snapshot version " + map.get("version"));
        }
        if (!(map.get("states") instanceof Map)) {
            throw new LedgerCorruptionException(origin + ": missing states object");
        }
        Instant createdAt = map.get("created_at") instanceof Number n
            ? LedgerAuditRecord.toInstant(n.doubleValue())
            : Instant.EPOCH;
        long logOffset = 0;
        if (map.get("cut") instanceof Map) {
            Object offset = ((Map<String, Object>) map.get("cut")).get("log_offset");
            if (offset instanceof Number n) {
                logOffset = n.longValue();
            }
        }

        Map<String, DocumentLedgerEntry> entries = new HashMap<>();
        for (Map.Entry<String, Object> item : ((Map<String, Object>) map.get("states")).entrySet()) {
            if (!(item.getValue() instanceof Map)) {
                throw new LedgerCorruptionException(origin + ": state of " + item.getKey() + " is not an object");
            }
            Map<String, Object> state = (Map<String, Object>) item.getValue();
            if (!(state.get("updated_at") instanceof Number updatedAt)) {
                throw new LedgerCorruptionException(origin + ": state of " + item.getKey() + " has no updated_at");
            }
            Object metadata = state.get("metadata");
            Object adapter = state.get("adapter");
            entries.put(item.getKey(), new DocumentLedgerEntry(
                item.getKey(),
                StateAliases.decode(state.get("state") == null ? null : state.get("state").toString(), null),
                LedgerAuditRecord.toInstant(updatedAt.doubleValue()),
                adapter == null ? null : adapter.toString(),
                metadata instanceof Map ? (Map<String, Object>) metadata : Map.of(),
                state.get("retry_count") instanceof Number n ? n.intValue() : 0
            ));
        }
        return new Snapshot(createdAt, logOffset, Collections.unmodifiableMap(entries));
    }
}
