package com.medkg.ingestion.adapter.filelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medkg.ingestion.core.ledger.LedgerCorruptionException;
import com.medkg.ingestion.core.ledger.LedgerIOException;

import java.io.IOException;
import java.util.Map;

/**
 * 로그, 스냅샷, 인덱스가 공유하는 Jackson 매퍼.
 *
 * <p>읽기 실패는 {@link LedgerCorruptionException}, 쓰기 실패는
 * {@link LedgerIOException}으로 변환합니다.</p>
 */
final class LedgerJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private LedgerJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Object> readObject(String json, String origin) {
        try {
            Map<String, Object> value = MAPPER.readValue(json, MAP_TYPE);
            if (value == null) {
                throw new LedgerCorruptionException(origin + ": expected a JSON object but found null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new LedgerCorruptionException(origin + ": malformed JSON (" + e.getOriginalMessage() + ")", e);
        }
    }

    static Map<String, Object> readObject(byte[] json, String origin) {
        try {
            Map<String, Object> value = MAPPER.readValue(json, MAP_TYPE);
            if (value == null) {
                throw new LedgerCorruptionException(origin + ": expected a JSON object but found null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new LedgerCorruptionException(origin + ": malformed JSON (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new LedgerIOException(origin + ": cannot read", e);
        }
    }

    static String writeLine(Map<String, Object> value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LedgerIOException("Cannot serialize ledger record: " + e.getOriginalMessage(), e);
        }
    }

    static byte[] writeBytes(Map<String, Object> value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new LedgerIOException("Cannot serialize ledger document: " + e.getOriginalMessage(), e);
        }
    }
}
