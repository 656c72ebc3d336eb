package com.tonindexer.ingestion.normalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics sink that keeps every finding as a readable line, for assertions.
 */
public class RecordingDiagnostics implements NormalizationDiagnostics {

    private final List<String> events = new ArrayList<>();

    public List<String> events() {
        return events;
    }

    @Override
    public void unknownBlockType(String btype, String traceId) {
        events.add("unknown:" + btype + ":" + traceId);
    }

    @Override
    public void unusablePayload(String btype, String payloadType, String traceId) {
        events.add("unusable:" + btype + ":" + payloadType);
    }

    @Override
    public void missingField(String btype, String field, String traceId, String actionId) {
        events.add("missing:" + btype + ":" + field);
    }

    @Override
    public void initiatorAccountAdded(String initiatorTxHash, String account, String traceId, String actionId) {
        events.add("initiator:" + initiatorTxHash + ":" + account);
    }

    @Override
    public void fillerFailed(String btype, String traceId, RuntimeException cause) {
        events.add("failed:" + btype + ":" + cause.getMessage());
    }
}
