package com.tonindexer.ingestion.normalizer;

/**
 * Sink for non-fatal findings while normalizing blocks. None of these stop normalization; the affected action is
 * still produced with whatever could be filled.
 */
public interface NormalizationDiagnostics {

    /** Tag outside {@link com.tonindexer.domain.BlockType}; the action keeps only base fields. */
    void unknownBlockType(String btype, String traceId);

    /** Known tag but the payload is missing or of another operation's shape; base fields only. */
    void unusablePayload(String btype, String payloadType, String traceId);

    /** A field the operation normally carries was absent and left null. */
    void missingField(String btype, String field, String traceId, String actionId);

    /** The initiating transaction's account was not among the action's accounts (possible classification gap). */
    void initiatorAccountAdded(String initiatorTxHash, String account, String traceId, String actionId);

    /** A filler failed unexpectedly; the action keeps only base fields. */
    void fillerFailed(String btype, String traceId, RuntimeException cause);
}
