package com.tonindexer.ingestion.normalizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingNormalizationDiagnostics implements NormalizationDiagnostics {

    @Override
    public void unknownBlockType(String btype, String traceId) {
        log.warn("Unknown block type {} for trace {}", btype, traceId);
    }

    @Override
    public void unusablePayload(String btype, String payloadType, String traceId) {
        log.warn("Block {} in trace {} has unusable payload {}", btype, traceId, payloadType);
    }

    @Override
    public void missingField(String btype, String field, String traceId, String actionId) {
        log.warn("Block {} missing {} (trace {}, action {})", btype, field, traceId, actionId);
    }

    @Override
    public void initiatorAccountAdded(String initiatorTxHash, String account, String traceId, String actionId) {
        log.info("Initiating transaction ({}) account {} not in accounts. Trace id: {}. Action id: {}",
                initiatorTxHash, account, traceId, actionId);
    }

    @Override
    public void fillerFailed(String btype, String traceId, RuntimeException cause) {
        log.warn("Failed to fill {} action for trace {}, keeping base fields: {}", btype, traceId, cause.getMessage(), cause);
    }
}
