package com.tonindexer.ingestion.store;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.ActionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores the actions of a trace keyed by actionId. Re-delivering the same trace rewrites identical documents;
 * actions the trace no longer produces (re-classification) are removed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdempotentActionStore {

    private final ActionRepository repository;

    public List<Action> replaceTrace(String traceId, List<Action> actions) {
        Map<String, Action> byId = new LinkedHashMap<>();
        for (Action action : actions) {
            Action previous = byId.putIfAbsent(action.getActionId(), action);
            if (previous != null) {
                log.warn("Trace {} produced action {} twice ({} and {}), keeping the first",
                        traceId, action.getActionId(), previous.getType(), action.getType());
            }
        }
        List<Action> stale = new ArrayList<>();
        for (Action existing : repository.findByTraceIdOrderByStartLtAsc(traceId)) {
            if (!byId.containsKey(existing.getActionId())) {
                stale.add(existing);
            }
        }
        if (!stale.isEmpty()) {
            log.info("Removing {} stale action(s) of trace {}", stale.size(), traceId);
            repository.deleteAll(stale);
        }
        return repository.saveAll(byId.values());
    }
}
