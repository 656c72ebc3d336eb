package com.tonindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for actions, keyed by actionId. Used by IdempotentActionStore.
 */
public interface ActionRepository extends MongoRepository<Action, String> {

    List<Action> findByTraceIdOrderByStartLtAsc(String traceId);
}
