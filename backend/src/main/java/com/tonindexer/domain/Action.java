package com.tonindexer.domain;

import com.tonindexer.domain.action.ActionDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Canonical, storage-ready record of one detected operation. Built once per block by the normalizer and never
 * mutated afterwards. {@code actionId} is content-derived, so re-processing a block yields the same document.
 */
@Document(collection = "actions")
@CompoundIndexes({
    @CompoundIndex(name = "trace_start_lt", def = "{'traceId': 1, 'startLt': 1}"),
    @CompoundIndex(name = "accounts_start_lt", def = "{'accounts': 1, 'startLt': -1}")
})
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class Action {

    @Id
    String actionId;
    @Indexed
    String traceId;
    String type;
    List<String> txHashes;
    /** {@link #txHashes} plus the initiating transaction, when there is one. */
    List<String> extendedTxHashes;
    long startLt;
    long endLt;
    long startUtime;
    long endUtime;
    boolean success;
    /** Distinct, non-null participant addresses in canonical form, sorted. */
    List<String> accounts;
    String source;
    String sourceSecondary;
    String destination;
    String destinationSecondary;
    String asset;
    String assetSecondary;
    String asset2;
    BigInteger amount;
    BigInteger value;
    Long opcode;
    ActionDetails details;

    public <T extends ActionDetails> Optional<T> detailsAs(Class<T> type) {
        return type.isInstance(details) ? Optional.of(type.cast(details)) : Optional.empty();
    }
}
