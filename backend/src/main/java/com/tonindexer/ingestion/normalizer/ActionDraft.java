package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.action.ActionDetails;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Action under construction. Created by {@link BaseActionConverter}, filled by one action filler and turned into
 * an immutable {@link Action} by {@link ActionAssembler}. Never handed out of the normalizer.
 */
@Getter
@Setter
public class ActionDraft {

    @Setter(AccessLevel.NONE)
    private final String traceId;
    @Setter(AccessLevel.NONE)
    private final String actionId;
    @Setter(AccessLevel.NONE)
    private final String btype;
    private String type;
    @Setter(AccessLevel.NONE)
    private List<String> txHashes = List.of();
    private long startLt;
    private long endLt;
    private long startUtime;
    private long endUtime;
    private boolean success;
    @Setter(AccessLevel.NONE)
    private final List<String> accounts = new ArrayList<>();
    private String source;
    private String sourceSecondary;
    private String destination;
    private String destinationSecondary;
    private String asset;
    private String assetSecondary;
    private String asset2;
    private BigInteger amount;
    private BigInteger value;
    private Long opcode;
    @Setter(AccessLevel.NONE)
    private ActionDetails details;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<String> missingFields = new ArrayList<>();

    public ActionDraft(String traceId, String actionId, String btype) {
        this.traceId = traceId;
        this.actionId = actionId;
        this.btype = btype;
        this.type = btype;
    }

    void setTxHashes(List<String> txHashes) {
        this.txHashes = List.copyOf(txHashes);
    }

    void addAccount(String account) {
        accounts.add(account);
    }

    /**
     * Attach the type-specific payload. An action carries at most one.
     */
    public void setDetails(ActionDetails details) {
        if (this.details != null) {
            throw new IllegalStateException("Details already set for action " + actionId + ": "
                    + this.details.getClass().getSimpleName());
        }
        this.details = details;
    }

    /**
     * Pass-through that records {@code field} as missing when {@code value} is null.
     */
    public <T> T require(String field, T value) {
        if (value == null) {
            missingFields.add(field);
        }
        return value;
    }

    public List<String> missingFields() {
        return Collections.unmodifiableList(missingFields);
    }

    Action toAction(List<String> finalAccounts, List<String> extendedTxHashes) {
        return Action.builder()
                .traceId(traceId)
                .actionId(actionId)
                .type(type)
                .txHashes(txHashes)
                .extendedTxHashes(List.copyOf(extendedTxHashes))
                .startLt(startLt)
                .endLt(endLt)
                .startUtime(startUtime)
                .endUtime(endUtime)
                .success(success)
                .accounts(List.copyOf(finalAccounts))
                .source(source)
                .sourceSecondary(sourceSecondary)
                .destination(destination)
                .destinationSecondary(destinationSecondary)
                .asset(asset)
                .assetSecondary(assetSecondary)
                .asset2(asset2)
                .amount(amount)
                .value(value)
                .opcode(opcode)
                .details(details)
                .build();
    }
}
