package com.tonindexer.domain.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-specific part of an action. At most one is attached to an action; its name (JSON wrapper key and
 * Mongo type alias) identifies the payload, e.g. {@code ton_transfer_data}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TonTransferDetails.class, name = TonTransferDetails.NAME),
        @JsonSubTypes.Type(value = JettonTransferDetails.class, name = JettonTransferDetails.NAME),
        @JsonSubTypes.Type(value = NftTransferDetails.class, name = NftTransferDetails.NAME),
        @JsonSubTypes.Type(value = NftDiscoveryDetails.class, name = NftDiscoveryDetails.NAME),
        @JsonSubTypes.Type(value = NftMintDetails.class, name = NftMintDetails.NAME),
        @JsonSubTypes.Type(value = JettonSwapDetails.class, name = JettonSwapDetails.NAME),
        @JsonSubTypes.Type(value = DexDepositLiquidityDetails.class, name = DexDepositLiquidityDetails.NAME),
        @JsonSubTypes.Type(value = DexWithdrawLiquidityDetails.class, name = DexWithdrawLiquidityDetails.NAME),
        @JsonSubTypes.Type(value = JVaultStakeDetails.class, name = JVaultStakeDetails.NAME),
        @JsonSubTypes.Type(value = JVaultClaimDetails.class, name = JVaultClaimDetails.NAME),
        @JsonSubTypes.Type(value = MultisigCreateOrderDetails.class, name = MultisigCreateOrderDetails.NAME),
        @JsonSubTypes.Type(value = MultisigApproveDetails.class, name = MultisigApproveDetails.NAME),
        @JsonSubTypes.Type(value = VestingSendMessageDetails.class, name = VestingSendMessageDetails.NAME),
        @JsonSubTypes.Type(value = VestingAddWhitelistDetails.class, name = VestingAddWhitelistDetails.NAME),
        @JsonSubTypes.Type(value = ChangeDnsRecordDetails.class, name = ChangeDnsRecordDetails.NAME),
        @JsonSubTypes.Type(value = StakingDetails.class, name = StakingDetails.NAME)
})
public interface ActionDetails {
}
