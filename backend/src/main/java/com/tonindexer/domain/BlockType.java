package com.tonindexer.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of operation tags emitted by the classifier. Adding a tag requires a matching action filler.
 */
public enum BlockType {
    TON_TRANSFER("ton_transfer"),
    CALL_CONTRACT("call_contract"),
    CONTRACT_DEPLOY("contract_deploy"),
    JETTON_TRANSFER("jetton_transfer"),
    JETTON_BURN("jetton_burn"),
    JETTON_MINT("jetton_mint"),
    JETTON_SWAP("jetton_swap"),
    NFT_TRANSFER("nft_transfer"),
    NFT_DISCOVERY("nft_discovery"),
    NFT_MINT("nft_mint"),
    CHANGE_DNS("change_dns"),
    DELETE_DNS("delete_dns"),
    RENEW_DNS("renew_dns"),
    ELECTION_DEPOSIT("election_deposit"),
    ELECTION_RECOVER("election_recover"),
    AUCTION_BID("auction_bid"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    DEX_DEPOSIT_LIQUIDITY("dex_deposit_liquidity"),
    DEX_WITHDRAW_LIQUIDITY("dex_withdraw_liquidity"),
    DEDUST_DEPOSIT_LIQUIDITY("dedust_deposit_liquidity"),
    DEDUST_DEPOSIT_LIQUIDITY_PARTIAL("dedust_deposit_liquidity_partial"),
    TONSTAKERS_DEPOSIT("tonstakers_deposit"),
    TONSTAKERS_WITHDRAWAL_REQUEST("tonstakers_withdrawal_request"),
    TONSTAKERS_WITHDRAWAL("tonstakers_withdrawal"),
    NOMINATOR_POOL_DEPOSIT("nominator_pool_deposit"),
    NOMINATOR_POOL_WITHDRAW_REQUEST("nominator_pool_withdraw_request"),
    JVAULT_STAKE("jvault_stake"),
    JVAULT_UNSTAKE("jvault_unstake"),
    JVAULT_CLAIM("jvault_claim"),
    MULTISIG_CREATE_ORDER("multisig_create_order"),
    MULTISIG_APPROVE("multisig_approve"),
    VESTING_SEND_MESSAGE("vesting_send_message"),
    VESTING_ADD_WHITELIST("vesting_add_whitelist");

    private static final Map<String, BlockType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BlockType::tag, Function.identity()));

    private final String tag;

    BlockType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<BlockType> fromTag(String tag) {
        return tag == null ? Optional.empty() : Optional.ofNullable(BY_TAG.get(tag));
    }
}
