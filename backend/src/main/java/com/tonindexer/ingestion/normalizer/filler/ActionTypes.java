package com.tonindexer.ingestion.normalizer.filler;

/**
 * Action types that differ from the block tag they are produced from.
 */
final class ActionTypes {

    static final String STAKE_DEPOSIT = "stake_deposit";
    static final String STAKE_WITHDRAWAL_REQUEST = "stake_withdrawal_request";
    static final String STAKE_WITHDRAWAL = "stake_withdrawal";
    static final String DEX_DEPOSIT_LIQUIDITY = "dex_deposit_liquidity";

    private ActionTypes() {
    }
}
