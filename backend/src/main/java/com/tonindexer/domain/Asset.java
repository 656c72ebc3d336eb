package com.tonindexer.domain;

/**
 * Asset moved by an operation: the native coin (no contract) or a jetton identified by its master contract.
 */
public record Asset(boolean isTon, AccountId jettonAddress) {

    public static final Asset TON = new Asset(true, null);

    public Asset {
        if (isTon && jettonAddress != null) {
            throw new IllegalArgumentException("Native asset has no jetton master");
        }
    }

    public static Asset jetton(AccountId jettonMaster) {
        return new Asset(false, jettonMaster);
    }
}
