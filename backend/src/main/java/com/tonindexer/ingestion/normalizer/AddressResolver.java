package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;

/**
 * Resolves account and asset references to the canonical address string stored in actions.
 */
public final class AddressResolver {

    private AddressResolver() {
    }

    public static String resolve(AccountId account) {
        return account == null ? null : account.asString();
    }

    /**
     * Jetton master address, or null for the native coin (it has no contract).
     */
    public static String resolve(Asset asset) {
        if (asset == null || asset.isTon()) {
            return null;
        }
        return resolve(asset.jettonAddress());
    }
}
