package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;

import java.math.BigInteger;

/**
 * NFT item as resolved by the classifier. {@code collection} is null for standalone items.
 */
public record NftItemRef(AccountId address, BigInteger index, AccountId collection) {
}
