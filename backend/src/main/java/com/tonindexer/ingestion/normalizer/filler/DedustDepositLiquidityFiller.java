package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.DexDepositLiquidityDetails;
import com.tonindexer.domain.block.DedustDepositLiquidityData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Completed DeDust deposit, reported as a generic {@code dex_deposit_liquidity} action.
 */
@Component
public class DedustDepositLiquidityFiller implements ActionFiller<DedustDepositLiquidityData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEDUST_DEPOSIT_LIQUIDITY);
    }

    @Override
    public Class<DedustDepositLiquidityData> dataType() {
        return DedustDepositLiquidityData.class;
    }

    @Override
    public void fill(DedustDepositLiquidityData data, ActionDraft draft) {
        draft.setType(ActionTypes.DEX_DEPOSIT_LIQUIDITY);
        draft.setSource(resolve(data.sender()));
        draft.setDestination(resolve(data.poolAddress()));
        draft.setDestinationSecondary(resolve(data.depositContract()));
        draft.setDetails(details(data, data.lpTokensMinted()));
    }

    static DexDepositLiquidityDetails details(DedustDepositLiquidityData data, BigInteger lpTokensMinted) {
        return new DexDepositLiquidityDetails(
                data.dex(),
                data.amount1(),
                data.amount2(),
                resolve(data.asset1()),
                resolve(data.asset2()),
                resolve(data.userJettonWallet1()),
                resolve(data.userJettonWallet2()),
                lpTokensMinted);
    }
}
