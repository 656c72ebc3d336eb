package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.VestingAddWhitelistDetails;
import com.tonindexer.domain.block.VestingAddWhitelistData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import com.tonindexer.ingestion.normalizer.AddressResolver;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class VestingAddWhitelistFiller implements ActionFiller<VestingAddWhitelistData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.VESTING_ADD_WHITELIST);
    }

    @Override
    public Class<VestingAddWhitelistData> dataType() {
        return VestingAddWhitelistData.class;
    }

    @Override
    public void fill(VestingAddWhitelistData data, ActionDraft draft) {
        draft.setSource(resolve(data.adder()));
        draft.setDestination(resolve(data.vesting()));
        List<AccountId> added = data.accountsAdded() != null ? data.accountsAdded() : List.of();
        draft.setDetails(new VestingAddWhitelistDetails(
                data.queryId(),
                added.stream().map(AddressResolver::resolve).collect(Collectors.toList())));
    }
}
