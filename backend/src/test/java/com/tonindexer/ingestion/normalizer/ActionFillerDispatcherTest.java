package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.ElectionStakeData;
import com.tonindexer.domain.block.PoolDepositData;
import com.tonindexer.domain.block.TonTransferData;
import com.tonindexer.ingestion.normalizer.filler.ActionFiller;
import com.tonindexer.ingestion.normalizer.filler.ElectionStakeFiller;
import com.tonindexer.ingestion.normalizer.filler.TonTransferFiller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionFillerDispatcherTest {

    private final ActionFillerDispatcher dispatcher = new ActionFillerDispatcher(ActionFillerFixtures.allFillers());

    @Test
    @DisplayName("every block type has exactly one filler")
    void exhaustive() {
        for (BlockType type : BlockType.values()) {
            assertThat(dispatcher.fillerFor(type)).as(type.tag()).isNotNull();
            assertThat(dispatcher.fillerFor(type).blockTypes()).contains(type);
        }
    }

    @Test
    @DisplayName("missing filler fails at construction")
    void missingFiller() {
        List<ActionFiller<?>> fillers = new ArrayList<>(ActionFillerFixtures.allFillers());
        fillers.removeIf(f -> f instanceof ElectionStakeFiller);

        assertThatThrownBy(() -> new ActionFillerDispatcher(fillers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ELECTION_DEPOSIT")
                .hasMessageContaining("ELECTION_RECOVER");
    }

    @Test
    @DisplayName("two fillers for one type fail at construction")
    void duplicateFiller() {
        List<ActionFiller<?>> fillers = new ArrayList<>(ActionFillerFixtures.allFillers());
        fillers.add(new TonTransferFiller());

        assertThatThrownBy(() -> new ActionFillerDispatcher(fillers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TON_TRANSFER");
    }

    @Test
    @DisplayName("payload of another operation is rejected without touching the draft")
    void mismatchedPayload() {
        ActionDraft draft = Blocks.draft("ton_transfer");

        boolean filled = dispatcher.fill(BlockType.TON_TRANSFER,
                new PoolDepositData(Blocks.account(1), Blocks.account(2), BigInteger.ONE), draft);

        assertThat(filled).isFalse();
        assertThat(draft.getSource()).isNull();
        assertThat(draft.getAmount()).isNull();
    }

    @Test
    @DisplayName("null payload is rejected")
    void nullPayload() {
        assertThat(dispatcher.fill(BlockType.JETTON_BURN, null, Blocks.draft("jetton_burn"))).isFalse();
    }

    @Test
    @DisplayName("payload declaring the type but of another class is rejected")
    void foreignPayloadClass() {
        BlockData impostor = () -> Set.of(BlockType.ELECTION_DEPOSIT);

        assertThat(dispatcher.fill(BlockType.ELECTION_DEPOSIT, impostor, Blocks.draft("election_deposit"))).isFalse();
    }

    @Test
    @DisplayName("shared payload shape fills either of its types")
    void sharedShape() {
        ActionDraft draft = Blocks.draft("election_recover");

        boolean filled = dispatcher.fill(BlockType.ELECTION_RECOVER,
                new ElectionStakeData(Blocks.account(4), BigInteger.TEN), draft);

        assertThat(filled).isTrue();
        assertThat(draft.getSource()).isEqualTo(Blocks.address(4));
        assertThat(draft.getAmount()).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("valid payload reaches its filler")
    void dispatches() {
        ActionDraft draft = Blocks.draft("ton_transfer");

        assertThat(dispatcher.fill(BlockType.TON_TRANSFER,
                new TonTransferData(Blocks.account(1), Blocks.account(2), BigInteger.TWO, null, false), draft)).isTrue();
        assertThat(draft.getValue()).isEqualTo(BigInteger.TWO);
    }
}
