package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.Block;
import com.tonindexer.domain.EventNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tonindexer.ingestion.normalizer.Blocks.account;
import static com.tonindexer.ingestion.normalizer.Blocks.address;
import static com.tonindexer.ingestion.normalizer.Blocks.block;
import static com.tonindexer.ingestion.normalizer.Blocks.node;
import static com.tonindexer.ingestion.normalizer.Blocks.tickTock;
import static org.assertj.core.api.Assertions.assertThat;

class ActionAssemblerTest {

    private RecordingDiagnostics diagnostics;
    private BaseActionConverter converter;
    private ActionAssembler assembler;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        converter = new BaseActionConverter(new ActionIdCalculator());
        assembler = new ActionAssembler(diagnostics);
    }

    @Test
    @DisplayName("source, destination and their secondaries join the accounts once")
    void addressFieldsJoinAccounts() {
        Block b = block("jetton_transfer", null, List.of(node(100, "tx-1", account(1), "m1")));
        ActionDraft draft = converter.convert(b, "trace-1");
        draft.setSource(address(3));
        draft.setSourceSecondary(address(1));
        draft.setDestination(address(2));

        Action action = assembler.assemble(draft, b);

        assertThat(action.getAccounts()).containsExactly(address(1), address(2), address(3));
        assertThat(action.getExtendedTxHashes()).containsExactly("tx-1");
        assertThat(diagnostics.events()).isEmpty();
    }

    @Test
    @DisplayName("initiator outside the block adds its hash and account and is reported")
    void initiatorOutsideBlock() {
        EventNode initiator = node(90, "tx-0", account(9), "m0");
        Block b = block("ton_transfer", null, List.of(node(100, "tx-1", account(1), "m1")), initiator);

        Action action = assembler.assemble(converter.convert(b, "trace-1"), b);

        assertThat(action.getTxHashes()).containsExactly("tx-1");
        assertThat(action.getExtendedTxHashes()).containsExactly("tx-0", "tx-1");
        assertThat(action.getAccounts()).containsExactly(address(1), address(9));
        assertThat(diagnostics.events()).containsExactly("initiator:tx-0:" + address(9));
    }

    @Test
    @DisplayName("initiator already among accounts is not reported")
    void initiatorInsideBlock() {
        EventNode initiator = node(100, "tx-1", account(1), "m1");
        Block b = block("ton_transfer", null, List.of(initiator), initiator);

        Action action = assembler.assemble(converter.convert(b, "trace-1"), b);

        assertThat(action.getExtendedTxHashes()).containsExactly("tx-1");
        assertThat(action.getAccounts()).containsExactly(address(1));
        assertThat(diagnostics.events()).isEmpty();
    }

    @Test
    @DisplayName("tick-tock initiator contributes its hash but never its account")
    void tickTockInitiator() {
        EventNode initiator = tickTock(50, "tx-tick", account(7));
        Block b = block("call_contract", null, List.of(node(100, "tx-1", account(1), "m1")), initiator);

        Action action = assembler.assemble(converter.convert(b, "trace-1"), b);

        assertThat(action.getExtendedTxHashes()).containsExactly("tx-1", "tx-tick");
        assertThat(action.getAccounts()).containsExactly(address(1));
        assertThat(diagnostics.events()).isEmpty();
    }

    @Test
    @DisplayName("extended hashes always contain the block hashes")
    void extendedIsSuperset() {
        Block b = block("ton_transfer", null, List.of(
                node(100, "tx-2", account(1), "m1"),
                node(101, "tx-1", account(2), "m2")), node(99, "tx-2", account(1), "m1"));

        Action action = assembler.assemble(converter.convert(b, "trace-1"), b);

        assertThat(action.getExtendedTxHashes()).containsAll(action.getTxHashes()).doesNotHaveDuplicates();
    }
}
