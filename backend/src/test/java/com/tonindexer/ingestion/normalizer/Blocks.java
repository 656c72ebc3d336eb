package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Block;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.EventNode;
import com.tonindexer.domain.InboundMessage;

import java.util.List;

/**
 * Test fixtures for blocks and event nodes.
 */
public final class Blocks {

    private Blocks() {
    }

    /** Account {@code 0:NNNN…} whose hash repeats the hex digit {@code n}. */
    public static AccountId account(int n) {
        return new AccountId(0, String.valueOf(Character.forDigit(n, 16)).repeat(64));
    }

    public static String address(int n) {
        return account(n).asString();
    }

    public static EventNode node(long lt, String txHash, AccountId account, String msgHash) {
        return new EventNode(lt, txHash, account, new InboundMessage(msgHash, lt - 1));
    }

    public static EventNode tickTock(long lt, String txHash, AccountId account) {
        return new EventNode(lt, txHash, account, null);
    }

    public static Block block(String btype, BlockData data, List<EventNode> nodes) {
        return block(btype, data, nodes, null);
    }

    public static Block block(String btype, BlockData data, List<EventNode> nodes, EventNode initiator) {
        long minLt = nodes.stream().mapToLong(EventNode::lt).min().orElse(0);
        long maxLt = nodes.stream().mapToLong(EventNode::lt).max().orElse(0);
        return new Block(btype, nodes, data, minLt, maxLt, 1_700_000_000L, 1_700_000_005L, false, initiator);
    }

    public static Block simpleBlock(String btype, BlockData data) {
        return block(btype, data, List.of(node(100, "tx-1", account(1), "inmsg-1")));
    }

    public static ActionDraft draft(String btype) {
        return new ActionDraft("trace-1", "action-1", btype);
    }
}
