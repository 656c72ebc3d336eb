package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Block;
import com.tonindexer.domain.EventNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Comparator;

/**
 * Derives the action id from block content: base64(sha256(rootKey + btype)).
 * The root node is the one with the lowest lt; equal lts are ordered by transaction hash. Its inbound message hash
 * is the root key, or the transaction hash for tick-tock nodes.
 */
@Component
public class ActionIdCalculator {

    static final Comparator<EventNode> ROOT_ORDER = Comparator
            .comparingLong(EventNode::lt)
            .thenComparing(n -> nullToEmpty(n.txHash()));

    public String calculate(Block block) {
        EventNode root = block.eventNodes().stream().min(ROOT_ORDER).orElse(null);
        String key = rootKey(root) + nullToEmpty(block.btype());
        return Base64.getEncoder().encodeToString(sha256(key));
    }

    private static String rootKey(EventNode root) {
        if (root == null) {
            return "";
        }
        if (root.message() != null) {
            return nullToEmpty(root.message().msgHash());
        }
        return nullToEmpty(root.txHash());
    }

    private static byte[] sha256(String key) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
