package com.waqiti.bridge.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives transfer identifiers from the source ledger and its lock nonce.
 */
public final class TransferIds {

    private TransferIds() {
    }

    /**
     * @return lowercase hex SHA-256 of {@code sourceChain + ":" + nonce}
     */
    public static String derive(String sourceChain, long nonce) {
        if (sourceChain == null || sourceChain.isBlank()) {
            throw new IllegalArgumentException("Source chain is required to derive a transfer id");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((sourceChain + ":" + nonce).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
