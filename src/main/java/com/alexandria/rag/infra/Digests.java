package com.alexandria.rag.infra;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Digests {

    private Digests() {
    }

    public static MessageDigest sha256() {
        return getInstance("SHA-256");
    }

    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(sha256().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static String md5Hex(String text) {
        return HexFormat.of().formatHex(getInstance("MD5").digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest getInstance(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256 and MD5
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }
}
