package com.tablesmith.core.assets;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Content hash of an asset script. Whitespace-only edits at line ends and line-ending style do not
 * change the hash.
 */
public final class AssetHasher {

    private AssetHasher() {
    }

    public static String hash(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(normalize(sql).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    public static String normalize(String sql) {
        String text = sql.strip()
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        return text.lines()
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
