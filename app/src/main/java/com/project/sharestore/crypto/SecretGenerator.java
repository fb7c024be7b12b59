package com.project.sharestore.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random identifiers and secrets, encoded as unpadded base64url.
 */
public final class SecretGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder BASE64URL = Base64.getUrlEncoder().withoutPadding();

    /** 16 bytes: 22 characters. */
    public static final int SHARE_ID_BYTES = 16;
    /** 24 bytes: 32 characters. */
    public static final int EDIT_TOKEN_BYTES = 24;

    private SecretGenerator() {
    }

    public static String newShareId() {
        return randomBase64Url(SHARE_ID_BYTES);
    }

    public static String newEditToken() {
        return randomBase64Url(EDIT_TOKEN_BYTES);
    }

    static String randomBase64Url(int byteCount) {
        byte[] bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        return BASE64URL.encodeToString(bytes);
    }
}
