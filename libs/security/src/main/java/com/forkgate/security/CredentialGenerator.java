package com.forkgate.security;

import java.security.SecureRandom;
import java.util.HexFormat;

/** Produces new credential strings. */
@FunctionalInterface
public interface CredentialGenerator {

    /** Number of random bytes behind every generated credential (128 bits). */
    int RANDOM_BYTES = 16;

    String generate();

    /** 128 bits from {@link SecureRandom}, hex-encoded to 32 lower-case characters. */
    static CredentialGenerator secureRandom() {
        SecureRandom random = new SecureRandom();
        HexFormat hex = HexFormat.of();
        return () -> {
            byte[] bytes = new byte[RANDOM_BYTES];
            random.nextBytes(bytes);
            return hex.formatHex(bytes);
        };
    }
}
