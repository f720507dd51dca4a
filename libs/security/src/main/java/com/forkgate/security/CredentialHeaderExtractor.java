package com.forkgate.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the credentials a request presents in its {@value #HEADER_NAME} header.
 *
 * <p>HTTP lets a header repeat, and intermediaries may fold repeats into one comma-separated value.
 * Both forms are unfolded here so that {@link AccessResolver} sees every presented credential and
 * can reject more than one.
 */
public final class CredentialHeaderExtractor {

    /** Request header carrying the credential. */
    public static final String HEADER_NAME = "X-API-Key";

    private CredentialHeaderExtractor() {
        // utility class
    }

    /**
     * Extracts every presented credential from the raw header values.
     *
     * @param headerValues all values of the credential header, may be null or empty
     * @return the credentials in arrival order, whitespace-stripped; empty when none were presented
     */
    public static List<String> extract(List<String> headerValues) {
        if (headerValues == null || headerValues.isEmpty()) {
            return List.of();
        }
        List<String> credentials = new ArrayList<>();
        for (String value : headerValues) {
            if (value == null) {
                continue;
            }
            // Folded repeats: "a, b"
            for (String part : value.split(",", -1)) {
                credentials.add(part.strip());
            }
        }
        return List.copyOf(credentials);
    }
}
