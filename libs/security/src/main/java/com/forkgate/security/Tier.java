package com.forkgate.security;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Privilege tiers, declared in order of decreasing privilege.
 *
 * <p>Storable tiers carry a numeric storage code where {@code 0} is the highest privilege and every
 * following tier has a strictly larger code. {@link #UNAUTHENTICATED} has no storage code: it is the
 * tier of a request that presents no credential and can never be written to the credential store.
 *
 * <p>The code ordering is verified when the class initialises; an enum edit that breaks it fails on
 * first use instead of silently handing out the wrong budgets.
 */
public enum Tier {

    ADMINISTRATOR(0),
    DEVELOPER(1),
    BASIC(2),
    UNAUTHENTICATED(-1);

    private static final int NO_CODE = -1;

    static {
        int previous = NO_CODE;
        for (Tier tier : values()) {
            if (tier.storageCode == NO_CODE) {
                continue;
            }
            if (tier.storageCode <= previous) {
                throw new ExceptionInInitializerError(
                        "Tier storage codes must increase as privilege decreases: " + tier);
            }
            previous = tier.storageCode;
        }
    }

    private final int storageCode;

    Tier(int storageCode) {
        this.storageCode = storageCode;
    }

    /** Lower-case name used on the wire, e.g. {@code "developer"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The code persisted in the credential table, or empty for {@link #UNAUTHENTICATED}. */
    public OptionalInt storageCode() {
        return storageCode == NO_CODE ? OptionalInt.empty() : OptionalInt.of(storageCode);
    }

    /** Whether a credential bound to this tier may be minted by the issuance service. */
    public boolean isIssuable() {
        return this == DEVELOPER || this == BASIC;
    }

    /**
     * Maps a stored code back to its tier.
     *
     * @param code the value read from the credential table
     * @return the tier, or empty when no storable tier has that code
     */
    public static Optional<Tier> fromStorageCode(int code) {
        for (Tier tier : values()) {
            if (tier.storageCode != NO_CODE && tier.storageCode == code) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a tier by its wire name (case-insensitive).
     *
     * @param value the string to match, may be null
     * @return the matching tier, or empty if not found
     */
    public static Optional<Tier> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.wireName().equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
