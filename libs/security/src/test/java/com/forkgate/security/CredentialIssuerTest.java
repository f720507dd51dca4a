package com.forkgate.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.forkgate.security.testing.InMemoryCredentialStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("CredentialIssuer")
class CredentialIssuerTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private InMemoryCredentialStore store;
    private CredentialIssuer issuer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        issuer = new CredentialIssuer(store, CredentialGenerator.secureRandom(), CLOCK);
    }

    @Nested
    @DisplayName("authorization")
    class Authorization {

        @ParameterizedTest
        @EnumSource(value = Tier.class, names = "ADMINISTRATOR", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("non-administrators are refused and nothing is written")
        void nonAdministratorsRefused(Tier caller) {
            IssuanceResult result = issuer.issue(Tier.BASIC, "label", caller);

            assertThat(result.rejectionReason()).contains(RejectionReason.NOT_AUTHORIZED);
            assertThat(store.records()).isEmpty();
            assertThat(store.insertCount()).isZero();
        }

        @Test
        @DisplayName("authorization is checked before the requested tier")
        void authorizationFirst() {
            assertThat(issuer.issue(Tier.ADMINISTRATOR, "x", Tier.DEVELOPER).rejection())
                    .isEqualTo(RejectionReason.NOT_AUTHORIZED);
        }
    }

    @Nested
    @DisplayName("requested tier")
    class RequestedTier {

        @ParameterizedTest
        @EnumSource(value = Tier.class, names = {"ADMINISTRATOR", "UNAUTHENTICATED"})
        @DisplayName("administrator and unauthenticated cannot be issued")
        void nonIssuableTiers(Tier requested) {
            IssuanceResult result = issuer.issue(requested, "label", Tier.ADMINISTRATOR);

            assertThat(result.rejection()).isEqualTo(RejectionReason.INVALID_REQUESTED_TIER);
            assertThat(store.records()).isEmpty();
        }

        @Test
        @DisplayName("null requested tier is invalid")
        void nullRequestedTier() {
            assertThat(issuer.issue(null, "label", Tier.ADMINISTRATOR).rejection())
                    .isEqualTo(RejectionReason.INVALID_REQUESTED_TIER);
        }
    }

    @Nested
    @DisplayName("successful issue")
    class SuccessfulIssue {

        @Test
        @DisplayName("persists the record and returns a 32-character hex credential")
        void persistsRecord() {
            IssuanceResult result = issuer.issue(Tier.DEVELOPER, "test", Tier.ADMINISTRATOR);

            assertThat(result.isIssued()).isTrue();
            String credential = result.credential();
            assertThat(credential).matches("[0-9a-f]{32}");

            CredentialRecord record = store.records().get(credential);
            assertThat(record.tier()).isEqualTo(Tier.DEVELOPER);
            assertThat(record.label()).isEqualTo("test");
            assertThat(record.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("an issued credential resolves to the requested tier")
        void issuedCredentialResolves() {
            String credential = issuer.issue(Tier.BASIC, "ci", Tier.ADMINISTRATOR).credential();

            assertThat(new AccessResolver(store).resolve(List.of(credential)).grantedTier())
                    .contains(Tier.BASIC);
        }

        @Test
        @DisplayName("credentials are unique across many issues")
        void credentialsAreUnique() {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < 500; i++) {
                seen.add(issuer.issue(Tier.BASIC, "bulk", Tier.ADMINISTRATOR).credential());
            }
            assertThat(seen).hasSize(500);
        }

        @Test
        @DisplayName("toString never shows the full credential")
        void toStringMasksCredential() {
            IssuanceResult result = issuer.issue(Tier.BASIC, "x", Tier.ADMINISTRATOR);
            assertThat(result.toString()).doesNotContain(result.credential());
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailures {

        @Test
        @DisplayName("unavailable store yields issuance-failed")
        void unavailableStore() {
            store.setUnavailable(true);

            IssuanceResult result = issuer.issue(Tier.DEVELOPER, "test", Tier.ADMINISTRATOR);

            assertThat(result.rejection()).isEqualTo(RejectionReason.ISSUANCE_FAILED);
            assertThat(result.rejection().retryable()).isTrue();
        }

        @Test
        @DisplayName("colliding credential yields issuance-failed and a retry succeeds")
        void collisionThenRetry() {
            var fixed = new CredentialIssuer(store, () -> "ffffffffffffffffffffffffffffffff", CLOCK);
            assertThat(fixed.issue(Tier.BASIC, "first", Tier.ADMINISTRATOR).isIssued()).isTrue();

            assertThat(fixed.issue(Tier.BASIC, "second", Tier.ADMINISTRATOR).rejection())
                    .isEqualTo(RejectionReason.ISSUANCE_FAILED);
            assertThat(issuer.issue(Tier.BASIC, "second", Tier.ADMINISTRATOR).isIssued()).isTrue();
        }
    }

    @Nested
    @DisplayName("labels")
    class Labels {

        @Test
        @DisplayName("blank label is rejected")
        void blankLabel() {
            assertThatThrownBy(() -> issuer.issue(Tier.BASIC, " ", Tier.ADMINISTRATOR))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("label");
        }

        @Test
        @DisplayName("overlong label is rejected")
        void longLabel() {
            String label = "x".repeat(CredentialIssuer.MAX_LABEL_LENGTH + 1);
            assertThatThrownBy(() -> issuer.issue(Tier.BASIC, label, Tier.ADMINISTRATOR))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
