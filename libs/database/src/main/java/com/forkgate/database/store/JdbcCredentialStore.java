package com.forkgate.database.store;

import com.forkgate.security.CredentialMasker;
import com.forkgate.security.CredentialRecord;
import com.forkgate.security.CredentialStore;
import com.forkgate.security.CredentialStoreException;
import com.forkgate.security.Tier;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link CredentialStore} over the {@code credentials} table.
 *
 * <p>Each call borrows one pooled connection through {@link JdbcTemplate}, which returns it on
 * every exit path. Spring's {@link DataAccessException} hierarchy, including the timeout raised
 * when the pool stays exhausted, is translated to {@link CredentialStoreException}.
 */
public class JdbcCredentialStore implements CredentialStore {

    static final String SELECT_TIER = "SELECT tier FROM credentials WHERE credential = ?";

    static final String INSERT =
            "INSERT INTO credentials (credential, tier, label, created_at) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcCredentialStore(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Tier> lookup(String credential) {
        List<Integer> codes;
        try {
            codes = jdbcTemplate.query(SELECT_TIER, (rs, rowNum) -> rs.getInt(1), credential);
        } catch (DataAccessException e) {
            throw new CredentialStoreException(
                    "Lookup of " + CredentialMasker.mask(credential) + " failed", e);
        }
        if (codes.isEmpty()) {
            return Optional.empty();
        }
        int code = codes.get(0);
        return Optional.of(
                Tier.fromStorageCode(code)
                        .orElseThrow(() -> CredentialStoreException.unknownTierCode(code)));
    }

    @Override
    public void insert(CredentialRecord record) {
        int code = record.tier().storageCode().orElseThrow();
        try {
            jdbcTemplate.update(
                    INSERT,
                    record.credential(),
                    code,
                    record.label(),
                    record.createdAt().atOffset(ZoneOffset.UTC));
        } catch (DuplicateKeyException e) {
            throw new CredentialStoreException(
                    "Credential " + CredentialMasker.mask(record.credential()) + " already exists",
                    e);
        } catch (DataAccessException e) {
            throw new CredentialStoreException(
                    "Insert of " + CredentialMasker.mask(record.credential()) + " failed", e);
        }
    }
}
