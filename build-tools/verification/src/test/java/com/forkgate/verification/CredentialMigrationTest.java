package com.forkgate.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Naming and content rules for the credential schema migrations. */
@DisplayName("Credential Migrations")
class CredentialMigrationTest {

    private static final Pattern VERSIONED = Pattern.compile("V(\\d+)__[a-z0-9_]+\\.sql");

    private static Path migrationDir;
    private static List<Path> migrations;

    @BeforeAll
    static void listMigrations() throws IOException {
        Path projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        migrationDir = projectRoot.resolve(
                "libs/database/src/main/resources/db/migration/credentials");
        assertThat(migrationDir).isDirectory();
        try (Stream<Path> files = Files.list(migrationDir)) {
            migrations = files.sorted().collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("Every file follows V<n>__<snake_case>.sql")
    void namingConvention() {
        assertThat(migrations).isNotEmpty();
        for (Path migration : migrations) {
            assertThat(migration.getFileName().toString()).matches(VERSIONED);
        }
    }

    @Test
    @DisplayName("Versions start at 1 and have no gaps")
    void sequentialVersions() {
        List<Integer> versions = migrations.stream()
                .map(p -> VERSIONED.matcher(p.getFileName().toString()))
                .filter(Matcher::matches)
                .map(m -> Integer.parseInt(m.group(1)))
                .sorted()
                .collect(Collectors.toList());
        for (int i = 0; i < versions.size(); i++) {
            assertThat(versions.get(i)).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("Credentials table stores the tier as a numeric code")
    void credentialsTable() throws IOException {
        String sql = Files.readString(migrationDir.resolve("V1__create_credentials.sql"));
        assertThat(sql).containsIgnoringCase("CREATE TABLE credentials")
                .containsIgnoringCase("tier")
                .containsIgnoringCase("SMALLINT")
                .containsIgnoringCase("PRIMARY KEY");
    }
}
