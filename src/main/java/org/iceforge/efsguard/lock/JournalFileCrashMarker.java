package org.iceforge.efsguard.lock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Checks for a rollback journal next to the database file ({@code <db>-journal} for SQLite).
 */
public class JournalFileCrashMarker implements CrashMarker {

    public static final String DEFAULT_SUFFIX = "-journal";

    private final Path journal;

    public JournalFileCrashMarker(String databasePath, String suffix) {
        Objects.requireNonNull(databasePath, "databasePath");
        String s = (suffix == null || suffix.isBlank()) ? DEFAULT_SUFFIX : suffix;
        this.journal = Path.of(databasePath + s);
    }

    public Path journal() {
        return journal;
    }

    @Override
    public boolean exists() {
        return Files.exists(journal);
    }
}
