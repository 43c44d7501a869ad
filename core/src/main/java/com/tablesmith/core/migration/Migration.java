package com.tablesmith.core.migration;

/**
 * A hand-authored schema change. Migrations are applied in ordinal order of {@link #id()}, so ids
 * are usually timestamp-prefixed, for example {@code 20240101_000001_CreateUsers}.
 *
 * <p>Implementations can be registered under {@code META-INF/services/com.tablesmith.core.migration.Migration}
 * for discovery with {@link java.util.ServiceLoader}.
 */
public abstract class Migration {

    public abstract String id();

    public String name() {
        return getClass().getSimpleName();
    }

    public abstract void up(MigrationBuilder migration);

    /**
     * Reverts {@link #up}. Nothing runs this automatically.
     */
    public void down(MigrationBuilder migration) {
    }

    @Override
    public String toString() {
        return id() + " (" + name() + ")";
    }
}
