package com.tablesmith.core.migration;

import com.tablesmith.core.MigrationExecutionException;
import com.tablesmith.core.TablesmithException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Applies pending migrations under an advisory lock.
 *
 * <p>Each migration runs in its own transaction together with its history row, so a migration is
 * either fully applied and recorded or not applied at all. A failure stops the run; migrations
 * committed before it stay committed.
 */
public class Migrator {
    private static final Logger logger = LoggerFactory.getLogger(Migrator.class);

    private final MigrationSqlGenerator generator;
    private final MigrationHistoryRepository history;
    private final MigrationLockProvider lockProvider;
    private final TransactionalMigrationExecutor executor;
    private final MigratorOptions options;
    private final Clock clock;

    public Migrator(
            MigrationSqlGenerator generator,
            MigrationHistoryRepository history,
            MigrationLockProvider lockProvider,
            TransactionalMigrationExecutor executor,
            MigratorOptions options,
            Clock clock
    ) {
        this.generator = generator;
        this.history = history;
        this.lockProvider = lockProvider;
        this.executor = executor;
        this.options = options == null ? MigratorOptions.defaults() : options;
        this.clock = clock;
    }

    public Migrator(
            MigrationSqlGenerator generator,
            MigrationHistoryRepository history,
            MigrationLockProvider lockProvider,
            TransactionalMigrationExecutor executor,
            MigratorOptions options
    ) {
        this(generator, history, lockProvider, executor, options, Clock.systemUTC());
    }

    /**
     * @throws com.tablesmith.core.MigrationLockException if the lock cannot be taken; nothing is executed
     * @throws MigrationExecutionException                if a migration fails; its transaction is rolled back
     */
    public MigrationReport migrate(Collection<? extends Migration> migrations) {
        List<Migration> ordered = ordered(migrations);

        try (MigrationLock lock = lockProvider.acquire(options.scope())) {
            history.ensureCreated();
            Set<String> alreadyApplied = history.getAppliedIds();

            List<String> applied = new ArrayList<>();
            List<String> skipped = new ArrayList<>();

            for (Migration migration : ordered) {
                if (alreadyApplied.contains(migration.id())) {
                    skipped.add(migration.id());
                    continue;
                }
                apply(migration);
                applied.add(migration.id());
            }

            if (applied.isEmpty()) {
                logger.info("Database is up to date under scope {} ({} migrations known)", lock.scope(), ordered.size());
            } else {
                logger.info("Applied {} migration(s) under scope {}: {}", applied.size(), lock.scope(), applied);
            }
            return new MigrationReport(applied, skipped);
        }
    }

    private void apply(Migration migration) {
        String id = migration.id();

        MigrationBuilder builder = new MigrationBuilder();
        migration.up(builder);
        List<String> batches = generator.generate(builder.operations());

        logger.info("Applying migration {} ({} batches)", migration, batches.size());

        int batchIndex = -1;
        String batch = null;

        executor.beginTransaction();
        try {
            for (int i = 0; i < batches.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Migration run interrupted before batch " + (i + 1));
                }
                batchIndex = i;
                batch = batches.get(i);
                logger.debug("Migration {} batch {}/{}:\n{}", id, i + 1, batches.size(), batch);
                executor.executeBatch(batch, options.commandTimeoutSeconds());
            }

            batchIndex = -1;
            batch = null;
            history.insert(id, migration.name(), options.productVersion(), clock.instant());
            executor.commit();
        } catch (RuntimeException e) {
            rollback(id, e);
            throw new MigrationExecutionException(id, batchIndex, batch, e);
        }
    }

    private void rollback(String migrationId, RuntimeException cause) {
        try {
            executor.rollback();
        } catch (RuntimeException rollbackFailure) {
            logger.warn("Rollback of migration {} failed", migrationId, rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static List<Migration> ordered(Collection<? extends Migration> migrations) {
        Map<String, Migration> byId = new HashMap<>();
        for (Migration migration : migrations) {
            String id = migration.id();
            if (id == null || id.isBlank()) {
                throw new TablesmithException("Migration " + migration.getClass().getName() + " has no id");
            }
            Migration previous = byId.putIfAbsent(id, migration);
            if (previous != null) {
                throw new TablesmithException("Duplicate migration id '" + id + "': "
                        + previous.getClass().getName() + " and " + migration.getClass().getName());
            }
        }

        List<Migration> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparing(Migration::id));
        return ordered;
    }
}
