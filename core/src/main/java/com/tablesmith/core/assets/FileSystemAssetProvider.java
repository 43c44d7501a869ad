package com.tablesmith.core.assets;

import com.tablesmith.core.TablesmithException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads {@code *.sql} assets from a directory tree such as:
 *
 * <pre>
 * assets/
 *   Views/dbo.vw_ActiveUsers.sql
 *   Procedures/dbo.sp_ListUsers.sql
 *   FunctionsScalar/dbo.fn_IsActive.sql
 *   FunctionsTable/...
 *   Triggers/...
 * </pre>
 *
 * The kind comes from the nearest recognised directory (procedure if none), and the schema and
 * object name come from the file name, {@code schema.name.sql} or {@code name.sql} for the default
 * schema. Assets are returned in path order.
 */
public class FileSystemAssetProvider implements DbAssetProvider {
    private static final Logger logger = LoggerFactory.getLogger(FileSystemAssetProvider.class);

    public static final String DEFAULT_SCHEMA = "dbo";

    private final Path root;

    public FileSystemAssetProvider(Path root) {
        this.root = root;
    }

    @Override
    public List<DbAsset> getAssets() {
        if (!Files.isDirectory(root)) {
            logger.warn("Asset directory {} does not exist", root);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TablesmithException("Failed to scan asset directory " + root, e);
        }

        List<DbAsset> assets = new ArrayList<>();
        for (Path file : files) {
            assets.add(load(file));
        }
        logger.debug("Loaded {} asset(s) from {}", assets.size(), root);
        return assets;
    }

    private DbAsset load(Path file) {
        String fileName = file.getFileName().toString();
        String baseName = fileName.substring(0, fileName.length() - ".sql".length());

        String schema = DEFAULT_SCHEMA;
        String name = baseName;
        int dot = baseName.indexOf('.');
        if (dot > 0 && dot < baseName.length() - 1) {
            schema = baseName.substring(0, dot);
            name = baseName.substring(dot + 1);
        }

        try {
            String sql = Files.readString(file, StandardCharsets.UTF_8);
            return new DbAsset(schema, name, inferKind(root.relativize(file)), sql);
        } catch (IOException e) {
            throw new TablesmithException("Failed to read asset " + file, e);
        }
    }

    static DbAssetKind inferKind(Path relative) {
        Path parent = relative.getParent();
        for (Path p = parent; p != null; p = p.getParent()) {
            String dir = p.getFileName().toString().toLowerCase(Locale.ROOT);
            for (DbAssetKind kind : DbAssetKind.values()) {
                if (kind.directory().equals(dir)) {
                    return kind;
                }
            }
        }
        return DbAssetKind.PROCEDURE;
    }
}
