package com.tablesmith.dialects.sqlserver;

import java.util.Optional;

public record DatabaseEnsureResult(DatabaseEnsureStatus status, String database, Exception error) {

    public DatabaseEnsureResult(DatabaseEnsureStatus status, String database) {
        this(status, database, null);
    }

    public boolean usable() {
        return status == DatabaseEnsureStatus.ALREADY_EXISTS || status == DatabaseEnsureStatus.CREATED;
    }

    public Optional<Exception> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
