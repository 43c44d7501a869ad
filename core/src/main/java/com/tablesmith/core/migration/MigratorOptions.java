package com.tablesmith.core.migration;

public record MigratorOptions(
        String scope,
        String productVersion,
        int commandTimeoutSeconds
) {
    public static final String DEFAULT_SCOPE = "Tablesmith.Migrations";
    public static final String DEFAULT_PRODUCT_VERSION = "Tablesmith";
    public static final int DEFAULT_COMMAND_TIMEOUT_SECONDS = 120;

    public MigratorOptions {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Lock scope must not be blank");
        }
        if (productVersion == null || productVersion.isBlank()) {
            throw new IllegalArgumentException("Product version must not be blank");
        }
        if (commandTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Command timeout must not be negative: " + commandTimeoutSeconds);
        }
    }

    public static MigratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String scope = DEFAULT_SCOPE;
        private String productVersion = DEFAULT_PRODUCT_VERSION;
        private int commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_SECONDS;

        /**
         * Name of the advisory lock. Runs sharing a scope never overlap.
         */
        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder productVersion(String productVersion) {
            this.productVersion = productVersion;
            return this;
        }

        /**
         * Per-batch timeout; 0 waits indefinitely.
         */
        public Builder commandTimeoutSeconds(int commandTimeoutSeconds) {
            this.commandTimeoutSeconds = commandTimeoutSeconds;
            return this;
        }

        public MigratorOptions build() {
            return new MigratorOptions(scope, productVersion, commandTimeoutSeconds);
        }
    }
}
