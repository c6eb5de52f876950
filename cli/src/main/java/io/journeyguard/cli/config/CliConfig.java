package io.journeyguard.cli.config;

/**
 * Configuration of the command line tool. Use {@link #builder()} to construct instances; every
 * field has a default.
 *
 * @param registryPath    node-definitions override file, or {@code null} for the bundled registry
 * @param autoFix         apply and persist repairs during {@code validate}
 * @param maxRepairCycles upper bound on repair-then-rescan cycles
 * @param workspaceFolder folder journey files may live under, or {@code null}
 * @param userCwd         second folder journey files may live under
 * @param maxFileBytes    largest journey file accepted
 * @param loggingFormat   json or text
 * @param loggingLevel    level of journey-guard's own loggers
 */
public record CliConfig(
        String registryPath,
        boolean autoFix,
        int maxRepairCycles,
        String workspaceFolder,
        String userCwd,
        long maxFileBytes,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private String registryPath;
        private boolean autoFix = true;
        private int maxRepairCycles = 1;
        private String workspaceFolder;
        private String userCwd = System.getProperty("user.dir");
        private long maxFileBytes = 10_485_760; // 10 MiB
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder registryPath(String registryPath) {
            this.registryPath = registryPath;
            return this;
        }

        public Builder autoFix(boolean autoFix) {
            this.autoFix = autoFix;
            return this;
        }

        public Builder maxRepairCycles(int maxRepairCycles) {
            this.maxRepairCycles = maxRepairCycles;
            return this;
        }

        public Builder workspaceFolder(String workspaceFolder) {
            this.workspaceFolder = workspaceFolder;
            return this;
        }

        public Builder userCwd(String userCwd) {
            this.userCwd = userCwd;
            return this;
        }

        public Builder maxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link CliConfig}.
         *
         * @throws ConfigLoadException if a numeric limit is out of range
         */
        public CliConfig build() {
            if (maxRepairCycles < 0) {
                throw new ConfigLoadException("validation.max-repair-cycles must be >= 0, got " + maxRepairCycles);
            }
            if (maxFileBytes <= 0) {
                throw new ConfigLoadException("security.max-file-bytes must be > 0, got " + maxFileBytes);
            }
            return new CliConfig(
                    registryPath,
                    autoFix,
                    maxRepairCycles,
                    workspaceFolder,
                    userCwd,
                    maxFileBytes,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
