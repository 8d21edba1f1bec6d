package io.simconvert.standalone.config;

import io.simconvert.core.engine.StepFailurePolicy;
import java.util.Objects;

/**
 * Root configuration for the command-line converter.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param backup            copy each file to {@code <file><backupSuffix>} before overwriting it
 * @param backupSuffix      suffix appended to the original file name for the backup copy
 * @param dryRun            convert in memory and report, but write nothing
 * @param includeGlob       file-name glob applied when walking directories
 * @param stepFailurePolicy what the driver does when a step throws
 * @param xmlDeclaration    write an XML declaration at the top of converted files
 * @param loggingFormat     json or text
 * @param loggingLevel      root log level
 */
public record StandaloneConfig(
        boolean backup,
        String backupSuffix,
        boolean dryRun,
        String includeGlob,
        StepFailurePolicy stepFailurePolicy,
        boolean xmlDeclaration,
        String loggingFormat,
        String loggingLevel) {

    public StandaloneConfig {
        Objects.requireNonNull(stepFailurePolicy, "stepFailurePolicy must not be null");
        if (includeGlob == null || includeGlob.isBlank()) {
            throw new ConfigLoadException("convert.include-glob must not be empty");
        }
        if (backup && (backupSuffix == null || backupSuffix.isBlank())) {
            throw new ConfigLoadException("convert.backup-suffix must not be empty when backups are enabled");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with defaults for every field. */
    public static final class Builder {

        private boolean backup = true;
        private String backupSuffix = ".bak";
        private boolean dryRun = false;
        private String includeGlob = "*.apsimx";
        private StepFailurePolicy stepFailurePolicy = StepFailurePolicy.SKIP;
        private boolean xmlDeclaration = true;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder backup(boolean backup) {
            this.backup = backup;
            return this;
        }

        public Builder backupSuffix(String backupSuffix) {
            this.backupSuffix = backupSuffix;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder includeGlob(String includeGlob) {
            this.includeGlob = includeGlob;
            return this;
        }

        public Builder stepFailurePolicy(StepFailurePolicy stepFailurePolicy) {
            this.stepFailurePolicy = stepFailurePolicy;
            return this;
        }

        public Builder xmlDeclaration(boolean xmlDeclaration) {
            this.xmlDeclaration = xmlDeclaration;
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

        public StandaloneConfig build() {
            return new StandaloneConfig(
                    backup,
                    backupSuffix,
                    dryRun,
                    includeGlob,
                    stepFailurePolicy,
                    xmlDeclaration,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
