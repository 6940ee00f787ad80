package io.horizen.rawtx.settings;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code rawtx} configuration section.
 */
public final class RawTxSettings {
    public static final String ROOT_PATH = "rawtx";

    private final String logDir;
    private final LogInfo logInfo;
    private final int maxSigningVariants;
    private final int maxProofTargets;

    public RawTxSettings(String logDir, LogInfo logInfo, int maxSigningVariants, int maxProofTargets) {
        if (maxSigningVariants < 1)
            throw new IllegalArgumentException("maxSigningVariants must be positive");
        if (maxProofTargets < 1)
            throw new IllegalArgumentException("maxProofTargets must be positive");
        this.logDir = logDir;
        this.logInfo = logInfo;
        this.maxSigningVariants = maxSigningVariants;
        this.maxProofTargets = maxProofTargets;
    }

    public static RawTxSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT_PATH);
        Config logInfo = root.getConfig("logInfo");
        return new RawTxSettings(
                root.getString("logDir"),
                new LogInfo(logInfo.getString("logFileName"), logInfo.getString("logFileLevel"), logInfo.getString("logConsoleLevel")),
                root.getInt("limits.maxSigningVariants"),
                root.getInt("limits.maxProofTargets")
        );
    }

    public String logDir() {
        return logDir;
    }

    public LogInfo logInfo() {
        return logInfo;
    }

    // Entities accepted by one signing call, the base included.
    public int maxSigningVariants() {
        return maxSigningVariants;
    }

    public int maxProofTargets() {
        return maxProofTargets;
    }
}
