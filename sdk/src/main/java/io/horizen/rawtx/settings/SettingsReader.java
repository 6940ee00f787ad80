package io.horizen.rawtx.settings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.Optional;

public class SettingsReader {

    private final RawTxSettings settings;
    private final Config config;

    public SettingsReader(Optional<String> userConfigPath) {
        this.config = readConfigFromPath(userConfigPath);
        this.settings = RawTxSettings.fromConfig(this.config);
        // init log4j logging system as soon as possible after having read the settings
        LogInitializer.initLogManager(this.settings);
    }

    public static Config readConfigFromPath(Optional<String> userConfigPath) {
        Config defaults = ConfigFactory.load();
        if (userConfigPath.isEmpty())
            return defaults;

        File userConfigFile = new File(userConfigPath.get());
        if (!userConfigFile.exists())
            throw new IllegalArgumentException("Config file not found: " + userConfigFile.getAbsolutePath());
        return ConfigFactory.parseFile(userConfigFile).withFallback(defaults).resolve();
    }

    public RawTxSettings getSettings() {
        return this.settings;
    }

    public Config getConfig() {
        return this.config;
    }
}
