package io.horizen.rawtx.settings;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.LinkedHashSet;
import java.util.Set;

public class LogInitializer {
    private static boolean initDone = false;
    // note: the order is from the most to the least verbose level
    private static final Set<String> levelSet = new LinkedHashSet<>();

    static {
        levelSet.add("all");
        levelSet.add("trace");
        levelSet.add("debug");
        levelSet.add("info");
        levelSet.add("warn");
        levelSet.add("error");
        levelSet.add("fatal");
        levelSet.add("off");
    }

    public static synchronized void initLogManager(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
        if (initDone) return;
        initDone = true;

        String checkedFileLevel = getCheckedLevel(logFileLevel);
        String checkedConsoleLevel = getCheckedLevel(logConsoleLevel);

        // make sure logDir ends with a separator
        if (!logDir.isBlank() && !logDir.endsWith(File.separator)) {
            logDir = logDir + File.separator;
        }

        System.setProperty("logDir", logDir);
        System.setProperty("logFilename", logFileName);
        System.setProperty("logRootLevel", rootLevel(checkedFileLevel, checkedConsoleLevel));
        System.setProperty("logFileLevel", checkedFileLevel);
        System.setProperty("logConsoleLevel", checkedConsoleLevel);

        Logger logger = LogManager.getLogger(LogInitializer.class);
        logger.log(
            Level.INFO, "Logging system started, log file: [{}], file log level: [{}], console log level: [{}]",
            logDir + logFileName, checkedFileLevel, checkedConsoleLevel
        );
    }

    public static void initLogManager(RawTxSettings settings) {
        LogInfo logInfo = settings.logInfo();
        initLogManager(settings.logDir(), logInfo.logFileName(), logInfo.logFileLevel(), logInfo.logConsoleLevel());
    }

    // The most verbose of the two appender levels: the root logger must not filter what an appender wants.
    static String rootLevel(String fileLevel, String consoleLevel) {
        for (String level : levelSet) {
            if (level.equals(fileLevel) || level.equals(consoleLevel))
                return level;
        }
        return "all";
    }

    public static String getCheckedLevel(String inLevel) {
        if (levelSet.contains(inLevel)) {
            return inLevel;
        }
        LogManager.getLogger(LogInitializer.class).warn("Specified log4j level: [{}] not valid: defaulting to [info]", inLevel);
        return "info";
    }
}
