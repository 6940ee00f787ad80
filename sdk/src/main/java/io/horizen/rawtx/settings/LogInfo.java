package io.horizen.rawtx.settings;

public final class LogInfo {
    private final String logFileName;
    private final String logFileLevel;
    private final String logConsoleLevel;

    public LogInfo(String logFileName, String logFileLevel, String logConsoleLevel) {
        this.logFileName = logFileName;
        this.logFileLevel = logFileLevel;
        this.logConsoleLevel = logConsoleLevel;
    }

    public String logFileName() {
        return logFileName;
    }

    public String logFileLevel() {
        return logFileLevel;
    }

    public String logConsoleLevel() {
        return logConsoleLevel;
    }
}
