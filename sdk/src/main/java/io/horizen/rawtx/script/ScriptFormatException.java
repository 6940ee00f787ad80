package io.horizen.rawtx.script;

// Raised when a script can not be split into operations, e.g. a push runs past the end of the script.
public class ScriptFormatException extends IllegalArgumentException {
    public ScriptFormatException(String message) {
        super(message);
    }
}
