package io.horizen.rawtx.script;

public final class ScriptVerificationResult {
    private static final ScriptVerificationResult OK = new ScriptVerificationResult(ScriptError.OK);

    private final ScriptError error;

    private ScriptVerificationResult(ScriptError error) {
        this.error = error;
    }

    public static ScriptVerificationResult ok() {
        return OK;
    }

    public static ScriptVerificationResult failed(ScriptError error) {
        if (error == ScriptError.OK)
            throw new IllegalArgumentException("Failed verification must carry an error");
        return new ScriptVerificationResult(error);
    }

    public boolean isValid() {
        return error == ScriptError.OK;
    }

    public ScriptError error() {
        return error;
    }

    public String errorDescription() {
        return error.description();
    }

    @Override
    public String toString() {
        return isValid() ? "ScriptVerificationResult(OK)" : "ScriptVerificationResult(" + error + ")";
    }
}
