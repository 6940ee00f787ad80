package io.horizen.rawtx.script;

import java.util.Set;

public class StandardScriptVerifier implements ScriptVerifier {

    @Override
    public ScriptVerificationResult verify(byte[] unlockingScript,
                                           byte[] lockingScript,
                                           Set<ScriptVerifyFlag> flags,
                                           SignatureChecker checker) {
        ScriptError error = ScriptInterpreter.verifyScript(unlockingScript, lockingScript, flags, checker);
        return error == ScriptError.OK ? ScriptVerificationResult.ok() : ScriptVerificationResult.failed(error);
    }
}
