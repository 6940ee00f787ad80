package io.horizen.rawtx.script;

import java.util.Set;

public interface ScriptVerifier {

    ScriptVerificationResult verify(byte[] unlockingScript,
                                    byte[] lockingScript,
                                    Set<ScriptVerifyFlag> flags,
                                    SignatureChecker checker);
}
