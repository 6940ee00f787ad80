package io.horizen.rawtx.script;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum ScriptVerifyFlag {
    // evaluate P2SH subscripts
    P2SH,
    // strict signature and public key encodings
    STRICTENC,
    // strict DER signatures
    DERSIG,
    // S value at most half the curve order
    LOW_S,
    // the extra CHECKMULTISIG stack element must be empty
    NULLDUMMY,
    // signature scripts may only push data
    SIGPUSHONLY,
    // pushes must use the smallest possible encoding
    MINIMALDATA,
    // exactly one stack element must remain, only with P2SH
    CLEANSTACK;

    // Rules that do not depend on the block the entity is included in.
    public static final Set<ScriptVerifyFlag> STANDARD_NONCONTEXTUAL_FLAGS =
            Collections.unmodifiableSet(EnumSet.of(P2SH, STRICTENC, DERSIG, LOW_S, NULLDUMMY, MINIMALDATA, CLEANSTACK));

    public static final Set<ScriptVerifyFlag> MANDATORY_FLAGS = Collections.unmodifiableSet(EnumSet.of(P2SH));
}
