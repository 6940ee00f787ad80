package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.horizen.rawtx.script.ScriptParser;
import io.horizen.rawtx.script.ScriptSolution;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.utils.BytesUtils;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScriptView {
    public final String asm;
    public final String hex;
    public final Integer reqSigs;
    public final String type;

    private ScriptView(String asm, String hex, Integer reqSigs, String type) {
        this.asm = asm;
        this.hex = hex;
        this.reqSigs = reqSigs;
        this.type = type;
    }

    // Unlocking script: asm and hex only.
    public static ScriptView unlocking(byte[] script) {
        return new ScriptView(ScriptParser.toAsm(script), BytesUtils.toHexString(script), null, null);
    }

    // Standalone script: asm, type and required signatures, without hex.
    public static ScriptView decoded(byte[] script) {
        ScriptView view = locking(script);
        return new ScriptView(view.asm, null, view.reqSigs, view.type);
    }

    public static ScriptView locking(byte[] script) {
        ScriptSolution solution = StandardScripts.solve(script);
        int required = solution.requiredSignatures();
        return new ScriptView(ScriptParser.toAsm(script), BytesUtils.toHexString(script),
                required > 0 ? required : null, solution.type().typeName());
    }
}
