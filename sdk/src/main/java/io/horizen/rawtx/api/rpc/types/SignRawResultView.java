package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.horizen.rawtx.combine.CombinationResult;
import io.horizen.rawtx.utils.BytesUtils;

import java.util.List;
import java.util.stream.Collectors;

public class SignRawResultView {
    public final String hex;
    public final boolean complete;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<InputErrorView> errors;

    public SignRawResultView(CombinationResult result) {
        this.hex = BytesUtils.toHexString(result.entity().bytes());
        this.complete = result.isComplete();
        this.errors = result.errors().stream().map(InputErrorView::new).collect(Collectors.toList());
    }
}
