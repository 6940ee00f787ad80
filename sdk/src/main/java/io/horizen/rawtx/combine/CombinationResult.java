package io.horizen.rawtx.combine;

import io.horizen.rawtx.entity.McEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CombinationResult {
    private final McEntity entity;
    private final List<InputError> errors;

    public CombinationResult(McEntity entity, List<InputError> errors) {
        this.entity = entity;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    // The merged entity, owned by the caller.
    public McEntity entity() {
        return entity;
    }

    public boolean isComplete() {
        return errors.isEmpty();
    }

    public List<InputError> errors() {
        return errors;
    }
}
