package com.example.reconcile.field;

import com.example.reconcile.model.NormalizationFailure;
import com.example.reconcile.model.TypedValue;

/**
 * What a {@link FieldHandler} made of a raw value.
 */
public record NormalizationOutcome(
        TypedValue value,
        NormalizationFailure failure,
        String strictViolation,
        String ruleId
) {
    public static NormalizationOutcome strict(TypedValue value, String ruleId) {
        return new NormalizationOutcome(value, null, null, ruleId);
    }

    public static NormalizationOutcome plausible(TypedValue value, String violation, String ruleId) {
        return new NormalizationOutcome(value, null, violation, ruleId);
    }

    public static NormalizationOutcome failed(String reason, String ruleId) {
        return new NormalizationOutcome(null, new NormalizationFailure(reason, ruleId), null, ruleId);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
