package com.poker.tracker.validation;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {

    ValidationStatus status;
    ImmutableList<String> reasons;

    public static ValidationResult accepted() {
        return new ValidationResult(ValidationStatus.ACCEPTED, ImmutableList.of());
    }

    public static ValidationResult duplicate() {
        return new ValidationResult(ValidationStatus.DUPLICATE, ImmutableList.of());
    }

    public static ValidationResult rejected(List<String> reasons) {
        return new ValidationResult(ValidationStatus.REJECTED, ImmutableList.copyOf(reasons));
    }

    public boolean isAccepted() {
        return status == ValidationStatus.ACCEPTED;
    }
}
