package org.driptable.service.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.driptable.models.enums.ValidationScope;

import java.util.Collection;
import java.util.stream.Collectors;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(ValidationScope scope, String columnKey, String message) {

    public static ValidationError prop(String message) {
        return new ValidationError(ValidationScope.PROP, null, message);
    }

    public static ValidationError column(String columnKey, String message) {
        return new ValidationError(ValidationScope.COLUMN, columnKey, message);
    }

    public boolean failsTable() {
        return scope == ValidationScope.PROP;
    }

    public static String join(Collection<ValidationError> errors) {
        return errors.stream().map(ValidationError::message).collect(Collectors.joining("\n"));
    }
}
