package io.osquerymcp.core.args;

import io.osquerymcp.core.OsQueryException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when raw tool arguments do not satisfy the tool's argument model.
 */
public class ArgumentValidationException extends OsQueryException {

    private final List<ValidationError> errors;

    public ArgumentValidationException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
