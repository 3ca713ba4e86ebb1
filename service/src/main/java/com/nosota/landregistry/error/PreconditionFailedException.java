package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;
import lombok.Getter;

import java.util.List;

/**
 * A transition was attempted before its preconditions hold.
 *
 * <p>The message names every missing condition so that the officer knows what is still outstanding.
 */
@Getter
public class PreconditionFailedException extends RegistryException {

    private final List<String> missingConditions;

    public PreconditionFailedException(String operation, List<String> missingConditions) {
        super(ErrorKind.PRECONDITION_FAILED,
                "Cannot " + operation + ": " + String.join(", ", missingConditions));
        this.missingConditions = List.copyOf(missingConditions);
    }
}
