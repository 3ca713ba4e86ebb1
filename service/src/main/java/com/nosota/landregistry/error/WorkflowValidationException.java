package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

/**
 * A required field is missing or malformed, e.g. a blank rejection reason.
 */
public class WorkflowValidationException extends RegistryException {

    public WorkflowValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
