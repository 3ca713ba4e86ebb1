package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

/**
 * The requested status transition is not legal from the current state.
 */
public class InvalidStateException extends RegistryException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
