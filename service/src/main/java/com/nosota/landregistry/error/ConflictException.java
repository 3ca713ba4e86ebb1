package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

/**
 * Duplicate resource or re-transition of an entity that is already in the requested or a terminal state.
 */
public class ConflictException extends RegistryException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
