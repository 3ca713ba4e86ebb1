package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

/**
 * Role or ownership guard failed.
 */
public class ForbiddenOperationException extends RegistryException {

    public ForbiddenOperationException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
