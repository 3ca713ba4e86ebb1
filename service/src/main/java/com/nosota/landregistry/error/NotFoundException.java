package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

import java.util.UUID;

public class NotFoundException extends RegistryException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
