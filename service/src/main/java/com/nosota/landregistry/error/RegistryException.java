package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;
import lombok.Getter;

/**
 * Base class of every workflow failure. The {@link ErrorKind} decides the HTTP status.
 */
@Getter
public abstract class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    protected RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
