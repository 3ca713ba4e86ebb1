package com.nosota.landregistry.error;

import com.nosota.landregistry.api.model.ErrorKind;

import java.math.BigDecimal;

public class InvalidAmountException extends RegistryException {

    public InvalidAmountException(BigDecimal amount) {
        super(ErrorKind.INVALID_AMOUNT, "Payment amount must be positive, got: " + amount);
    }
}
