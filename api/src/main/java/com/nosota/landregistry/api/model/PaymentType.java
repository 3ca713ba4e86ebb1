package com.nosota.landregistry.api.model;

public enum PaymentType {
    REGISTRATION_FEE,
    TRANSFER_FEE,
    CERTIFICATE_FEE,
    MODIFICATION_FEE;

    /**
     * @return true if this fee is paid against a transfer rather than a property application
     */
    public boolean isTransferScoped() {
        return this == TRANSFER_FEE;
    }
}
