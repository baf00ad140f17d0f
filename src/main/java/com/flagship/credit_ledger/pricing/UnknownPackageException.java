package com.flagship.credit_ledger.pricing;

public class UnknownPackageException extends RuntimeException {

    public UnknownPackageException(String packageId) {
        super("Unknown package: " + packageId);
    }
}
