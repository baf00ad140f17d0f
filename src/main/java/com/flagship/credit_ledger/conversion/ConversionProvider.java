package com.flagship.credit_ledger.conversion;

/**
 * External identifier-conversion provider. Invoked only after a successful reservation.
 */
public interface ConversionProvider {

    /**
     * @param installationId normalized 63-digit installation id
     * @return the confirmation id
     * @throws InvalidInstallationIdException if the provider rejects the input
     * @throws ProviderUnavailableException on transient failure
     */
    String convert(String installationId);
}
