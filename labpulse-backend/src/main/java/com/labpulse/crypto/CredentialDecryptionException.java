package com.labpulse.crypto;

import com.labpulse.driver.ConfigurationException;

/**
 * Thrown when a stored credential blob cannot be decrypted or parsed.
 */
public class CredentialDecryptionException extends ConfigurationException {
    public CredentialDecryptionException(String message) {
        super(message);
    }

    public CredentialDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
