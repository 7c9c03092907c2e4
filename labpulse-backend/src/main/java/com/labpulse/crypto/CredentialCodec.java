package com.labpulse.crypto;

import com.labpulse.model.DriverCredentials;

/**
 * Converts between stored credential blobs and driver credentials.
 *
 * <p>Implementations must be stateless and safe to call from any thread.
 */
public interface CredentialCodec {

    /**
     * Decrypt a stored blob.
     *
     * @param ciphertext blob as stored on the integration row
     * @return decrypted credentials
     * @throws CredentialDecryptionException if the blob is malformed, tampered with, or encrypted with another secret
     */
    DriverCredentials decrypt(String ciphertext);

    /**
     * Encrypt credentials into a blob suitable for storage.
     *
     * @param credentials credentials
     * @return blob
     */
    String encrypt(DriverCredentials credentials);
}
