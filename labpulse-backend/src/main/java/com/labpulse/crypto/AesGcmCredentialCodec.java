package com.labpulse.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.model.DriverCredentials;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM codec with a PBKDF2-derived key.
 *
 * <p>Blob layout is {@code salt:iv:authTag:ciphertext}, each part base64 encoded. A fresh salt and IV are
 * generated per blob, so the key is re-derived on every call.
 */
@Component
public class AesGcmCredentialCodec implements CredentialCodec {

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int SALT_LENGTH = 64;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_BITS = 256;
    private static final int ITERATIONS = 100_000;

    private final String secret;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public AesGcmCredentialCodec(
            @Value("${labpulse.credentials.secret:}") String secret,
            ObjectMapper objectMapper
    ) {
        this.secret = secret;
        this.objectMapper = objectMapper;
    }

    @Override
    public DriverCredentials decrypt(String ciphertext) {
        requireSecret();
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new CredentialDecryptionException("Credential blob is empty");
        }

        String[] parts = ciphertext.trim().split(":");
        if (parts.length != 4 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty() || parts[3].isEmpty()) {
            throw new CredentialDecryptionException("Invalid encrypted text format");
        }

        String plaintext;
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] salt = decoder.decode(parts[0]);
            byte[] iv = decoder.decode(parts[1]);
            byte[] tag = decoder.decode(parts[2]);
            byte[] body = decoder.decode(parts[3]);

            // JCE expects the tag appended to the ciphertext.
            byte[] sealed = new byte[body.length + tag.length];
            System.arraycopy(body, 0, sealed, 0, body.length);
            System.arraycopy(tag, 0, sealed, body.length, tag.length);

            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            plaintext = new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialDecryptionException("Decryption failed: " + e.getMessage(), e);
        }

        try {
            return objectMapper.readValue(plaintext, DriverCredentials.class);
        } catch (JsonProcessingException e) {
            throw new CredentialDecryptionException("Decrypted credentials are not valid JSON", e);
        }
    }

    @Override
    public String encrypt(DriverCredentials credentials) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("labpulse.credentials.secret is not configured");
        }
        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(credentials);
            byte[] salt = new byte[SALT_LENGTH];
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(salt);
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            int bodyLength = sealed.length - TAG_LENGTH;
            byte[] body = new byte[bodyLength];
            byte[] tag = new byte[TAG_LENGTH];
            System.arraycopy(sealed, 0, body, 0, bodyLength);
            System.arraycopy(sealed, bodyLength, tag, 0, TAG_LENGTH);

            Base64.Encoder encoder = Base64.getEncoder();
            return String.join(":",
                    encoder.encodeToString(salt),
                    encoder.encodeToString(iv),
                    encoder.encodeToString(tag),
                    encoder.encodeToString(body));
        } catch (JsonProcessingException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credentials", e);
        }
    }

    private SecretKeySpec deriveKey(byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), salt, ITERATIONS, KEY_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    private void requireSecret() {
        if (secret == null || secret.isBlank()) {
            throw new CredentialDecryptionException("labpulse.credentials.secret is not configured");
        }
    }
}
