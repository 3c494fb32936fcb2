package org.tfregistry.security.oauth;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Seals and opens SCM secrets (access tokens, refresh tokens, OAuth client secrets) with AES-256-GCM.
 * <p>
 * Ciphertext is Base64 of {@code iv || ciphertext+tag}. Encryption always uses the current key;
 * decryption falls back to the previous key so values sealed before a key rotation stay readable.
 * The empty string seals to the empty string and opens to the empty string.
 */
public class TokenEncryptionService {

    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey currentKey;
    private final SecretKey previousKey;

    public TokenEncryptionService(String base64Key, String base64PreviousKey) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("Encryption key must be configured");
        }
        this.currentKey = toKey(base64Key);
        this.previousKey = base64PreviousKey == null || base64PreviousKey.isBlank()
                ? null
                : toKey(base64PreviousKey);
    }

    public String encrypt(String data) throws GeneralSecurityException {
        if (data == null || data.isEmpty()) {
            return "";
        }
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.ENCRYPT_MODE, currentKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        byte[] encrypted = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));

        byte[] encryptedWithIv = new byte[iv.length + encrypted.length];
        System.arraycopy(iv, 0, encryptedWithIv, 0, iv.length);
        System.arraycopy(encrypted, 0, encryptedWithIv, iv.length, encrypted.length);
        return Base64.getEncoder().encodeToString(encryptedWithIv);
    }

    public String decrypt(String encrypted) throws GeneralSecurityException {
        if (encrypted == null || encrypted.isEmpty()) {
            return "";
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Ciphertext is not valid Base64", e);
        }
        if (decoded.length <= GCM_IV_LENGTH) {
            throw new GeneralSecurityException("Ciphertext is too short");
        }

        try {
            return decryptWith(currentKey, decoded);
        } catch (AEADBadTagException e) {
            if (previousKey == null) {
                throw e;
            }
            return decryptWith(previousKey, decoded);
        }
    }

    private String decryptWith(SecretKey key, byte[] decoded) throws GeneralSecurityException {
        byte[] iv = new byte[GCM_IV_LENGTH];
        byte[] encryptedBytes = new byte[decoded.length - GCM_IV_LENGTH];
        System.arraycopy(decoded, 0, iv, 0, GCM_IV_LENGTH);
        System.arraycopy(decoded, GCM_IV_LENGTH, encryptedBytes, 0, encryptedBytes.length);

        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return new String(cipher.doFinal(encryptedBytes), StandardCharsets.UTF_8);
    }

    private static SecretKey toKey(String base64Key) {
        byte[] keyBytes = Base64.getDecoder().decode(base64Key.trim());
        if (keyBytes.length != 32) {
            throw new IllegalArgumentException("Encryption key must be 256 bits, got " + keyBytes.length * 8);
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
