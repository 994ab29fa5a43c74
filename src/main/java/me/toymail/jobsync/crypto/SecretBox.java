package me.toymail.jobsync.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM sealing of short secrets:
 * - key: SHA-256 of the configured passphrase
 * - nonce: random 12 bytes, stored next to the ciphertext
 * - aad: the secret's name, so a value cannot be moved to another entry
 */
public final class SecretBox {
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final byte[] key;
    private final SecureRandom random = new SecureRandom();

    public record Sealed(String nonceB64, String ciphertextB64) {}

    public SecretBox(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            throw new IllegalArgumentException("passphrase is required");
        }
        try {
            this.key = sha256(passphrase.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public Sealed seal(String name, String plaintext) throws GeneralSecurityException {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        byte[] ct = aesGcmEncrypt(key, nonce, aad(name), plaintext.getBytes(StandardCharsets.UTF_8));
        Base64.Encoder b64 = Base64.getEncoder();
        return new Sealed(b64.encodeToString(nonce), b64.encodeToString(ct));
    }

    public String open(String name, Sealed sealed) throws GeneralSecurityException {
        Base64.Decoder b64 = Base64.getDecoder();
        byte[] pt = aesGcmDecrypt(key, b64.decode(sealed.nonceB64()), aad(name), b64.decode(sealed.ciphertextB64()));
        return new String(pt, StandardCharsets.UTF_8);
    }

    private static byte[] aad(String name) {
        return ("jobsync-secret|" + name).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] aesGcmEncrypt(byte[] key, byte[] nonce, byte[] aad, byte[] plaintext) throws GeneralSecurityException {
        Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
        c.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
        c.updateAAD(aad);
        return c.doFinal(plaintext);
    }

    private static byte[] aesGcmDecrypt(byte[] key, byte[] nonce, byte[] aad, byte[] ciphertext) throws GeneralSecurityException {
        Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
        c.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
        c.updateAAD(aad);
        return c.doFinal(ciphertext);
    }

    private static byte[] sha256(byte[] in) throws GeneralSecurityException {
        return MessageDigest.getInstance("SHA-256").digest(in);
    }
}
