package me.toymail.jobsync.crypto;

import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;

import static org.junit.jupiter.api.Assertions.*;

public class SecretBoxTest {

    @Test
    public void testSealOpen() throws Exception {
        SecretBox box = new SecretBox("passphrase");

        SecretBox.Sealed sealed = box.seal("cred-1", "hunter2");

        assertNotEquals("hunter2", sealed.ciphertextB64());
        assertEquals("hunter2", box.open("cred-1", sealed));
    }

    @Test
    public void testNonceDiffersPerSeal() throws Exception {
        SecretBox box = new SecretBox("passphrase");

        assertNotEquals(box.seal("a", "x").nonceB64(), box.seal("a", "x").nonceB64());
    }

    @Test
    public void testSealedValueBoundToName() throws Exception {
        SecretBox box = new SecretBox("passphrase");
        SecretBox.Sealed sealed = box.seal("cred-1", "hunter2");

        assertThrows(GeneralSecurityException.class, () -> box.open("cred-2", sealed));
    }

    @Test
    public void testWrongPassphrase() throws Exception {
        SecretBox.Sealed sealed = new SecretBox("one").seal("cred-1", "hunter2");

        assertThrows(GeneralSecurityException.class, () -> new SecretBox("two").open("cred-1", sealed));
    }

    @Test
    public void testBlankPassphraseRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SecretBox(" "));
    }
}
