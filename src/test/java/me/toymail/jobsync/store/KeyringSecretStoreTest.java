package me.toymail.jobsync.store;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class KeyringSecretStoreTest {

    @Test
    public void testIsAvailable_WhenKeyringSupported() {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            mockedKeyring.when(Keyring::create).thenReturn(mock(Keyring.class));

            assertTrue(new KeyringSecretStore().isAvailable());
        }
    }

    @Test
    public void testIsAvailable_WhenKeyringNotSupported() {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            mockedKeyring.when(Keyring::create).thenThrow(new BackendNotSupportedException("No backend"));

            KeyringSecretStore store = new KeyringSecretStore();

            assertFalse(store.isAvailable());
            assertFalse(store.getPassword("cred-1").isPresent());
            assertFalse(store.setPassword("cred-1", "pw"));
            assertFalse(store.deletePassword("cred-1"));
        }
    }

    @Test
    public void testGetPassword_KeyedByCredentialId() throws Exception {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            Keyring keyring = mock(Keyring.class);
            mockedKeyring.when(Keyring::create).thenReturn(keyring);
            when(keyring.getPassword("jobsync", "cred-1")).thenReturn("secret123");

            Optional<String> result = new KeyringSecretStore().getPassword("cred-1");

            assertEquals(Optional.of("secret123"), result);
            verify(keyring).getPassword("jobsync", "cred-1");
        }
    }

    @Test
    public void testGetPassword_AccessException() throws Exception {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            Keyring keyring = mock(Keyring.class);
            mockedKeyring.when(Keyring::create).thenReturn(keyring);
            when(keyring.getPassword("jobsync", "cred-1")).thenThrow(new PasswordAccessException("Access denied"));

            assertFalse(new KeyringSecretStore().getPassword("cred-1").isPresent());
        }
    }

    @Test
    public void testSetPassword_Success() throws Exception {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            Keyring keyring = mock(Keyring.class);
            mockedKeyring.when(Keyring::create).thenReturn(keyring);

            assertTrue(new KeyringSecretStore().setPassword("cred-1", "newpassword"));
            verify(keyring).setPassword("jobsync", "cred-1", "newpassword");
        }
    }

    @Test
    public void testSetPassword_AccessException() throws Exception {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            Keyring keyring = mock(Keyring.class);
            mockedKeyring.when(Keyring::create).thenReturn(keyring);
            doThrow(new PasswordAccessException("Cannot save"))
                    .when(keyring).setPassword("jobsync", "cred-1", "newpassword");

            assertFalse(new KeyringSecretStore().setPassword("cred-1", "newpassword"));
        }
    }

    @Test
    public void testDeletePassword_Success() throws Exception {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            Keyring keyring = mock(Keyring.class);
            mockedKeyring.when(Keyring::create).thenReturn(keyring);

            assertTrue(new KeyringSecretStore().deletePassword("cred-1"));
            verify(keyring).deletePassword("jobsync", "cred-1");
        }
    }
}
