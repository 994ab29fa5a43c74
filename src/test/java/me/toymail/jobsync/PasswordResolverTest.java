package me.toymail.jobsync;

import me.toymail.jobsync.store.EmailCredential;
import me.toymail.jobsync.store.SecretStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class PasswordResolverTest {

    private SecretStore secretStore;
    private PasswordResolver resolver;
    private EmailCredential credential;

    @BeforeEach
    void setUp() {
        secretStore = mock(SecretStore.class);
        resolver = new PasswordResolver(secretStore);
        credential = new EmailCredential();
        credential.id = "cred-1";
        credential.address = "user@example.com";
    }

    @Test
    public void testResolve_ExplicitPasswordTakesPriority() {
        when(secretStore.getPassword("cred-1")).thenReturn(Optional.of("stored-password"));

        assertEquals("explicit-password", resolver.resolve("explicit-password", credential));
        verify(secretStore, never()).getPassword(anyString());
    }

    @Test
    public void testResolve_BlankExplicitFallsToSecretStore() {
        when(secretStore.getPassword("cred-1")).thenReturn(Optional.of("stored-password"));

        assertEquals("stored-password", resolver.resolve("   ", credential));
        verify(secretStore).getPassword("cred-1");
    }

    @Test
    public void testResolve_NullExplicitFallsToSecretStore() {
        when(secretStore.getPassword("cred-1")).thenReturn(Optional.of("stored-password"));

        assertEquals("stored-password", resolver.resolve(null, credential));
    }

    @Test
    public void testResolve_ThrowsWhenNothingStored() {
        when(secretStore.getPassword("cred-1")).thenReturn(Optional.empty());

        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> resolver.resolve(null, credential));

        assertTrue(exception.getMessage().contains("user@example.com"));
        assertTrue(exception.getMessage().contains("credential update cred-1 --password"));
    }
}
