package com.securehealth.infrastructure.keyvault;

import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.crypto.KeyUnavailableException;
import com.securehealth.support.PhiTestFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DefaultKeyVaultTest {

    private final PhiTestFixtures fixtures = new PhiTestFixtures();

    @Test
    void createsKeyOnFirstUseAndReusesIt() {
        DataKey first = fixtures.keyVault.getOrCreateDataKey("k");
        DataKey second = fixtures.keyVault.getOrCreateDataKey("k");

        assertEquals(first.getId(), second.getId());
        assertEquals("k", first.getAltName());
        assertEquals(LocalMasterKeyProvider.PROVIDER_NAME, first.getMasterKeyProvider());
        assertEquals(1, fixtures.keyStore.size());
        assertEquals(1, fixtures.audit.eventsOf(AuditEventKind.DATA_KEY_CREATED).size());
        assertEquals(1.0, fixtures.meterRegistry.counter("phi.keys.created").count());
    }

    @Test
    void concurrentCallersResolveToOneKey() throws Exception {
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DataKey>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<DataKey> call = () -> {
                    start.await();
                    return fixtures.keyVault.getOrCreateDataKey("k");
                };
                futures.add(executor.submit(call));
            }
            start.countDown();

            UUID expected = futures.get(0).get(10, TimeUnit.SECONDS).getId();
            for (Future<DataKey> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS).getId());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, fixtures.keyStore.size());
        assertEquals(1, fixtures.audit.eventsOf(AuditEventKind.DATA_KEY_CREATED).size());
    }

    @Test
    void losingTheInsertRaceAdoptsTheWinner() {
        DataKey winner = DataKey.builder().id(UUID.randomUUID()).altName("k").keyMaterial(new byte[1]).build();
        KeyVaultStore store = mock(KeyVaultStore.class);
        when(store.findByAltName("k")).thenReturn(Optional.empty(), Optional.of(winner));
        when(store.insert(any())).thenReturn(KeyVaultStore.InsertOutcome.CONFLICT);

        DataKey resolved = fixtures.keyVault(store).getOrCreateDataKey("k");

        assertSame(winner, resolved);
        verify(store, times(1)).insert(any());
        assertTrue(fixtures.audit.eventsOf(AuditEventKind.DATA_KEY_CREATED).isEmpty());
    }

    @Test
    void givesUpAfterRepeatedConflicts() {
        KeyVaultStore store = mock(KeyVaultStore.class);
        when(store.findByAltName(anyString())).thenReturn(Optional.empty());
        when(store.insert(any())).thenReturn(KeyVaultStore.InsertOutcome.CONFLICT);

        assertThrows(KeyUnavailableException.class, () -> fixtures.keyVault(store).getOrCreateDataKey("k"));
        verify(store, times(DefaultKeyVault.MAX_CREATE_ATTEMPTS)).insert(any());
    }

    @Test
    void storeOutagePropagatesAsKeyUnavailable() {
        KeyVaultStore store = mock(KeyVaultStore.class);
        when(store.findByAltName(anyString())).thenThrow(new KeyUnavailableException("unreachable"));

        assertThrows(KeyUnavailableException.class, () -> fixtures.keyVault(store).getOrCreateDataKey("k"));
    }

    @Test
    void storedKeyMaterialIsWrapped() {
        DataKey key = fixtures.keyVault.getOrCreateDataKey("k");

        byte[] plain = fixtures.keyVault.keyMaterial(key);

        assertEquals(96, plain.length);
        assertNotEquals(96, key.getKeyMaterial().length);
        assertFalse(key.toString().contains("keyMaterial"));
    }

    @Test
    void findsKeysByIdAndCachesThem() {
        DataKey created = fixtures.keyVault.getOrCreateDataKey("k");
        KeyVaultStore store = spy(fixtures.keyStore);
        DefaultKeyVault vault = fixtures.keyVault(store);

        assertEquals(created.getId(), vault.findDataKey(created.getId()).orElseThrow().getId());
        assertEquals(created.getId(), vault.findDataKey(created.getId()).orElseThrow().getId());
        assertTrue(vault.findDataKey(UUID.randomUUID()).isEmpty());

        verify(store, times(1)).findById(created.getId());
    }

    @Test
    void keyWrappedUnderAnotherMasterKeyIsUnavailable() {
        DataKey key = fixtures.keyVault.getOrCreateDataKey("k");
        PhiTestFixtures other = new PhiTestFixtures();

        assertThrows(KeyUnavailableException.class, () -> other.keyVault.keyMaterial(key));
    }
}
