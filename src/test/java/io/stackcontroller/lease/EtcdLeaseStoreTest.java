package io.stackcontroller.lease;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Txn;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseGrantResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.lease.LeaseRevokeResponse;
import io.stackcontroller.store.EtcdPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EtcdLeaseStore against a mocked jetcd client.
 */
public class EtcdLeaseStoreTest {

    private static final Duration TTL = Duration.ofSeconds(30);
    private static final String KEY = "entities/beat-leader";

    private Client mockEtcdClient;
    private KV mockKv;
    private Lease mockLease;
    private Txn mockTxn;
    private EtcdPathResolver pathResolver;
    private EtcdLeaseStore store;

    @BeforeEach
    void setUp() {
        mockEtcdClient = mock(Client.class);
        mockKv = mock(KV.class);
        mockLease = mock(Lease.class);
        mockTxn = mock(Txn.class, RETURNS_SELF);
        when(mockEtcdClient.getKVClient()).thenReturn(mockKv);
        when(mockEtcdClient.getLeaseClient()).thenReturn(mockLease);
        when(mockKv.txn()).thenReturn(mockTxn);
        pathResolver = new EtcdPathResolver("stack");
        store = new EtcdLeaseStore(mockEtcdClient, pathResolver);
    }

    // ------------------------- helpers -------------------------

    private void stubStored(String holder, long leaseId) {
        GetResponse response = mock(GetResponse.class);
        if (holder == null) {
            when(response.getKvs()).thenReturn(Collections.emptyList());
        } else {
            KeyValue kv = mock(KeyValue.class);
            when(kv.getValue()).thenReturn(ByteSequence.from(holder, UTF_8));
            when(kv.getLease()).thenReturn(leaseId);
            when(response.getKvs()).thenReturn(List.of(kv));
        }
        when(mockKv.get(ByteSequence.from(pathResolver.getLeasePath(KEY), UTF_8)))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    private void stubTxn(boolean succeeded) {
        TxnResponse response = mock(TxnResponse.class);
        when(response.isSucceeded()).thenReturn(succeeded);
        when(mockTxn.commit()).thenReturn(CompletableFuture.completedFuture(response));
    }

    private void stubGrant(long leaseId) {
        LeaseGrantResponse grant = mock(LeaseGrantResponse.class);
        when(grant.getID()).thenReturn(leaseId);
        when(mockLease.grant(anyLong())).thenReturn(CompletableFuture.completedFuture(grant));
    }

    private void stubRevoke() {
        when(mockLease.revoke(anyLong())).thenReturn(CompletableFuture.completedFuture(mock(LeaseRevokeResponse.class)));
    }

    // ------------------------- tests -------------------------

    @Test
    public void testTryAcquire_FreeKeyIsCreatedWithEtcdLease() throws Exception {
        // Given
        stubStored(null, 0);
        stubGrant(77L);
        stubTxn(true);

        // When
        boolean acquired = store.tryAcquireLease(KEY, "beat-a", TTL);

        // Then
        assertThat(acquired).isTrue();
        verify(mockLease).grant(30L);
        verify(mockLease, never()).revoke(anyLong());
    }

    @Test
    public void testTryAcquire_LostCreateRaceRevokesUnusedLease() throws Exception {
        // Given
        stubStored(null, 0);
        stubGrant(77L);
        stubRevoke();
        stubTxn(false);

        // Then
        assertThat(store.tryAcquireLease(KEY, "beat-a", TTL)).isFalse();
        verify(mockLease).revoke(77L);
    }

    @Test
    public void testTryAcquire_HeldByOtherHolder() throws Exception {
        stubStored("beat-b", 12L);

        assertThat(store.tryAcquireLease(KEY, "beat-a", TTL)).isFalse();
        verify(mockLease, never()).grant(anyLong());
        verify(mockKv, never()).txn();
    }

    @Test
    public void testTryAcquire_OwnLeaseIsKeptAlive() throws Exception {
        // Given
        stubStored("beat-a", 12L);
        LeaseKeepAliveResponse keepAlive = mock(LeaseKeepAliveResponse.class);
        when(keepAlive.getTTL()).thenReturn(30L);
        when(mockLease.keepAliveOnce(12L)).thenReturn(CompletableFuture.completedFuture(keepAlive));

        // Then
        assertThat(store.tryAcquireLease(KEY, "beat-a", TTL)).isTrue();
        verify(mockLease).keepAliveOnce(12L);
    }

    @Test
    public void testRenew_NotHeld() throws Exception {
        stubStored(null, 0);

        assertThat(store.renewLease(KEY, "beat-a", TTL)).isFalse();
    }

    @Test
    public void testRelease_RevokesEtcdLease() throws Exception {
        // Given
        stubStored("beat-a", 12L);
        stubTxn(true);
        stubRevoke();

        // Then
        assertThat(store.releaseLease(KEY, "beat-a")).isTrue();
        verify(mockLease).revoke(12L);
    }

    @Test
    public void testRelease_ValueMismatchLeavesLease() throws Exception {
        stubStored("beat-b", 12L);
        stubTxn(false);

        assertThat(store.releaseLease(KEY, "beat-a")).isFalse();
        verify(mockLease, never()).revoke(anyLong());
    }

    @Test
    public void testGetHolder() throws Exception {
        stubStored("beat-a", 12L);

        assertThat(store.getHolder(KEY)).contains("beat-a");
    }

    @Test
    public void testUnreachableEtcdSurfacesAsLeaseException() {
        when(mockKv.get(any(ByteSequence.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("deadline exceeded")));

        assertThatThrownBy(() -> store.tryAcquireLease(KEY, "beat-a", TTL))
                .isInstanceOf(LeaseException.class)
                .hasMessageContaining("deadline exceeded");
    }

    @Test
    public void testClose_ClosesClient() {
        store.close();

        verify(mockEtcdClient).close();
    }
}
