package io.stackcontroller.lease;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.PutOption;
import io.stackcontroller.store.EtcdPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Leases backed by etcd. Each key is written with an etcd lease of the requested TTL, so
 * etcd deletes it by itself once the holder stops renewing. Writes are guarded by
 * transactions: create only when absent, delete only while the stored holder matches.
 */
@Slf4j
public class EtcdLeaseStore implements LeaseStore, AutoCloseable {

    private static final int ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final Client etcdClient;
    private final KV kvClient;
    private final Lease leaseClient;
    private final EtcdPathResolver pathResolver;

    public EtcdLeaseStore(Client etcdClient, EtcdPathResolver pathResolver) {
        this.etcdClient = etcdClient;
        this.kvClient = etcdClient.getKVClient();
        this.leaseClient = etcdClient.getLeaseClient();
        this.pathResolver = pathResolver;
        log.info("EtcdLeaseStore initialized under {}", pathResolver.getNamespace());
    }

    public static EtcdLeaseStore connect(String[] endpoints, String namespace) {
        return new EtcdLeaseStore(Client.builder().endpoints(endpoints).build(), new EtcdPathResolver(namespace));
    }

    @Override
    public void close() {
        log.info("Closing lease store connection");
        etcdClient.close();
    }

    @Override
    public boolean tryAcquireLease(String key, String holder, Duration ttl) throws LeaseException {
        Optional<KeyValue> current = read(key);
        if (current.isPresent()) {
            if (!holder.equals(current.get().getValue().toString(UTF_8))) {
                return false;
            }
            return keepAlive(key, current.get().getLease());
        }

        long leaseId = await(leaseClient.grant(ttlSeconds(ttl)), "grant lease for " + key).getID();
        ByteSequence path = bytes(pathResolver.getLeasePath(key));
        TxnResponse txn = await(kvClient.txn()
                .If(new Cmp(path, Cmp.Op.EQUAL, CmpTarget.version(0)))
                .Then(Op.put(path, bytes(holder), PutOption.newBuilder().withLeaseId(leaseId).build()))
                .commit(), "acquire " + key);
        if (!txn.isSucceeded()) {
            await(leaseClient.revoke(leaseId), "revoke unused lease for " + key);
            return false;
        }
        log.debug("Lease {} acquired by {} (leaseId: {})", key, holder, leaseId);
        return true;
    }

    @Override
    public boolean renewLease(String key, String holder, Duration ttl) throws LeaseException {
        Optional<KeyValue> current = read(key);
        if (current.isEmpty() || !holder.equals(current.get().getValue().toString(UTF_8))) {
            return false;
        }
        return keepAlive(key, current.get().getLease());
    }

    @Override
    public boolean releaseLease(String key, String holder) throws LeaseException {
        Optional<KeyValue> current = read(key);
        if (current.isEmpty()) {
            return false;
        }
        ByteSequence path = bytes(pathResolver.getLeasePath(key));
        TxnResponse txn = await(kvClient.txn()
                .If(new Cmp(path, Cmp.Op.EQUAL, CmpTarget.value(bytes(holder))))
                .Then(Op.delete(path, DeleteOption.DEFAULT))
                .commit(), "release " + key);
        if (!txn.isSucceeded()) {
            return false;
        }
        long leaseId = current.get().getLease();
        if (leaseId != 0) {
            await(leaseClient.revoke(leaseId), "revoke lease for " + key);
        }
        log.debug("Lease {} released by {}", key, holder);
        return true;
    }

    @Override
    public Optional<String> getHolder(String key) throws LeaseException {
        return read(key).map(kv -> kv.getValue().toString(UTF_8));
    }

    private Optional<KeyValue> read(String key) throws LeaseException {
        GetResponse response = await(kvClient.get(bytes(pathResolver.getLeasePath(key))), "read " + key);
        return response.getKvs().isEmpty() ? Optional.empty() : Optional.of(response.getKvs().get(0));
    }

    private boolean keepAlive(String key, long leaseId) throws LeaseException {
        if (leaseId == 0) {
            return true;
        }
        LeaseKeepAliveResponse response = await(leaseClient.keepAliveOnce(leaseId), "renew " + key);
        return response.getTTL() > 0;
    }

    private static long ttlSeconds(Duration ttl) {
        return Math.max(1L, (ttl.toMillis() + 999) / 1000);
    }

    private <T> T await(CompletableFuture<T> future, String action) throws LeaseException {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaseException("Interrupted during " + action, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new LeaseException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }
}
