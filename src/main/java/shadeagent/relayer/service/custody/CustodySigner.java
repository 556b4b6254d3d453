package shadeagent.relayer.service.custody;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.exception.FlowExecutionException;
import shadeagent.relayer.util.SignatureEncoding;

/**
 * Requests signatures for custodied accounts and serializes all work done on behalf of the
 * same derivation path, so two intents never race on one account's blockhash or nonce.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustodySigner {

    private final ChainSignatureClient signatureClient;
    private final ConcurrentHashMap<String, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding the lock of every given path. Locks are taken
     * in sorted order.
     */
    public <T> T withPathLocks(Collection<String> paths, Supplier<T> action) {
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (String path : new TreeSet<>(paths)) {
                ReentrantLock lock = pathLocks.computeIfAbsent(path, key -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    /**
     * Signs {@code messageHex} with each path's key, keeping the order of {@code signerPaths}
     * (index 0 is the fee payer).
     */
    public List<byte[]> signAll(String messageHex, List<String> signerPaths) {
        List<byte[]> signatures = new ArrayList<>(signerPaths.size());
        for (String path : signerPaths) {
            String encoded = signatureClient.requestSignature(path, messageHex, KeyType.EDDSA);
            try {
                signatures.add(SignatureEncoding.decodeSignature(encoded));
            } catch (IllegalArgumentException e) {
                throw new FlowExecutionException("sign", "Unusable signature for path " + path + ": " + e.getMessage(), e);
            }
        }
        log.debug("Collected {} custody signatures", signatures.size());
        return signatures;
    }

    public String deriveAddress(String path) {
        return signatureClient.deriveAddress(path);
    }

    boolean isLocked(String path) {
        ReentrantLock lock = pathLocks.get(path);
        return lock != null && lock.isLocked();
    }
}
