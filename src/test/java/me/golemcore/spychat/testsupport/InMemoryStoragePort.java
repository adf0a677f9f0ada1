package me.golemcore.spychat.testsupport;

import me.golemcore.spychat.port.outbound.StoragePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory StoragePort for service tests. Operations complete
 * synchronously on the calling thread.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(files.containsKey(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        files.remove(key(directory, path));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String dirPrefix = directory + "/";
        List<String> result = files.keySet().stream()
                .filter(k -> k.startsWith(dirPrefix))
                .map(k -> k.substring(dirPrefix.length()))
                .filter(p -> prefix == null || prefix.isEmpty() || p.startsWith(prefix))
                .sorted()
                .toList();
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        files.put(key(directory, path), content);
        writes.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.completedFuture(null);
    }

    public void seed(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public int writeCount() {
        return writes.get();
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
