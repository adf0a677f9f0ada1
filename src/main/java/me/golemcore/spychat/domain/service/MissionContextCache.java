package me.golemcore.spychat.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.CacheEntry;
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.ToolResult;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Memoizes mission lookups so each distinct key is fetched at most once.
 *
 * <p>
 * The first caller for a key installs a pending future and runs the fetch;
 * concurrent callers for the same key wait on that future and observe the same
 * settled {@link ToolResult}. Error results are cached like successes. A fetch
 * that throws is settled as an error result. Timeouts are the one exception:
 * waiters share the timeout result but the entry is dropped, so the next turn
 * retries.
 *
 * <p>
 * With a positive {@code spychat.cache.error-ttl}, cached errors expire after
 * that duration; the default zero keeps them until {@link #invalidate(String)}
 * or {@link #clear()}.
 */
@Service
@Slf4j
public class MissionContextCache {

    private static final ObjectMapper KEY_MAPPER = new ObjectMapper();

    private final Map<String, CompletableFuture<CacheEntry>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration errorTtl;

    @Autowired
    public MissionContextCache(Clock clock, SpyChatProperties properties) {
        this(clock, properties.getCache().getErrorTtl());
    }

    public MissionContextCache(Clock clock, Duration errorTtl) {
        this.clock = clock;
        this.errorTtl = errorTtl != null ? errorTtl : Duration.ZERO;
    }

    /**
     * Returns the cached result for {@code key}, running {@code fetch} only if no
     * settled or in-flight entry exists.
     */
    public CompletableFuture<ToolResult> getAsync(String key, Supplier<CompletableFuture<ToolResult>> fetch) {
        while (true) {
            CompletableFuture<CacheEntry> existing = entries.get(key);
            if (existing != null) {
                if (isExpired(existing)) {
                    entries.remove(key, existing);
                    continue;
                }
                log.debug("[MissionCache] Hit for {}", key);
                return existing.thenApply(CacheEntry::value);
            }

            CompletableFuture<CacheEntry> pending = new CompletableFuture<>();
            if (entries.putIfAbsent(key, pending) != null) {
                continue;
            }

            log.debug("[MissionCache] Miss for {}, fetching", key);
            startFetch(key, fetch, pending);
            return pending.thenApply(CacheEntry::value);
        }
    }

    /**
     * Blocking variant of {@link #getAsync(String, Supplier)} for synchronous
     * fetches.
     */
    public ToolResult get(String key, Supplier<ToolResult> fetch) {
        CompletableFuture<ToolResult> result = getAsync(key, () -> CompletableFuture.completedFuture(fetch.get()));
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Interrupted while waiting for " + key);
        } catch (ExecutionException e) {
            // pending futures are always completed normally
            throw new IllegalStateException("Cache entry failed unexpectedly: " + key, e.getCause());
        }
    }

    public void invalidate(String key) {
        if (entries.remove(key) != null) {
            log.debug("[MissionCache] Invalidated {}", key);
        }
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Builds a cache key from a tool name and its arguments: map keys sorted,
     * string values trimmed, so equivalent invocations share an entry.
     */
    public static String cacheKey(String toolName, Map<String, Object> arguments) {
        Object normalized = normalize(arguments != null ? arguments : Map.of());
        try {
            return toolName + ":" + KEY_MAPPER.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            return toolName + ":" + normalized;
        }
    }

    private void startFetch(String key, Supplier<CompletableFuture<ToolResult>> fetch,
            CompletableFuture<CacheEntry> pending) {
        CompletableFuture<ToolResult> fetched;
        try {
            fetched = fetch.get();
            if (fetched == null) {
                fetched = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) { // NOSONAR - settled as an error result below
            fetched = CompletableFuture.failedFuture(e);
        }

        fetched.handle((result, error) -> settle(key, result, error))
                .thenAccept(entry -> {
                    if (entry.value().getFailureKind() == ToolFailureKind.TIMEOUT) {
                        entries.remove(key, pending);
                    }
                    pending.complete(entry);
                });
    }

    private CacheEntry settle(String key, ToolResult result, Throwable error) {
        ToolResult value;
        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("[MissionCache] Fetch failed for {}: {}", key, cause.getMessage());
            ToolFailureKind kind = cause instanceof TimeoutException
                    ? ToolFailureKind.TIMEOUT
                    : ToolFailureKind.EXECUTION_FAILED;
            value = ToolResult.failure(kind, "Tool call failed: " + describe(cause));
        } else if (result == null) {
            value = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        } else {
            value = result;
        }
        return new CacheEntry(key, value, clock.instant());
    }

    private boolean isExpired(CompletableFuture<CacheEntry> future) {
        if (errorTtl.isZero() || errorTtl.isNegative() || !future.isDone()) {
            return false;
        }
        CacheEntry entry = future.getNow(null);
        if (entry == null || entry.value().isSuccess()) {
            return false;
        }
        return !clock.instant().isBefore(entry.insertedAt().plus(errorTtl));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object element : list) {
                normalized.add(normalize(element));
            }
            return normalized;
        }
        if (value instanceof String text) {
            return text.trim();
        }
        return value;
    }
}
