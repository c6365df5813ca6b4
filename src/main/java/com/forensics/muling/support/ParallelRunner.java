package com.forensics.muling.support;

import com.forensics.muling.exception.DetectionExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fans read-only per-account work out over a worker pool. Each task owns a disjoint slice of the
 * input and returns its own map; slices are merged on the calling thread after every task has
 * finished, so workers never share mutable state.
 */
@Slf4j
public class ParallelRunner {

    private final ExecutorService executor;
    private final int parallelism;

    public ParallelRunner(ExecutorService executor, int parallelism) {
        this.executor = executor;
        this.parallelism = Math.max(1, parallelism);
    }

    /** Runs everything on the calling thread. */
    public static ParallelRunner sameThread() {
        return new ParallelRunner(null, 1);
    }

    public int getParallelism() {
        return executor == null ? 1 : parallelism;
    }

    /**
     * Applies {@code work} to every key and collects the non-null results into a sorted map.
     */
    public <R> SortedMap<String, R> mapByKey(List<String> keys, Function<String, R> work) {
        SortedMap<String, R> merged = new TreeMap<>();
        if (keys.isEmpty()) return merged;
        List<List<String>> slices = partition(keys);
        if (slices.size() == 1) {
            merged.putAll(runSlice(slices.get(0), work));
            return merged;
        }
        List<Future<Map<String, R>>> futures = new ArrayList<>(slices.size());
        for (List<String> slice : slices) {
            futures.add(executor.submit(() -> runSlice(slice, work)));
        }
        for (Future<Map<String, R>> future : futures) {
            merged.putAll(await(future));
        }
        return merged;
    }

    /**
     * Applies {@code work} to every item; the returned list is in input order regardless of which
     * worker finished first.
     */
    public <T, R> List<R> mapInOrder(List<T> items, Function<T, R> work) {
        List<R> results = new ArrayList<>(items.size());
        if (executor == null || parallelism == 1 || items.size() <= 1) {
            for (T item : items) results.add(work.apply(item));
            return results;
        }
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> work.apply(item)));
        }
        for (Future<R> future : futures) {
            results.add(await(future));
        }
        return results;
    }

    private List<List<String>> partition(List<String> keys) {
        int slices = executor == null ? 1 : Math.min(parallelism, keys.size());
        List<List<String>> result = new ArrayList<>(slices);
        int size = (keys.size() + slices - 1) / slices;
        for (int start = 0; start < keys.size(); start += size) {
            result.add(keys.subList(start, Math.min(keys.size(), start + size)));
        }
        return result;
    }

    private static <R> Map<String, R> runSlice(List<String> slice, Function<String, R> work) {
        Map<String, R> out = new LinkedHashMap<>();
        for (String key : slice) {
            R value = work.apply(key);
            if (value != null) out.put(key, value);
        }
        return out;
    }

    private static <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectionExecutionException("Interrupted while waiting for detection worker", e);
        } catch (ExecutionException e) {
            log.error("Detection worker failed", e.getCause());
            throw new DetectionExecutionException("Detection worker failed: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
