package com.memorygraph.store;

import com.memorygraph.shared.StorageUnavailableException;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

public class StorageRetry {

    private static final long MAX_BACKOFF_MS = 5_000;

    @FunctionalInterface
    public interface IoAction<T> {
        T run() throws IOException;
    }

    public static <T> T execute(String what, IoAction<T> action, int maxRetries, long baseDelayMs) {
        IOException last = null;
        long delay = Math.max(baseDelayMs, 1);

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.run();
            } catch (IOException e) {
                last = e;
                if (isNonRetryable(e)) break;
                if (attempt < maxRetries) {
                    sleep(delay, what);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw new StorageUnavailableException("Storage unavailable: " + what, last);
    }

    static boolean isNonRetryable(IOException e) {
        return e instanceof AccessDeniedException
                || e instanceof NotDirectoryException
                || e instanceof NoSuchFileException;
    }

    private static void sleep(long ms, String what) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted during retry: " + what, ie);
        }
    }
}
