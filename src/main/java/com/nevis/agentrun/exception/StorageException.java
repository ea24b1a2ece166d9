package com.nevis.agentrun.exception;

import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Runs a store operation, translating data access failures into {@link StorageException}.
     */
    public static <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Storage unavailable during " + operation, e);
        }
    }
}
