package com.polysearch.search.cache;

public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
