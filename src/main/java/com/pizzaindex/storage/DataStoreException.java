package com.pizzaindex.storage;

/**
 * Raised when the external store answers with a non-2xx status or cannot be reached.
 * Aborts the current request only.
 */
public class DataStoreException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public DataStoreException(int status, String responseBody) {
        super("Data store returned HTTP " + status);
        this.status = status;
        this.responseBody = responseBody;
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }

    /** HTTP status from the store, 0 for transport failures. */
    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
