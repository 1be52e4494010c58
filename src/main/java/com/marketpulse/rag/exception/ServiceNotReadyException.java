package com.marketpulse.rag.exception;

public class ServiceNotReadyException extends RuntimeException {

    public ServiceNotReadyException() {
        super("Retrieval service is not initialized");
    }
}
