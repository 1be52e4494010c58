package com.marketpulse.rag.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class PersistenceException extends RuntimeException {
    private final Path location;

    public PersistenceException(Path location, Throwable cause) {
        super("Snapshot I/O failed at " + location + ": " + cause.getMessage(), cause);
        this.location = location;
    }
}
