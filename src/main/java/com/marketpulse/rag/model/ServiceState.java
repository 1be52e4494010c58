package com.marketpulse.rag.model;

public enum ServiceState {
    UNINITIALIZED,
    READY
}
