package com.barvault.dataservice.fetch;

public enum FetchStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
