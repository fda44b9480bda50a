package com.example.resumeparser.domain.model;

public enum StageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    SKIPPED
}
