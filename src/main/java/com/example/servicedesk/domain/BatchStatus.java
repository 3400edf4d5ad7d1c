package com.example.servicedesk.domain;

public enum BatchStatus {
    PENDING, READY, PROCESSED, FAILED
}
