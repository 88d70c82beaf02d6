package com.compareai.core.model;

public record BackendMetadata(
    String backendKey,
    String displayName,
    String model,
    double processingTimeSeconds,
    double costUsd,
    boolean error) {}
