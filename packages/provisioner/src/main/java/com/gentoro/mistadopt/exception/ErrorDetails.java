package com.gentoro.mistadopt.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, loggable view of an error. */
public record ErrorDetails(
    String type,
    String message,
    ProvisionerErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
