package io.ecsexporter.core.api;

/**
 * A named resource the API could not resolve inside an otherwise successful describe call.
 */
public record ResourceFailure(String arn, String reason, String detail) {
}
