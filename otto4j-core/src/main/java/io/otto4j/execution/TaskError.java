package io.otto4j.execution;

public record TaskError(String code, String message) {
}
