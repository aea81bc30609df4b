package com.example.pairprog.execution;

/**
 * Outcome of one sandbox run. {@code error} is null when neither compile nor run wrote to stderr.
 * {@code executionTime} is wall-clock seconds.
 */
public record ExecutionResult(String output, String error, double executionTime) {

    public static ExecutionResult failure(String error, double executionTime) {
        return new ExecutionResult("", error, executionTime);
    }
}
