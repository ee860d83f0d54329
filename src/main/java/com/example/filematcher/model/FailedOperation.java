package com.example.filematcher.model;

public record FailedOperation(
        String path,
        String error
) {
}
