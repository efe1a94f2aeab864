package com.switchboard.core.model;

public record RetrainResult(boolean success, int retrained) {}
