package com.deepcode.backend.service.progress;

public record ObserverHandle(String id) {}
