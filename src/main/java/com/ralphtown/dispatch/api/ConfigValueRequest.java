package com.ralphtown.dispatch.api;

public record ConfigValueRequest(String value) {}
