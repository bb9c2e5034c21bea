package com.ralphtown.dispatch.api;

public record CommitRequest(String message) {}
