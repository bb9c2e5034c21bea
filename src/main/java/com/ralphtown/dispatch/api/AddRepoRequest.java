package com.ralphtown.dispatch.api;

public record AddRepoRequest(String path) {}
