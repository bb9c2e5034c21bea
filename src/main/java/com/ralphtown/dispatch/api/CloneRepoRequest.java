package com.ralphtown.dispatch.api;

public record CloneRepoRequest(String url) {}
