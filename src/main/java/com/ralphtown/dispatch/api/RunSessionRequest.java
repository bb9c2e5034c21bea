package com.ralphtown.dispatch.api;

/** Inbound JSON body for POST /api/sessions/{id}/run. */
public record RunSessionRequest(String prompt) {}
