package com.ralphtown.dispatch.api;

public record CheckoutRequest(String branch) {}
