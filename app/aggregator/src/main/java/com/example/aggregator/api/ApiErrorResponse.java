package com.example.aggregator.api;

public record ApiErrorResponse(String detail) {}
