package com.nevis.reports.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
