package com.nevis.reports.controller;

public record ApiInfoResponse(String message) {}
