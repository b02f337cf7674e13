package com.whispers.api.web;

public record ErrorResponse(String message, String code) {}
