package com.shoryokuka.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
