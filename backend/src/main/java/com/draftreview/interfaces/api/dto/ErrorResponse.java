package com.draftreview.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
