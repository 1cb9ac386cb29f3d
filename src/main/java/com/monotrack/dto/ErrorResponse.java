package com.monotrack.dto;

public record ErrorResponse(String error, String code) {}
