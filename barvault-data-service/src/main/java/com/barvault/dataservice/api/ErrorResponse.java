package com.barvault.dataservice.api;

public record ErrorResponse(String error) {}
