package com.culprit.ingest.dto;

public record ApiError(String detail) {}
