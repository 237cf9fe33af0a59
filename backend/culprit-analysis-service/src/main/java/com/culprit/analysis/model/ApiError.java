package com.culprit.analysis.model;

public record ApiError(String detail) {}
