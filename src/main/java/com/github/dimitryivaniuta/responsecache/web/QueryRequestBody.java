package com.github.dimitryivaniuta.responsecache.web;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record QueryRequestBody(
        @NotBlank String query,
        String operationName,
        Map<String, Object> variables
) {}
