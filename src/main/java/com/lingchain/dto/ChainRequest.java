package com.lingchain.dto;

import jakarta.validation.constraints.NotNull;

public record ChainRequest(@NotNull String word) {}
