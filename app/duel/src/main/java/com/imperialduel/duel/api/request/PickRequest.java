package com.imperialduel.duel.api.request;

import jakarta.validation.constraints.NotBlank;

public record PickRequest(@NotBlank String stance) {}
