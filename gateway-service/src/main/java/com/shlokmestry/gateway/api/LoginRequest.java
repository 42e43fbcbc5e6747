package com.shlokmestry.gateway.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank @Size(max = 1024) String password
) {

    @Override
    public String toString() {
        return "LoginRequest[****]";
    }
}
