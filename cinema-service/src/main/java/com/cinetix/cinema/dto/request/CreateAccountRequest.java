package com.cinetix.cinema.dto.request;

import com.cinetix.cinema.domain.AccountRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotBlank @Size(max = 100) String displayName,
        @NotBlank @Email @Size(max = 254) String email,
        @NotBlank @Size(min = 3, max = 50) String loginName,
        @NotBlank @Size(min = 6, max = 100) String password,
        @Size(max = 20) String phone,
        AccountRole role
) {
}
