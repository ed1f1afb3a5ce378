package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Account;
import com.cinetix.cinema.domain.AccountRole;

import java.time.LocalDateTime;

/**
 * Public view of an account. The credential hash is never exposed.
 */
public record AccountResponse(
        Long id,
        String displayName,
        String email,
        String loginName,
        String phone,
        AccountRole role,
        boolean active,
        LocalDateTime createdAt
) {
    public static AccountResponse from(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getDisplayName(),
                account.getEmail(),
                account.getLoginName(),
                account.getPhone(),
                account.getRole(),
                account.isActive(),
                account.getCreatedAt()
        );
    }
}
