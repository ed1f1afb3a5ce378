package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.Account;
import com.cinetix.cinema.dto.request.CreateAccountRequest;
import com.cinetix.cinema.dto.response.AccountResponse;
import com.cinetix.cinema.repository.AccountRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final ConsistencyGuard consistencyGuard;

    @Transactional
    public AccountResponse register(CreateAccountRequest request) {
        if (accountRepository.existsByEmail(request.email())
                || accountRepository.existsByLoginName(request.loginName())) {
            throw new BusinessException(ErrorCode.DUPLICATE_ACCOUNT);
        }

        Account account = Account.builder()
                .displayName(request.displayName())
                .email(request.email())
                .loginName(request.loginName())
                .credentialHash(passwordEncoder.encode(request.password()))
                .phone(request.phone())
                .role(request.role())
                .build();

        // uk_accounts_email / uk_accounts_login_name catch a concurrent registration
        Account saved = consistencyGuard.commitUnique(
                () -> accountRepository.saveAndFlush(account),
                ErrorCode.DUPLICATE_ACCOUNT, ErrorCode.DUPLICATE_ACCOUNT.getMessage());

        log.info("Registered account id={}, loginName={}", saved.getId(), saved.getLoginName());
        return AccountResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public AccountResponse getAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .map(AccountResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCOUNT_NOT_FOUND,
                        "Account not found: " + accountId));
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> getAccounts() {
        return accountRepository.findAllByOrderByIdAsc().stream()
                .map(AccountResponse::from)
                .toList();
    }
}
