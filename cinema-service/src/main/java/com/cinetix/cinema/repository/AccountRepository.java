package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AccountRepository extends JpaRepository<Account, Long> {

    boolean existsByEmail(String email);

    boolean existsByLoginName(String loginName);

    List<Account> findAllByOrderByIdAsc();
}
