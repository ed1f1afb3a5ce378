package com.cinetix.cinema.domain;

import com.cinetix.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "accounts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_accounts_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_accounts_login_name", columnNames = "login_name")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String displayName;

    @Column(name = "email", nullable = false, length = 254)
    private String email;

    @Column(name = "login_name", nullable = false, length = 50)
    private String loginName;

    @Column(nullable = false)
    private String credentialHash;

    @Column(length = 20)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountRole role;

    @Column(nullable = false)
    private boolean active;

    @Builder
    private Account(String displayName, String email, String loginName, String credentialHash,
                    String phone, AccountRole role) {
        this.displayName = displayName;
        this.email = email;
        this.loginName = loginName;
        this.credentialHash = credentialHash;
        this.phone = phone;
        this.role = role != null ? role : AccountRole.CUSTOMER;
        this.active = true;
    }
}
