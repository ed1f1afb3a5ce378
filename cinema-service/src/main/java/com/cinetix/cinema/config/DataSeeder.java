package com.cinetix.cinema.config;

import com.cinetix.cinema.domain.Account;
import com.cinetix.cinema.domain.AccountRole;
import com.cinetix.cinema.domain.Auditorium;
import com.cinetix.cinema.domain.Film;
import com.cinetix.cinema.repository.AccountRepository;
import com.cinetix.cinema.repository.AuditoriumRepository;
import com.cinetix.cinema.repository.FilmRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Demo catalog for local runs. Each table is filled only while it is empty.
 */
@Slf4j
@Component
@Profile("local")
@RequiredArgsConstructor
public class DataSeeder implements ApplicationRunner {

    private final FilmRepository filmRepository;
    private final AuditoriumRepository auditoriumRepository;
    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (filmRepository.count() == 0) {
            filmRepository.saveAll(List.of(
                    film("Avengers: Endgame", "Action", 181, "The epic conclusion to the Infinity Saga"),
                    film("Parasite", "Thriller", 132, "A dark comedy thriller about class conflict"),
                    film("Spider-Man: No Way Home", "Action", 148, "Peter Parker's multiverse adventure")));
            log.info("Seeded films");
        }

        if (auditoriumRepository.count() == 0) {
            auditoriumRepository.saveAll(List.of(
                    auditorium("Studio IMAX", 200, "IMAX Screen, Dolby Atmos"),
                    auditorium("Studio Premium", 150, "Reclining Seats, 4K Projection"),
                    auditorium("Studio Regular", 100, "Standard Screen, Surround Sound")));
            log.info("Seeded auditoriums");
        }

        if (accountRepository.count() == 0) {
            accountRepository.saveAll(List.of(
                    account("John Doe", "john.doe@email.com", "johndoe", "123456", "081234567890", AccountRole.CUSTOMER),
                    account("Jane Smith", "jane.smith@email.com", "janesmith", "123456", "081234567891", AccountRole.CUSTOMER),
                    account("Bob Wilson", "bob.wilson@email.com", "bobwilson", "123456", "081234567892", AccountRole.CUSTOMER),
                    account("Admin User", "admin@cinema.com", "admin", "admin123", "081234567999", AccountRole.ADMIN)));
            log.info("Seeded accounts");
        }
    }

    private static Film film(String title, String genre, int durationMinutes, String description) {
        return Film.builder()
                .title(title)
                .genre(genre)
                .durationMinutes(durationMinutes)
                .description(description)
                .build();
    }

    private static Auditorium auditorium(String name, int capacity, String facilities) {
        return Auditorium.builder()
                .name(name)
                .capacity(capacity)
                .facilities(facilities)
                .build();
    }

    private Account account(String displayName, String email, String loginName, String password,
                            String phone, AccountRole role) {
        return Account.builder()
                .displayName(displayName)
                .email(email)
                .loginName(loginName)
                .credentialHash(passwordEncoder.encode(password))
                .phone(phone)
                .role(role)
                .build();
    }
}
