package com.cinetix.cinema;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@OpenAPIDefinition(info = @Info(
        title = "Cinema Service API",
        description = "Screenings, seat bookings and payments with slot-level consistency guarantees",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = "com.cinetix")
public class CinemaServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CinemaServiceApplication.class, args);
    }
}
