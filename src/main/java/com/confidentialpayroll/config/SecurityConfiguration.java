package com.confidentialpayroll.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

import java.util.List;

/**
 * Spring Security configuration for the payroll aggregation API.
 *
 * Security architecture:
 * - Stateless HTTP Basic authentication, one account per caller identity
 * - CSRF protection disabled (stateless API)
 * - Capability decisions (admin, provider, oracle) made by AccessControl, not here
 *
 * Passwords in configuration use the delegating encoder format, e.g. {@code {noop}secret}
 * or {@code {bcrypt}$2a$...}.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfiguration {

    private final ProtocolProperties properties;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless API
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .authorizeHttpRequests(auth -> auth
                // Public endpoints (health checks, API docs)
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()

                // API endpoints require authentication
                .requestMatchers("/api/**").authenticated()

                // All other requests denied by default
                .anyRequest().denyAll()
            )

            .httpBasic(Customizer.withDefaults())

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    /**
     * Accounts from {@code payroll.access.users}.
     */
    @Bean
    public UserDetailsService userDetailsService() {
        List<UserDetails> users = properties.getAccess().getUsers().stream()
            .map(user -> User.withUsername(user.getName())
                .password(user.getPassword())
                .roles("CALLER")
                .build())
            .toList();

        log.info("Configured {} API accounts", users.size());
        return new InMemoryUserDetailsManager(users);
    }
}
