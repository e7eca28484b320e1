package com.botcore.toolgate.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for the tool gateway.
 *
 * Design principles:
 * - Stateless, no sessions
 * - Tool endpoints are let through here; the shared-secret check is IncomingAuthGuard's job
 *   so that a rejected call still gets the structured ToolResult body
 * - Fail-closed for everything not listed
 */
@Configuration
public class SecurityConfig {

    @Bean
    @Order(2)
    SecurityFilterChain apiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher("/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/health").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/tools").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/tools/*").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().denyAll() // fail-closed
            )
            .build();
    }
}
