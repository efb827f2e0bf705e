package dev.coursebuilder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless security. Sign-in belongs to the surrounding course site; this service
 * only needs an authenticated principal, so HTTP basic stands in for it here.
 * Reviewer management on someone else's submission is reserved to admins.
 */
@Configuration
public class SecurityConfig {
    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(Customizer.withDefaults())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers(HttpMethod.PUT, "/units/*/submissions/*/reviewers/*").hasRole("ADMIN")
                .requestMatchers(HttpMethod.DELETE, "/units/*/submissions/*/reviewers/*").hasRole("ADMIN")
                .anyRequest().authenticated()
            );
        return http.build();
    }
}
