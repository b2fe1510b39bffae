package com.yoursp.clientstorage.config;

import com.yoursp.clientstorage.modules.auth.ClientKeyAuthFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration.
 * <ul>
 * <li>Security headers: HSTS, X-Content-Type-Options, X-Frame-Options, CSP,
 * Cache-Control</li>
 * <li>Correlation id filter first, then the client key filter</li>
 * <li>/admin/**, public static files, /actuator/health: permitAll</li>
 * <li>All other routes: require an authenticated client key</li>
 * <li>Stateless, CSRF disabled (no cookies are issued)</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        private final ClientKeyAuthFilter clientKeyAuthFilter;
        private final CorrelationIdFilter correlationIdFilter;
        private final StorageProperties storageProperties;

        public SecurityConfig(ClientKeyAuthFilter clientKeyAuthFilter,
                        CorrelationIdFilter correlationIdFilter,
                        StorageProperties storageProperties) {
                this.clientKeyAuthFilter = clientKeyAuthFilter;
                this.correlationIdFilter = correlationIdFilter;
                this.storageProperties = storageProperties;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                                // ── Security Headers ──
                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                }) // X-Content-Type-Options: nosniff
                                                .frameOptions(frame -> frame.deny()) // X-Frame-Options: DENY
                                                .httpStrictTransportSecurity(hsts -> hsts
                                                                .includeSubDomains(true)
                                                                .maxAgeInSeconds(31536000)) // HSTS: 1 year
                                                .contentSecurityPolicy(csp -> csp
                                                                .policyDirectives(
                                                                                "default-src 'self'; frame-ancestors 'none'"))
                                                .cacheControl(cache -> {
                                                })) // Cache-Control: no-cache, no-store, must-revalidate

                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/admin/**").permitAll()
                                                .requestMatchers("/" + storageProperties.getStaticPrefix() + "/**")
                                                .permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .requestMatchers("/actuator/info").permitAll()
                                                .requestMatchers("/error").permitAll()
                                                .anyRequest().authenticated())
                                .addFilterBefore(correlationIdFilter, UsernamePasswordAuthenticationFilter.class)
                                .addFilterBefore(clientKeyAuthFilter, UsernamePasswordAuthenticationFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }
}
