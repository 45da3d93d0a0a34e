package com.pgskipper.replication.admin;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.userdetails.MapReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.web.server.SecurityWebFilterChain;

import com.pgskipper.replication.config.ApiProperties;

/**
 * HTTP basic authentication for the admin API.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code /health} is open, so orchestrators can probe without credentials.</li>
 *   <li>Every other route requires the single API user from {@link ApiProperties}.</li>
 *   <li>No sessions, form login or CSRF tokens: callers are automation, not browsers.</li>
 * </ul>
 */
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(ApiProperties.class)
public class ApiSecurityConfig {

    @Bean
    public SecurityWebFilterChain apiSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .authorizeExchange(exchanges -> exchanges
                        .pathMatchers("/health").permitAll()
                        .anyExchange().authenticated())
                .httpBasic(Customizer.withDefaults())
                .build();
    }

    @Bean
    public MapReactiveUserDetailsService apiUsers(ApiProperties api) {
        UserDetails user = User.withUsername(api.getUser())
                .password("{noop}" + api.getPassword())
                .roles("ADMIN")
                .build();
        return new MapReactiveUserDetailsService(user);
    }
}
