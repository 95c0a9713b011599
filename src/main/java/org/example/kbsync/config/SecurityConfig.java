package org.example.kbsync.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, SyncApiKeyFilter syncApiKeyFilter) throws Exception {
        http.csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(SyncApiKeyFilter.SYNC_PATH_PREFIX + "**").hasAuthority(SyncApiKeyFilter.ROLE_SYNC)
                        .anyRequest().permitAll())
                .addFilterBefore(syncApiKeyFilter, UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    // 过滤器只挂在 Security 过滤链里，不再作为普通 Servlet 过滤器重复注册
    @Bean
    public FilterRegistrationBean<SyncApiKeyFilter> syncApiKeyFilterRegistration(SyncApiKeyFilter syncApiKeyFilter) {
        FilterRegistrationBean<SyncApiKeyFilter> registration = new FilterRegistrationBean<>(syncApiKeyFilter);
        registration.setEnabled(false);
        return registration;
    }
}
