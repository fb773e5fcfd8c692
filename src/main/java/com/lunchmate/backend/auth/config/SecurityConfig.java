package com.lunchmate.backend.auth.config;

import com.lunchmate.backend.auth.security.AccessTokenFilter;
import com.lunchmate.backend.common.web.ApiErrorWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Bearer-token only, no sessions. Everything outside app.security.public-paths requires a user; role checks
 * (cook vs customer) happen in the services and answer 403 FORBIDDEN_ROLE.
 * Rejections at this layer use the same {code, message, requestId} body as the controllers.
 */
@Slf4j
@Configuration
public class SecurityConfig {

    private final AccessTokenFilter accessTokenFilter;
    private final ApiErrorWriter errors;
    private final String[] publicPaths;

    public SecurityConfig(AccessTokenFilter accessTokenFilter,
                          ApiErrorWriter errors,
                          @Value("${app.security.public-paths:/actuator/health,/actuator/info}") String[] publicPaths) {
        this.accessTokenFilter = accessTokenFilter;
        this.errors = errors;
        this.publicPaths = publicPaths;
    }

    /** Registered in the security chain only, not a second time as a plain servlet filter. */
    @Bean
    public FilterRegistrationBean<AccessTokenFilter> accessTokenFilterRegistration() {
        FilterRegistrationBean<AccessTokenFilter> reg = new FilterRegistrationBean<>(accessTokenFilter);
        reg.setEnabled(false);
        return reg;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers(publicPaths).permitAll()
                        .anyRequest().authenticated()
                )
                .addFilterBefore(accessTokenFilter, UsernamePasswordAuthenticationFilter.class)
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) -> {
                            log.debug("anonymous request rejected path={}", req.getRequestURI());
                            errors.write(req, res, HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "bearer token required");
                        })
                        .accessDeniedHandler((req, res, e) -> {
                            log.debug("request denied path={}", req.getRequestURI());
                            errors.write(req, res, HttpStatus.FORBIDDEN, "FORBIDDEN", "access denied");
                        })
                );

        return http.build();
    }
}
