package com.lunchmate.backend.auth.security;

import com.lunchmate.backend.auth.entity.AuthToken;
import com.lunchmate.backend.auth.repo.AuthTokenRepo;
import com.lunchmate.backend.common.web.ApiErrorWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

@Slf4j
@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    public static final String USER_ID_ATTR = "userId";

    private final AuthTokenRepo tokens;
    private final Clock clock;
    private final ApiErrorWriter errors;

    public AccessTokenFilter(AuthTokenRepo tokens, Clock clock, ApiErrorWriter errors) {
        this.tokens = tokens;
        this.clock = clock;
        this.errors = errors;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            // anonymous; the entry point answers 401 for protected paths
            chain.doFilter(req, res);
            return;
        }

        String raw = auth.substring(7).trim();
        Optional<AuthToken> found = raw.isEmpty() ? Optional.empty() : tokens.findByToken(raw);
        Instant now = Instant.now(clock);

        if (found.isEmpty() || !found.get().isActiveAt(now)) {
            log.info("rejected bearer token path={} known={}", req.getRequestURI(), found.isPresent());
            errors.write(req, res, HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "invalid or expired access token");
            return;
        }

        // principal is the user id only, never the entity
        String uid = found.get().getUserId();
        var authentication = new UsernamePasswordAuthenticationToken(uid, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        req.setAttribute(USER_ID_ATTR, uid);

        chain.doFilter(req, res);
    }
}
