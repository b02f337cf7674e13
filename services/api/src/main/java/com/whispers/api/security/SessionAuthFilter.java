package com.whispers.api.security;

import com.whispers.api.auth.AuthService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the request's session token into an {@link Identity} principal. Requests without a
 * usable session continue anonymously; handlers decide whether that is acceptable.
 */
@Component
class SessionAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);

    private final AuthService authService;

    SessionAuthFilter(AuthService authService) {
        this.authService = authService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        final String token = SessionTokens.fromRequest(req);
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(req, res);
            return;
        }

        try {
            Identity identity = authService.resolve(token);
            var authToken = new UsernamePasswordAuthenticationToken(
                    identity, null, AuthorityUtils.createAuthorityList("USER"));
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (UnauthenticatedException e) {
            log.debug("Session rejected path={}, reason={}", req.getRequestURI(), e.getMessage());
        }

        chain.doFilter(req, res);
    }
}
