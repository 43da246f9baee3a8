package com.titan.cargo.security;

import com.titan.cargo.exception.ApiException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    /**
     * Set when a bearer token was present but rejected; read by {@link CustomAuthenticationEntryPoint}.
     */
    public static final String TOKEN_REJECTED_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".REJECTED";

    private final JwtUtils jwtUtils;

    public JwtAuthenticationFilter(JwtUtils jwtUtils) {
        this.jwtUtils = jwtUtils;
    }

    @Override
    protected void doFilterInternal(@NotNull HttpServletRequest request,
                                    @NotNull HttpServletResponse response,
                                    @NotNull FilterChain chain)
            throws ServletException, IOException {
        // CORS preflight
        if (request.getMethod().equals("OPTIONS")) {
            chain.doFilter(request, response);
            return;
        }

        String token = jwtUtils.extractToken(request);

        if (token != null) {
            try {
                AuthenticatedUser user = jwtUtils.verifyToken(token);
                var authToken = new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities());
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } catch (ApiException e) {
                logger.debug("Jeton rejeté pour {}: {}", request.getRequestURI(), e.getMessage());
                request.setAttribute(TOKEN_REJECTED_ATTRIBUTE, e.getMessage());
            }
        }

        chain.doFilter(request, response);
    }
}
