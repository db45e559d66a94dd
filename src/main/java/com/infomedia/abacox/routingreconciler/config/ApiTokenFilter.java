package com.infomedia.abacox.routingreconciler.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;
import org.springframework.security.web.context.SecurityContextRepository;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

@Component
@Log4j2
public class ApiTokenFilter extends OncePerRequestFilter {

    public static final String API_TOKEN_HEADER = "x-api-token";
    public static final String PROTECTED_PATH = "/fix/";
    public static final String PRINCIPAL = "operator";

    private final byte[] apiToken;
    private final SecurityContextRepository securityContextRepository = new RequestAttributeSecurityContextRepository();

    public ApiTokenFilter(@Value("${reconciler.api-token:}") String apiToken) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalStateException("API_TOKEN is required");
        }
        this.apiToken = apiToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!request.getRequestURI().startsWith(PROTECTED_PATH)) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedToken = request.getHeader(API_TOKEN_HEADER);

        if (providedToken != null && MessageDigest.isEqual(apiToken, providedToken.getBytes(StandardCharsets.UTF_8))) {
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    PRINCIPAL, null, List.of());
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
            securityContextRepository.saveContext(context, request, response);

            filterChain.doFilter(request, response);
        } else {
            log.warn("Rejected {} {}: missing or invalid API token", request.getMethod(), request.getRequestURI());
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized");
        }
    }
}
