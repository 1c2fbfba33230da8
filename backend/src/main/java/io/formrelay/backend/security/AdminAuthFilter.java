package io.formrelay.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates dashboard requests carrying {@code Authorization: Bearer <token>}. A missing or
 * invalid token leaves the request anonymous; the security chain then answers 401.
 *
 * <p>The public ingestion endpoint and the login endpoint are excluded via {@link
 * #shouldNotFilter}.
 */
@Component
public class AdminAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(AdminAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final AdminJwtService adminJwtService;

  public AdminAuthFilter(AdminJwtService adminJwtService) {
    this.adminJwtService = adminJwtService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
      try {
        var claims = adminJwtService.verifyToken(authHeader.substring(BEARER_PREFIX.length()));
        var authentication =
            new UsernamePasswordAuthenticationToken(
                new AdminPrincipal(claims.adminId(), claims.email()),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
        var context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
      } catch (AdminAuthException e) {
        log.debug("Admin auth failed: {}", e.getBody().getDetail());
      }
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (!path.startsWith("/api/")) {
      return true;
    }
    return path.startsWith("/api/v1/submit/") || path.equals("/api/auth/login");
  }
}
