package com.helpline.crm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helpline.crm.common.ApiException;
import com.helpline.crm.common.ApiExceptionHandler;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.UserRepository;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.*;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.*;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

import static org.springframework.security.config.Customizer.withDefaults;

@Configuration
public class SecurityConfig {
  @Bean PasswordEncoder passwordEncoder(){ return new BCryptPasswordEncoder(); }

  @Bean
  CorsConfigurationSource corsConfigurationSource(@Value("${app.cors-origins:*}") String origins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowedOriginPatterns(Arrays.stream(origins.split(",")).map(String::trim).filter(o -> !o.isEmpty()).toList());
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setExposedHeaders(List.of(HttpHeaders.AUTHORIZATION, HttpHeaders.CONTENT_DISPOSITION));
    config.setAllowCredentials(true);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }

  @Bean SecurityFilterChain filterChain(HttpSecurity http, JwtFilter jwtFilter, ObjectMapper mapper) throws Exception {
    return http.csrf(c->c.disable())
      .cors(withDefaults())
      .sessionManagement(s->s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
      .authorizeHttpRequests(a->a
        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
        .requestMatchers("/api", "/api/", "/api/auth/register", "/api/auth/login", "/swagger-ui/**", "/v3/api-docs/**", "/actuator/health").permitAll()
        .requestMatchers(HttpMethod.POST, "/api/freepbx/call-event").permitAll()
        .requestMatchers("/api/admin/**").hasAnyRole(AccessPolicy.ADMIN_ONLY.roleNames())
        .anyRequest().hasAnyRole(AccessPolicy.ANY_ROLE.roleNames()))
      .exceptionHandling(e->e
        .authenticationEntryPoint(entryPoint(mapper))
        .accessDeniedHandler(accessDeniedHandler(mapper)))
      .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
      .build();
  }

  /** Reports why the bearer token was rejected, or that there was none. */
  static AuthenticationEntryPoint entryPoint(ObjectMapper mapper) {
    return (req, res, ex) -> {
      var failure = req.getAttribute(JwtFilter.AUTH_FAILURE);
      ApiException error = failure instanceof ApiException ? (ApiException) failure : ApiException.unauthorized("Not authenticated");
      write(mapper, res, error.status(), error.code(), error.getMessage());
    };
  }

  static AccessDeniedHandler accessDeniedHandler(ObjectMapper mapper) {
    return (req, res, ex) -> write(mapper, res, HttpStatus.FORBIDDEN, "FORBIDDEN",
        "Access denied. Required roles: " + AccessPolicy.forPath(req.getRequestURI()).describe());
  }

  private static void write(ObjectMapper mapper, HttpServletResponse res, HttpStatus status, String code, String message) throws IOException {
    res.setStatus(status.value());
    res.setContentType(MediaType.APPLICATION_JSON_VALUE);
    mapper.writeValue(res.getOutputStream(), ApiExceptionHandler.body(code, message));
  }

  @Component
  public static class JwtService {
    private final SecretKey key;
    private final Duration ttl;
    public JwtService(@Value("${app.jwt-secret}") String secret, @Value("${app.jwt-ttl-hours:24}") long ttlHours){
      this.key=Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
      this.ttl=Duration.ofHours(ttlHours);
    }
    public String generate(String userId, Role role){
      return Jwts.builder().subject(userId).claim("role", role.name()).issuedAt(new Date()).expiration(new Date(System.currentTimeMillis()+ttl.toMillis())).signWith(key).compact();
    }
    public Jws<Claims> parse(String token){ return Jwts.parser().verifyWith(key).build().parseSignedClaims(token); }
  }

  /**
   * Resolves the bearer token to a stored, active user. A rejected token never fails the
   * request here: the reason is parked in {@link #AUTH_FAILURE} and reported only if the
   * route turns out to require authentication.
   */
  @Component
  public static class JwtFilter extends OncePerRequestFilter {
    public static final String AUTH_FAILURE = JwtFilter.class.getName() + ".failure";
    private final JwtService jwt;
    private final UserRepository users;
    public JwtFilter(JwtService jwt, UserRepository users){this.jwt=jwt;this.users=users;}
    @Override protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain) throws ServletException, IOException {
      String h=req.getHeader(HttpHeaders.AUTHORIZATION);
      if(h!=null && h.startsWith("Bearer ")){
        try {
          UserEntity user=resolve(h.substring(7));
          var auth=new UsernamePasswordAuthenticationToken(user,null, List.of(new SimpleGrantedAuthority(AccessPolicy.authority(user.role))));
          SecurityContextHolder.getContext().setAuthentication(auth);
        } catch (ApiException failure) {
          req.setAttribute(AUTH_FAILURE, failure);
        }
      }
      chain.doFilter(req,res);
    }

    UserEntity resolve(String token) {
      String userId;
      try {
        userId=jwt.parse(token).getPayload().getSubject();
      } catch (ExpiredJwtException e) {
        throw ApiException.unauthorized("Token expired");
      } catch (JwtException | IllegalArgumentException e) {
        throw ApiException.unauthorized("Invalid token");
      }
      if(userId==null || userId.isBlank()) throw ApiException.unauthorized("Invalid token");
      UserEntity user=users.findById(userId).orElseThrow(()->ApiException.unauthorized("User not found"));
      if(!user.active()) throw ApiException.forbidden("Account is deactivated");
      return user;
    }
  }
}
