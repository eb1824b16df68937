package com.helpline.crm.auth;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.config.SecurityConfig.JwtService;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import com.helpline.crm.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
public class AuthService {
  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final UserRepository users;
  private final MongoOperations mongo;
  private final PasswordEncoder encoder;
  private final JwtService jwt;
  private final Clock clock;

  public AuthService(UserRepository users, MongoOperations mongo, PasswordEncoder encoder, JwtService jwt, Clock clock) {
    this.users = users;
    this.mongo = mongo;
    this.encoder = encoder;
    this.jwt = jwt;
    this.clock = clock;
  }

  public record TokenResponse(String accessToken, String tokenType, UserView user) {
    static TokenResponse bearer(String token, UserEntity user) {
      return new TokenResponse(token, "bearer", UserView.of(user));
    }
  }

  /** The first account ever stored becomes admin; everyone after that starts as agent. */
  public TokenResponse register(String email, String password, String name) {
    if (users.existsByEmail(email)) throw ApiException.conflict("Email already registered");

    Instant now = clock.instant();
    UserEntity u = new UserEntity();
    u.id = UUID.randomUUID().toString();
    u.email = email;
    u.passwordHash = encoder.encode(password);
    u.name = name;
    u.role = users.count() == 0 ? Role.ADMIN : Role.AGENT;
    u.status = UserStatus.ACTIVE;
    u.createdAt = now;
    u.lastLogin = now;
    try {
      users.insert(u);
    } catch (DuplicateKeyException e) {
      throw ApiException.conflict("Email already registered");
    }
    log.info("Registered user {} with role {}", email, u.role.value());
    return TokenResponse.bearer(jwt.generate(u.id, u.role), u);
  }

  /** Only {@code lastLogin} is written, so concurrent admin changes to the account survive. */
  public TokenResponse login(String email, String password) {
    UserEntity u = users.findByEmail(email)
        .filter(candidate -> candidate.passwordHash != null && encoder.matches(password, candidate.passwordHash))
        .orElseThrow(() -> ApiException.unauthorized("Invalid email or password"));
    if (!u.active()) throw ApiException.forbidden("Account is deactivated. Contact administrator.");

    u.lastLogin = clock.instant();
    mongo.updateFirst(Query.query(Criteria.where("id").is(u.id)), new Update().set("lastLogin", u.lastLogin), UserEntity.class);
    return TokenResponse.bearer(jwt.generate(u.id, u.role), u);
  }
}
