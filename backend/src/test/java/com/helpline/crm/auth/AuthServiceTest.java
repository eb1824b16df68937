package com.helpline.crm.auth;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.config.SecurityConfig.JwtService;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import com.helpline.crm.domain.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.bson.Document;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AuthServiceTest {
  private static final Instant NOW = Instant.parse("2025-03-12T15:30:00Z");

  private final UserRepository users = mock(UserRepository.class);
  private final MongoOperations mongo = mock(MongoOperations.class);
  private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
  private final JwtService jwt = new JwtService("test-secret-for-helpline-crm-tests-0123456789", 24);
  private AuthService service;

  @BeforeEach
  void setUp() {
    service = new AuthService(users, mongo, encoder, jwt, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void firstRegisteredUserBecomesAdmin() {
    when(users.existsByEmail("first@helpline.test")).thenReturn(false);
    when(users.count()).thenReturn(0L);

    var response = service.register("first@helpline.test", "secret1", "First");

    assertEquals(Role.ADMIN, response.user().role());
    assertEquals("bearer", response.tokenType());
    assertEquals(response.user().id(), jwt.parse(response.accessToken()).getPayload().getSubject());
    assertEquals("ADMIN", jwt.parse(response.accessToken()).getPayload().get("role", String.class));
  }

  @Test
  void laterRegistrationsBecomeAgents() {
    when(users.existsByEmail("next@helpline.test")).thenReturn(false);
    when(users.count()).thenReturn(3L);

    var response = service.register("next@helpline.test", "secret1", "Next");

    ArgumentCaptor<UserEntity> saved = ArgumentCaptor.forClass(UserEntity.class);
    verify(users).insert(saved.capture());
    assertEquals(Role.AGENT, saved.getValue().role);
    assertEquals(Role.AGENT, response.user().role());
    assertEquals(UserStatus.ACTIVE, saved.getValue().status);
    assertEquals(NOW, saved.getValue().createdAt);
    assertEquals(NOW, saved.getValue().lastLogin);
    assertNotEquals("secret1", saved.getValue().passwordHash);
    assertTrue(encoder.matches("secret1", saved.getValue().passwordHash));
  }

  @Test
  void registeringTakenEmailIsConflict() {
    when(users.existsByEmail("taken@helpline.test")).thenReturn(true);

    var ex = assertThrows(ApiException.class, () -> service.register("taken@helpline.test", "secret1", "Taken"));

    assertEquals("CONFLICT", ex.code());
    verify(users, never()).insert(any(UserEntity.class));
  }

  @Test
  void concurrentRegistrationLosingUniqueIndexIsConflict() {
    when(users.existsByEmail("race@helpline.test")).thenReturn(false);
    when(users.insert(any(UserEntity.class))).thenThrow(new DuplicateKeyException("E11000 duplicate key"));

    var ex = assertThrows(ApiException.class, () -> service.register("race@helpline.test", "secret1", "Race"));

    assertEquals("CONFLICT", ex.code());
    assertEquals("Email already registered", ex.getMessage());
  }

  @Test
  void loginWithWrongPasswordIsUnauthorized() {
    when(users.findByEmail("agent@helpline.test")).thenReturn(Optional.of(user("right-pass", UserStatus.ACTIVE)));

    var ex = assertThrows(ApiException.class, () -> service.login("agent@helpline.test", "wrong-pass"));

    assertEquals(HttpStatus.UNAUTHORIZED, ex.status());
  }

  @Test
  void loginWithUnknownEmailIsUnauthorized() {
    when(users.findByEmail("ghost@helpline.test")).thenReturn(Optional.empty());

    var ex = assertThrows(ApiException.class, () -> service.login("ghost@helpline.test", "whatever"));

    assertEquals(HttpStatus.UNAUTHORIZED, ex.status());
  }

  @Test
  void inactiveAccountNeverGetsToken() {
    when(users.findByEmail("agent@helpline.test")).thenReturn(Optional.of(user("right-pass", UserStatus.INACTIVE)));

    var ex = assertThrows(ApiException.class, () -> service.login("agent@helpline.test", "right-pass"));

    assertEquals(HttpStatus.FORBIDDEN, ex.status());
    verify(users, never()).save(any(UserEntity.class));
    verifyNoInteractions(mongo);
  }

  @Test
  void successfulLoginStampsLastLogin() {
    UserEntity u = user("right-pass", UserStatus.ACTIVE);
    when(users.findByEmail("agent@helpline.test")).thenReturn(Optional.of(u));

    var response = service.login("agent@helpline.test", "right-pass");

    assertEquals(NOW, u.lastLogin);
    assertEquals(NOW, response.user().lastLogin());
    assertEquals("u-1", jwt.parse(response.accessToken()).getPayload().getSubject());
  }

  @Test
  void loginWritesOnlyLastLoginLeavingConcurrentAdminChangesIntact() {
    when(users.findByEmail("agent@helpline.test")).thenReturn(Optional.of(user("right-pass", UserStatus.ACTIVE)));

    service.login("agent@helpline.test", "right-pass");

    ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
    ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
    verify(mongo).updateFirst(query.capture(), update.capture(), eq(UserEntity.class));
    assertEquals("u-1", query.getValue().getQueryObject().get("id"));
    Document set = update.getValue().getUpdateObject().get("$set", Document.class);
    assertEquals(Set.of("lastLogin"), set.keySet());
    assertEquals(NOW, set.get("lastLogin"));
    assertEquals(1, update.getValue().getUpdateObject().size());
    verify(users, never()).save(any(UserEntity.class));
  }

  private UserEntity user(String password, UserStatus status) {
    UserEntity u = new UserEntity();
    u.id = "u-1";
    u.email = "agent@helpline.test";
    u.name = "Agent";
    u.role = Role.AGENT;
    u.status = status;
    u.passwordHash = encoder.encode(password);
    u.createdAt = NOW.minusSeconds(3600);
    return u;
  }
}
