package com.helpline.crm.admin;

import com.helpline.crm.auth.UserView;
import com.helpline.crm.common.ApiException;
import com.helpline.crm.contact.ContactService;
import com.helpline.crm.domain.CallRepository;
import com.helpline.crm.domain.ContactRepository;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import com.helpline.crm.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class AdminService {
  private static final Logger log = LoggerFactory.getLogger(AdminService.class);
  static final int MIN_PASSWORD_LENGTH = 6;
  static final int LIST_LIMIT = 1000;

  private final UserRepository users;
  private final ContactRepository contacts;
  private final CallRepository calls;
  private final MongoOperations mongo;
  private final PasswordEncoder encoder;
  private final Clock clock;

  public AdminService(UserRepository users, ContactRepository contacts, CallRepository calls,
                      MongoOperations mongo, PasswordEncoder encoder, Clock clock) {
    this.users = users;
    this.contacts = contacts;
    this.calls = calls;
    this.mongo = mongo;
    this.encoder = encoder;
    this.clock = clock;
  }

  public List<UserView> listUsers(String search, Role role, UserStatus status) {
    List<Criteria> filters = new ArrayList<>();
    if (StringUtils.hasText(search)) filters.add(ContactService.containsAny(search, "name", "email"));
    if (role != null) filters.add(Criteria.where("role").is(role));
    if (status != null) filters.add(Criteria.where("status").is(status));
    Query query = filters.isEmpty() ? new Query() : new Query(new Criteria().andOperator(filters));
    query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(LIST_LIMIT);
    return mongo.find(query, UserEntity.class).stream().map(UserView::of).toList();
  }

  public UserView getUser(String id) {
    return UserView.of(find(id));
  }

  public UserView createUser(UserEntity actor, String email, String password, String name, Role role, String extension) {
    if (users.existsByEmail(email)) throw ApiException.conflict("Email already registered");
    UserEntity u = new UserEntity();
    u.id = UUID.randomUUID().toString();
    u.email = email;
    u.passwordHash = encoder.encode(password);
    u.name = name;
    u.role = role == null ? Role.AGENT : role;
    u.status = UserStatus.ACTIVE;
    u.extension = StringUtils.hasText(extension) ? extension : null;
    u.createdAt = clock.instant();
    try {
      users.insert(u);
    } catch (DuplicateKeyException e) {
      throw ApiException.conflict("Email already registered");
    }
    log.info("Admin {} created user {} with role {}", actor.email, email, u.role.value());
    return UserView.of(u);
  }

  /** An admin may neither demote nor deactivate their own account. */
  public UserView updateUser(UserEntity actor, String id, UserPatch patch) {
    UserEntity current = find(id);
    boolean self = id.equals(actor.id);
    if (self && patch.role() != null && patch.role() != Role.ADMIN) {
      throw ApiException.badRequest("Cannot change your own role");
    }
    if (self && patch.status() == UserStatus.INACTIVE) {
      throw ApiException.badRequest("Cannot deactivate your own account");
    }
    if (patch.email() != null && !patch.email().equals(current.email) && users.existsByEmail(patch.email())) {
      throw ApiException.conflict("Email already registered");
    }
    if (patch.isEmpty()) return UserView.of(current);

    UserEntity updated;
    try {
      updated = mongo.findAndModify(
          Query.query(Criteria.where("id").is(id)),
          patch.toUpdate(),
          FindAndModifyOptions.options().returnNew(true),
          UserEntity.class);
    } catch (DuplicateKeyException e) {
      throw ApiException.conflict("Email already registered");
    }
    if (updated == null) throw ApiException.notFound("User not found");
    log.info("Admin {} updated user {}: {}", actor.email, id, patch);
    return UserView.of(updated);
  }

  public void resetPassword(UserEntity actor, String id, String newPassword) {
    find(id);
    if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
      throw ApiException.badRequest("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
    mongo.updateFirst(Query.query(Criteria.where("id").is(id)),
        new Update().set("passwordHash", encoder.encode(newPassword)),
        UserEntity.class);
    log.info("Admin {} reset password for user {}", actor.email, id);
  }

  public void deleteUser(UserEntity actor, String id) {
    if (id.equals(actor.id)) throw ApiException.badRequest("Cannot delete your own account");
    find(id);
    users.deleteById(id);
    log.info("Admin {} deleted user {}", actor.email, id);
  }

  public Map<String, Object> stats() {
    Map<String, Long> byRole = new LinkedHashMap<>();
    for (Role role : Role.values()) {
      byRole.put(role.value(), users.countByRole(role));
    }
    Instant weekAgo = clock.instant().minus(Duration.ofDays(7));

    Map<String, Object> userStats = new LinkedHashMap<>();
    userStats.put("total", users.count());
    userStats.put("active", users.countByStatusNot(UserStatus.INACTIVE));
    userStats.put("by_role", byRole);
    Map<String, Object> callStats = new LinkedHashMap<>();
    callStats.put("total", calls.count());
    callStats.put("last_7_days", calls.countByTimestampGreaterThanEqual(weekAgo));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("users", userStats);
    body.put("contacts", Map.of("total", contacts.count()));
    body.put("calls", callStats);
    return body;
  }

  private UserEntity find(String id) {
    return users.findById(id).orElseThrow(() -> ApiException.notFound("User not found"));
  }
}
