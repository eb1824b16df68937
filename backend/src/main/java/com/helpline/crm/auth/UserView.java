package com.helpline.crm.auth;

import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;

import java.time.Instant;

/** Public projection of a user; never carries the password hash. */
public record UserView(String id, String email, String name, Role role, UserStatus status, String extension, Instant createdAt, Instant lastLogin) {
  public static UserView of(UserEntity u) {
    return new UserView(u.id, u.email, u.name, u.role, u.status == null ? UserStatus.ACTIVE : u.status, u.extension, u.createdAt, u.lastLogin);
  }
}
