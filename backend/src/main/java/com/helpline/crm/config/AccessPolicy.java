package com.helpline.crm.config;

import com.helpline.crm.domain.Entities.Role;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** The three role sets every protected operation is gated by. */
public enum AccessPolicy {
  ADMIN_ONLY(EnumSet.of(Role.ADMIN)),
  SUPERVISOR_OR_ADMIN(EnumSet.of(Role.ADMIN, Role.SUPERVISOR)),
  ANY_ROLE(EnumSet.allOf(Role.class));

  private final Set<Role> roles;

  AccessPolicy(Set<Role> roles) {
    this.roles = roles;
  }

  public boolean allows(Role role) {
    return role != null && roles.contains(role);
  }

  /** Role names in the form {@code hasAnyRole} expects. */
  public String[] roleNames() {
    return roles.stream().map(Role::name).toArray(String[]::new);
  }

  public String describe() {
    return roles.stream().map(Role::value).collect(Collectors.joining(", "));
  }

  public static AccessPolicy forPath(String uri) {
    return uri != null && uri.startsWith("/api/admin") ? ADMIN_ONLY : ANY_ROLE;
  }

  public static String authority(Role role) {
    return switch (role) {
      case ADMIN -> "ROLE_ADMIN";
      case SUPERVISOR -> "ROLE_SUPERVISOR";
      case AGENT -> "ROLE_AGENT";
    };
  }
}
