package com.helpline.crm.admin;

import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserStatus;
import org.springframework.data.mongodb.core.query.Update;

public record UserPatch(String name, String email, Role role, UserStatus status, String extension) {
  Update toUpdate() {
    Update update = new Update();
    if (name != null) update.set("name", name);
    if (email != null) update.set("email", email);
    if (role != null) update.set("role", role);
    if (status != null) update.set("status", status);
    if (extension != null) update.set("extension", extension.isBlank() ? null : extension);
    return update;
  }

  boolean isEmpty() {
    return name == null && email == null && role == null && status == null && extension == null;
  }
}
