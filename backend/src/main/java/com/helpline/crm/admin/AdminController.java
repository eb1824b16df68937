package com.helpline.crm.admin;

import com.helpline.crm.auth.UserView;
import com.helpline.crm.common.ApiException;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {
  private final AdminService admin;

  public AdminController(AdminService admin) {
    this.admin = admin;
  }

  public record UserCreateReq(@NotBlank @Email String email, @NotBlank String password, @NotBlank String name, Role role, String extension) {}
  public record UserUpdateReq(String name, @Email String email, Role role, UserStatus status, String extension) {}
  public record PasswordResetReq(@NotNull String newPassword) {}

  @GetMapping("/users")
  List<UserView> listUsers(
      @RequestParam(required = false) String search,
      @RequestParam(required = false) String role,
      @RequestParam(required = false) String status
  ) {
    return admin.listUsers(search, parse(role, Role::of, "role"), parse(status, UserStatus::of, "status"));
  }

  @PostMapping("/users")
  UserView createUser(@Valid @RequestBody UserCreateReq req, @AuthenticationPrincipal UserEntity actor) {
    return admin.createUser(actor, req.email(), req.password(), req.name(), req.role(), req.extension());
  }

  @GetMapping("/users/{id}")
  UserView getUser(@PathVariable String id) {
    return admin.getUser(id);
  }

  @PutMapping("/users/{id}")
  UserView updateUser(@PathVariable String id, @Valid @RequestBody UserUpdateReq req, @AuthenticationPrincipal UserEntity actor) {
    return admin.updateUser(actor, id, new UserPatch(req.name(), req.email(), req.role(), req.status(), req.extension()));
  }

  @PostMapping("/users/{id}/reset-password")
  Map<String, Object> resetPassword(@PathVariable String id, @Valid @RequestBody PasswordResetReq req, @AuthenticationPrincipal UserEntity actor) {
    admin.resetPassword(actor, id, req.newPassword());
    return Map.of("message", "Password reset successfully");
  }

  @DeleteMapping("/users/{id}")
  Map<String, Object> deleteUser(@PathVariable String id, @AuthenticationPrincipal UserEntity actor) {
    admin.deleteUser(actor, id);
    return Map.of("message", "User deleted successfully");
  }

  @GetMapping("/stats")
  Map<String, Object> stats() {
    return admin.stats();
  }

  private static <T> T parse(String value, java.util.function.Function<String, T> parser, String field) {
    if (value == null || value.isBlank()) return null;
    try {
      return parser.apply(value);
    } catch (IllegalArgumentException e) {
      throw ApiException.badRequest("Invalid " + field + ": " + value);
    }
  }
}
