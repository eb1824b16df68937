package com.helpline.crm.config;

import com.helpline.crm.admin.AdminController;
import com.helpline.crm.admin.AdminService;
import com.helpline.crm.common.HealthController;
import com.helpline.crm.config.SecurityConfig.JwtService;
import com.helpline.crm.contact.ContactController;
import com.helpline.crm.contact.ContactService;
import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import com.helpline.crm.domain.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {HealthController.class, ContactController.class, AdminController.class})
@Import({SecurityConfig.class, JwtService.class})
class SecurityConfigTest {
  private static final String SECRET = "test-secret-for-helpline-crm-tests-0123456789";

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private JwtService jwt;

  @MockBean
  private UserRepository userRepository;

  @MockBean
  private ContactService contactService;

  @MockBean
  private AdminService adminService;

  @Test
  void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
    mockMvc.perform(get("/api/contacts"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.message").value("Not authenticated"));
  }

  @Test
  void malformedTokenIsUnauthorized() throws Exception {
    mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Invalid token"));
  }

  @Test
  void expiredTokenIsUnauthorized() throws Exception {
    var expired = new JwtService(SECRET, -1).generate("u-agent", Role.AGENT);

    mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, "Bearer " + expired))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Token expired"));
  }

  @Test
  void tokenForDeletedUserIsUnauthorized() throws Exception {
    when(userRepository.findById("u-gone")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, bearer("u-gone", Role.AGENT)))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("User not found"));
  }

  @Test
  void inactiveAccountIsForbidden() throws Exception {
    stubUser("u-off", Role.AGENT, UserStatus.INACTIVE);

    mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, bearer("u-off", Role.AGENT)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.message").value("Account is deactivated"));
  }

  @Test
  void anyRoleReachesContacts() throws Exception {
    stubUser("u-sup", Role.SUPERVISOR, UserStatus.ACTIVE);
    when(contactService.list(any(), any())).thenReturn(List.of());

    mockMvc.perform(get("/api/contacts").header(HttpHeaders.AUTHORIZATION, bearer("u-sup", Role.SUPERVISOR)))
        .andExpect(status().isOk());
  }

  @Test
  void agentCannotReachAdminRoutes() throws Exception {
    stubUser("u-agent", Role.AGENT, UserStatus.ACTIVE);

    mockMvc.perform(get("/api/admin/stats").header(HttpHeaders.AUTHORIZATION, bearer("u-agent", Role.AGENT)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("FORBIDDEN"))
        .andExpect(jsonPath("$.message").value("Access denied. Required roles: admin"));
  }

  @Test
  void supervisorCannotReachAdminRoutes() throws Exception {
    stubUser("u-sup", Role.SUPERVISOR, UserStatus.ACTIVE);

    mockMvc.perform(get("/api/admin/users").header(HttpHeaders.AUTHORIZATION, bearer("u-sup", Role.SUPERVISOR)))
        .andExpect(status().isForbidden());
  }

  @Test
  void roleComesFromStoredAccountNotTokenClaim() throws Exception {
    stubUser("u-demoted", Role.AGENT, UserStatus.ACTIVE);

    mockMvc.perform(get("/api/admin/stats").header(HttpHeaders.AUTHORIZATION, bearer("u-demoted", Role.ADMIN)))
        .andExpect(status().isForbidden());
  }

  @Test
  void adminReachesAdminRoutes() throws Exception {
    stubUser("u-admin", Role.ADMIN, UserStatus.ACTIVE);
    when(adminService.stats()).thenReturn(Map.of("contacts", Map.of("total", 4L)));

    mockMvc.perform(get("/api/admin/stats").header(HttpHeaders.AUTHORIZATION, bearer("u-admin", Role.ADMIN)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.contacts.total").value(4));
  }

  @Test
  void healthIsPublicAndIgnoresBadTokens() throws Exception {
    mockMvc.perform(get("/api/").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.authenticated_as").doesNotExist());
  }

  @Test
  void healthEchoesOptionalIdentity() throws Exception {
    stubUser("u-agent", Role.AGENT, UserStatus.ACTIVE);

    mockMvc.perform(get("/api/").header(HttpHeaders.AUTHORIZATION, bearer("u-agent", Role.AGENT)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.authenticated_as").value("u-agent@helpline.test"));
  }

  private String bearer(String userId, Role role) {
    return "Bearer " + jwt.generate(userId, role);
  }

  private void stubUser(String id, Role role, UserStatus status) {
    UserEntity u = new UserEntity();
    u.id = id;
    u.email = id + "@helpline.test";
    u.name = id;
    u.role = role;
    u.status = status;
    when(userRepository.findById(id)).thenReturn(Optional.of(u));
  }
}
