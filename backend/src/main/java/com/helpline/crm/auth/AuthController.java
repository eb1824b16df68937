package com.helpline.crm.auth;

import com.helpline.crm.auth.AuthService.TokenResponse;
import com.helpline.crm.domain.Entities.UserEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController @RequestMapping("/api/auth") @Validated
public class AuthController {
  private final AuthService auth;
  public AuthController(AuthService auth){this.auth=auth;}

  public record RegisterReq(@NotBlank @Email String email, @NotBlank String password, @NotBlank String name){}
  public record LoginReq(@NotBlank @Email String email, @NotBlank String password){}

  @PostMapping("/register")
  TokenResponse register(@Valid @RequestBody RegisterReq req){
    return auth.register(req.email(), req.password(), req.name());
  }

  @PostMapping("/login")
  TokenResponse login(@Valid @RequestBody LoginReq req){
    return auth.login(req.email(), req.password());
  }

  @GetMapping("/me")
  UserView me(@AuthenticationPrincipal UserEntity user){
    return UserView.of(user);
  }
}
