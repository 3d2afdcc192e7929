package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.auth.AuthResolver;
import cn.bitsleep.sysdocs.auth.AuthUser;
import cn.bitsleep.sysdocs.auth.CurrentUser;
import cn.bitsleep.sysdocs.auth.TokenService;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.service.LoginResult;
import cn.bitsleep.sysdocs.service.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final CurrentUser currentUser;

    @Value("${sysdocs.auth.cookie-secure:true}")
    private boolean cookieSecure;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginReq req) {
        LoginResult result = userService.login(req.getEmail(), req.getPassword());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, tokenCookie(result.token(), TokenService.TOKEN_TTL).toString())
                .body(Map.of("user", UserResponse.from(result.user())));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, tokenCookie("", Duration.ZERO).toString())
                .body(Map.of("message", "Logged out"));
    }

    @GetMapping("/me")
    public Map<String, Object> me() {
        AuthUser user = currentUser.require();
        return Map.of("user", UserResponse.from(user));
    }

    // same as POST /api/users
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody UserController.CreateUser req) {
        User user = userService.register(req.getName(), req.getEmail(), req.getPassword(), req.getRole(),
                currentUser.get().orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    private ResponseCookie tokenCookie(String value, Duration maxAge) {
        return ResponseCookie.from(AuthResolver.TOKEN_COOKIE, value)
                .httpOnly(true)
                .secure(cookieSecure)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    @Data
    public static class LoginReq {
        @NotBlank(message = "Email is required")
        private String email;
        @NotBlank(message = "Password is required")
        private String password;
    }
}
