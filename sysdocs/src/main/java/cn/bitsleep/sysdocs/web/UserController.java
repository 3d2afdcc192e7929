package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.auth.CurrentUser;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.service.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    public static final int MIN_PASSWORD_LENGTH = 6;

    private final UserService service;
    private final CurrentUser currentUser;

    @PostMapping
    public ResponseEntity<UserResponse> create(@Valid @RequestBody CreateUser req) {
        User user = service.register(req.getName(), req.getEmail(), req.getPassword(), req.getRole(),
                currentUser.get().orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @GetMapping
    public List<UserResponse> list() {
        currentUser.require(Role.ADMIN);
        return service.list().stream().map(UserResponse::from).toList();
    }

    @PatchMapping("/{id}/role")
    public UserResponse changeRole(@PathVariable Long id, @Valid @RequestBody ChangeRole req) {
        currentUser.require(Role.ADMIN);
        return UserResponse.from(service.changeRole(id, req.getRole()));
    }

    @Data
    public static class CreateUser {
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name too long")
        private String name;
        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email address")
        @Size(max = 255, message = "Email too long")
        private String email;
        // characters here; the 72-byte bcrypt limit is checked by UserService
        @NotBlank(message = "Password is required")
        @Size(min = MIN_PASSWORD_LENGTH, max = 72, message = "Password must be between 6 and 72 characters")
        private String password;
        private String role;
    }

    @Data
    public static class ChangeRole {
        @NotBlank(message = "Role is required")
        private String role;
    }
}
