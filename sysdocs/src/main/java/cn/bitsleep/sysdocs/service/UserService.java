package cn.bitsleep.sysdocs.service;

import cn.bitsleep.sysdocs.auth.AuthUser;
import cn.bitsleep.sysdocs.auth.PasswordHasher;
import cn.bitsleep.sysdocs.auth.TokenClaims;
import cn.bitsleep.sysdocs.auth.TokenService;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.error.ConflictException;
import cn.bitsleep.sysdocs.error.ForbiddenException;
import cn.bitsleep.sysdocs.error.NotFoundException;
import cn.bitsleep.sysdocs.error.UnauthenticatedException;
import cn.bitsleep.sysdocs.error.ValidationException;
import cn.bitsleep.sysdocs.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository repo;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;

    /**
     * Registers a new account. Any role other than {@link Role#USER} may only be
     * handed out by an administrator.
     *
     * @param requester the caller, or null for anonymous self-registration
     */
    @Transactional
    public User register(String name, String email, String password, String role, AuthUser requester) {
        if (password != null && !PasswordHasher.fits(password)) {
            throw new ValidationException("password", "Password must be at most 72 bytes");
        }
        Role r;
        try {
            r = role == null || role.isBlank() ? Role.USER : Role.fromName(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("role", "Role must be one of ADMIN, EDITOR, USER");
        }
        if (r != Role.USER && (requester == null || !requester.isAdmin())) {
            throw new ForbiddenException("Forbidden: only administrators can assign roles");
        }
        if (repo.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }
        User user = User.builder()
                .name(name)
                .email(email)
                .passwordHash(passwordHasher.hash(password))
                .role(r)
                .build();
        try {
            repo.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration of the same email
            throw new ConflictException("Email already registered");
        }
        log.info("Registered user {} with role {}", user.getId(), r);
        return user;
    }

    /**
     * The failure is the same whether the email is unknown or the password is wrong.
     */
    @Transactional(readOnly = true)
    public LoginResult login(String email, String password) {
        User user = repo.findByEmail(email).orElse(null);
        if (user == null || !passwordHasher.verify(password, user.getPasswordHash())) {
            log.warn("Failed login attempt");
            throw new UnauthenticatedException("INVALID_CREDENTIALS", "Invalid email or password");
        }
        String token = tokenService.sign(new TokenClaims(user.getId(), user.getEmail(), user.getRole()));
        log.info("User {} logged in", user.getId());
        return new LoginResult(user, token);
    }

    @Transactional(readOnly = true)
    public List<User> list() {
        return repo.findAllByOrderByIdAsc();
    }

    @Transactional
    public User changeRole(Long userId, String role) {
        Role r;
        try {
            r = Role.fromName(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("role", "Role must be one of ADMIN, EDITOR, USER");
        }
        User user = repo.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        Role previous = user.getRole();
        user.setRole(r);
        repo.save(user);
        log.info("Role of user {} changed from {} to {}", userId, previous, r);
        return user;
    }
}
