package cn.bitsleep.sysdocs.config;

import cn.bitsleep.sysdocs.auth.PasswordHasher;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.repo.UserRepository;
import cn.bitsleep.sysdocs.service.DocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the administrator account and a few sample documents on first start.
 * Does nothing once the administrator exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataLoader implements CommandLineRunner {

    private final UserRepository userRepository;
    private final DocumentService documentService;
    private final PasswordHasher passwordHasher;

    @Value("${sysdocs.seed.enabled:false}")
    private boolean enabled;

    @Value("${sysdocs.seed.admin-name:System Administrator}")
    private String adminName;

    @Value("${sysdocs.seed.admin-email:admin@localhost}")
    private String adminEmail;

    @Value("${sysdocs.seed.admin-password:}")
    private String adminPassword;

    @Override
    public void run(String... args) {
        if (!enabled) {
            log.info("Data loader disabled for this environment");
            return;
        }
        if (adminPassword == null || adminPassword.isBlank()) {
            throw new IllegalStateException("sysdocs.seed.admin-password must be set when seeding is enabled");
        }
        if (userRepository.existsByEmail(adminEmail)) {
            log.info("Administrator {} already present, skipping seed", adminEmail);
            return;
        }
        User admin = userRepository.save(User.builder()
                .name(adminName)
                .email(adminEmail)
                .passwordHash(passwordHasher.hash(adminPassword))
                .role(Role.ADMIN)
                .build());
        log.info("Created admin user {}", admin.getId());
        createSampleDocuments(admin.getId());
    }

    private void createSampleDocuments(Long authorId) {
        documentService.create(authorId, "Server Maintenance Checklist",
                "Weekly server maintenance tasks:\n1. Check disk space\n2. Review system logs\n3. Update security patches\n4. Backup verification",
                "TODO", "HIGH");
        documentService.create(authorId, "Network Configuration Guide",
                "Network setup documentation:\n1. Router configuration\n2. VLAN setup\n3. Firewall rules\n4. DNS configuration",
                "IN_PROGRESS", "MEDIUM");
        documentService.create(authorId, "Backup Procedures",
                "Daily backup procedures completed:\n1. Database backup\n2. File system backup\n3. Configuration backup\n4. Verification tests passed",
                "DONE", "HIGH");
        log.info("Created 3 sample documents");
    }
}
