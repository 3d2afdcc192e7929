package cn.bitsleep.sysdocs.config;

import cn.bitsleep.sysdocs.auth.PasswordHasher;
import cn.bitsleep.sysdocs.domain.Document;
import cn.bitsleep.sysdocs.domain.DocumentStatus;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.repo.DocumentRepository;
import cn.bitsleep.sysdocs.repo.UserRepository;
import cn.bitsleep.sysdocs.service.DocumentService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
class DataLoaderTest {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private PasswordHasher passwordHasher;

    private DataLoader loader(boolean enabled, String password) {
        DataLoader loader = new DataLoader(userRepository, documentService, passwordHasher);
        ReflectionTestUtils.setField(loader, "enabled", enabled);
        ReflectionTestUtils.setField(loader, "adminName", "System Administrator");
        ReflectionTestUtils.setField(loader, "adminEmail", "admin@localhost");
        ReflectionTestUtils.setField(loader, "adminPassword", password);
        return loader;
    }

    @Test
    void seedsAdminAndSampleDocumentsOnce() {
        loader(true, "Cambiame123!").run();
        loader(true, "Cambiame123!").run();

        User admin = userRepository.findByEmail("admin@localhost").orElseThrow();
        assertEquals(Role.ADMIN, admin.getRole());
        assertTrue(passwordHasher.verify("Cambiame123!", admin.getPasswordHash()));

        List<Document> docs = documentRepository.findAll();
        assertEquals(3, docs.size());
        assertTrue(docs.stream().allMatch(d -> admin.getId().equals(d.getAuthorId())));
        assertTrue(docs.stream().anyMatch(d -> d.getTitle().equals("Network Configuration Guide")
                && d.getStatus() == DocumentStatus.IN_PROGRESS));
    }

    @Test
    void disabledLoaderDoesNothing() {
        loader(false, "").run();

        assertTrue(userRepository.findByEmail("admin@localhost").isEmpty());
        assertEquals(0, documentRepository.count());
    }

    @Test
    void enabledLoaderRequiresAdminPassword() {
        assertThrows(IllegalStateException.class, () -> loader(true, " ").run());
    }
}
