package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.auth.AuthResolver;
import cn.bitsleep.sysdocs.auth.PasswordHasher;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.repo.UserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class DocumentWorkflowIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordHasher passwordHasher;

    @BeforeEach
    void seedAdmin() {
        userRepository.save(User.builder()
                .name("System Administrator")
                .email("admin@localhost")
                .passwordHash(passwordHasher.hash("Cambiame123!"))
                .role(Role.ADMIN)
                .build());
    }

    private String json(Map<String, ?> body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private void register(String name, String email, String password) throws Exception {
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", name, "email", email, "password", password))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("USER"))
                .andExpect(jsonPath("$.password").doesNotExist())
                .andExpect(jsonPath("$.passwordHash").doesNotExist());
    }

    private Cookie login(String email, String password) throws Exception {
        MvcResult result = mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", email, "password", password))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value(email))
                .andReturn();
        Cookie cookie = result.getResponse().getCookie(AuthResolver.TOKEN_COOKIE);
        assertNotNull(cookie);
        assertTrue(cookie.isHttpOnly());
        return cookie;
    }

    @Test
    void documentLifecycleAcrossOwnersAndAdmin() throws Exception {
        register("User A", "a@example.com", "password-a");
        Cookie a = login("a@example.com", "password-a");

        MvcResult created = mvc.perform(post("/api/documents").cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Server Maintenance Checklist",
                                "content", "1. Check disk space\n2. Review system logs"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("TODO"))
                .andExpect(jsonPath("$.priority").value("MEDIUM"))
                .andExpect(jsonPath("$.author.email").value("a@example.com"))
                .andReturn();
        String id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mvc.perform(get("/api/documents").cookie(a))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status").value("TODO"));

        mvc.perform(put("/api/documents/" + id).cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "IN_PROGRESS"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.title").value("Server Maintenance Checklist"));

        mvc.perform(get("/api/documents").param("status", "IN_PROGRESS").cookie(a))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(id));
        mvc.perform(get("/api/documents").param("status", "TODO").cookie(a))
                .andExpect(jsonPath("$", hasSize(0)));

        register("User B", "b@example.com", "password-b");
        Cookie b = login("b@example.com", "password-b");

        mvc.perform(put("/api/documents/" + id).cookie(b).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "DONE"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
        mvc.perform(delete("/api/documents/" + id).cookie(b))
                .andExpect(status().isForbidden());

        Cookie admin = login("admin@localhost", "Cambiame123!");
        mvc.perform(put("/api/documents/" + id).cookie(admin).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "DONE"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DONE"));
        mvc.perform(delete("/api/documents/" + id).cookie(admin))
                .andExpect(status().isOk());
        mvc.perform(delete("/api/documents/" + id).cookie(admin))
                .andExpect(status().isNotFound());
        mvc.perform(get("/api/documents/" + id).cookie(a))
                .andExpect(status().isNotFound());
    }

    @Test
    void updateBodyIsValidatedBeforeLookupAndOwnership() throws Exception {
        register("User A", "a@example.com", "password-a");
        register("User B", "b@example.com", "password-b");
        Cookie a = login("a@example.com", "password-a");
        Cookie b = login("b@example.com", "password-b");
        String id = createDocument(a, "Network Configuration Guide");

        mvc.perform(put("/api/documents/missing-id").cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "ARCHIVED"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.status").exists());
        mvc.perform(put("/api/documents/" + id).cookie(b).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", ""))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.title").exists());
        mvc.perform(put("/api/documents/missing-id").cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "DONE"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void explicitNullInUpdateIsRejected() throws Exception {
        register("User A", "a@example.com", "password-a");
        Cookie a = login("a@example.com", "password-a");
        String id = createDocument(a, "Backup Procedures");

        mvc.perform(patch("/api/documents/" + id).cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":null,\"title\":null}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.status").value("Status must be a string"))
                .andExpect(jsonPath("$.details.title").value("Title must be a string"));
        mvc.perform(patch("/api/documents/" + id).cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\":3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.priority").exists());
        mvc.perform(patch("/api/documents/" + id).cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest());

        mvc.perform(get("/api/documents/" + id).cookie(a))
                .andExpect(jsonPath("$.status").value("TODO"))
                .andExpect(jsonPath("$.title").value("Backup Procedures"));
    }

    @Test
    void longContentIsAccepted() throws Exception {
        register("User A", "a@example.com", "password-a");
        Cookie a = login("a@example.com", "password-a");
        String content = "x".repeat(70_000);

        MvcResult created = mvc.perform(post("/api/documents").cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Full log dump", "content", content))))
                .andExpect(status().isCreated())
                .andReturn();
        String id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mvc.perform(put("/api/documents/" + id).cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("content", content + "y"))))
                .andExpect(status().isOk());
        // the list query flushes pending writes to the database
        mvc.perform(get("/api/documents").cookie(a))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value(content + "y"));
    }

    private String createDocument(Cookie cookie, String title) throws Exception {
        MvcResult created = mvc.perform(post("/api/documents").cookie(cookie).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", title, "content", "Steps for " + title))))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(created.getResponse().getContentAsString(), "$.id");
    }

    @Test
    void documentEndpointsRequireAuthentication() throws Exception {
        mvc.perform(get("/api/documents"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"));
        mvc.perform(post("/api/documents").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "t", "content", "c"))))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/documents").cookie(new Cookie(AuthResolver.TOKEN_COOKIE, "forged.token.value")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void invalidEnumValuesAreRejectedWithFieldDetail() throws Exception {
        Cookie admin = login("admin@localhost", "Cambiame123!");

        mvc.perform(post("/api/documents").cookie(admin).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "t", "content", "c", "status", "BLOCKED", "priority", "SEVERE"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.status").exists())
                .andExpect(jsonPath("$.details.priority").exists());
        mvc.perform(get("/api/documents").param("priority", "SEVERE").cookie(admin))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/documents").cookie(admin))
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void boardGroupsDocumentsByStatus() throws Exception {
        Cookie admin = login("admin@localhost", "Cambiame123!");
        mvc.perform(post("/api/documents").cookie(admin).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Backup Procedures", "content", "c", "status", "DONE"))))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/documents/board").cookie(admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.TODO", hasSize(0)))
                .andExpect(jsonPath("$.IN_PROGRESS", hasSize(0)))
                .andExpect(jsonPath("$.DONE[0].title").value("Backup Procedures"));
    }

    @Test
    void loginFailuresAreGeneric() throws Exception {
        register("User A", "a@example.com", "password-a");

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "a@example.com", "password", "wrong-password"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.message").value("Invalid email or password"))
                .andExpect(header().doesNotExist("Set-Cookie"));
        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "ghost@example.com", "password", "password-a"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid email or password"));
    }

    @Test
    void meAndLogout() throws Exception {
        mvc.perform(get("/api/auth/me")).andExpect(status().isUnauthorized());

        Cookie admin = login("admin@localhost", "Cambiame123!");
        mvc.perform(get("/api/auth/me").cookie(admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("admin@localhost"))
                .andExpect(jsonPath("$.user.role").value("ADMIN"));

        MvcResult out = mvc.perform(post("/api/auth/logout").cookie(admin))
                .andExpect(status().isOk())
                .andReturn();
        Cookie cleared = out.getResponse().getCookie(AuthResolver.TOKEN_COOKIE);
        assertNotNull(cleared);
        assertEquals(0, cleared.getMaxAge());
        assertEquals("", cleared.getValue());
    }

    @Test
    void registrationValidatesInput() throws Exception {
        register("User A", "a@example.com", "password-a");

        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Again", "email", "a@example.com", "password", "password-a"))))
                .andExpect(status().isConflict());
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Bad", "email", "not-an-email", "password", "password-a"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.email").exists());
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Short", "email", "short@example.com", "password", "12345"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.password").exists());
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Wide", "email", "wide@example.com",
                                "password", "\u00e9".repeat(40)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.password").value("Password must be at most 72 bytes"));
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Sneaky", "email", "sneaky@example.com",
                                "password", "password-s", "role", "ADMIN"))))
                .andExpect(status().isForbidden());
    }

    @Test
    void userListIsAdminOnly() throws Exception {
        register("User A", "a@example.com", "password-a");
        Cookie a = login("a@example.com", "password-a");
        Cookie admin = login("admin@localhost", "Cambiame123!");

        mvc.perform(get("/api/users")).andExpect(status().isUnauthorized());
        mvc.perform(get("/api/users").cookie(a)).andExpect(status().isForbidden());
        mvc.perform(get("/api/users").cookie(admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].passwordHash").isEmpty());
    }

    @Test
    void roleChangeAppliesWithoutNewLogin() throws Exception {
        register("User A", "a@example.com", "password-a");
        Cookie a = login("a@example.com", "password-a");
        Cookie admin = login("admin@localhost", "Cambiame123!");
        Long aId = userRepository.findByEmail("a@example.com").orElseThrow().getId();

        mvc.perform(get("/api/users").cookie(a)).andExpect(status().isForbidden());
        mvc.perform(patch("/api/users/" + aId + "/role").cookie(a).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "ADMIN"))))
                .andExpect(status().isForbidden());

        mvc.perform(patch("/api/users/" + aId + "/role").cookie(admin).contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "ADMIN"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("ADMIN"));

        // same cookie, token still says USER
        mvc.perform(get("/api/users").cookie(a)).andExpect(status().isOk());
    }
}
