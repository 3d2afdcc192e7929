package cn.bitsleep.sysdocs.service;

import cn.bitsleep.sysdocs.domain.Document;
import cn.bitsleep.sysdocs.domain.DocumentPriority;
import cn.bitsleep.sysdocs.domain.DocumentStatus;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.error.ForbiddenException;
import cn.bitsleep.sysdocs.error.NotFoundException;
import cn.bitsleep.sysdocs.error.ValidationException;
import cn.bitsleep.sysdocs.repo.DocumentRepository;
import cn.bitsleep.sysdocs.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Create, read, update and delete of documents.
 * <p>
 * Input is validated before the store is touched. Only the author or an
 * {@link Role#ADMIN} may change or remove a document. Status moves freely
 * between the three board columns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentRepository repo;
    private final UserRepository users;
    private final Clock clock;

    @Transactional
    public Document create(Long authorId, String title, String content, String status, String priority) {
        Map<String, String> errors = new LinkedHashMap<>();
        checkTitle(title, errors);
        checkContent(content, errors);
        DocumentStatus s = status == null ? DocumentStatus.TODO : parseStatus(status, errors);
        DocumentPriority p = priority == null ? DocumentPriority.MEDIUM : parsePriority(priority, errors);
        if (!errors.isEmpty()) throw new ValidationException(errors);

        User author = users.findById(authorId)
                .orElseThrow(() -> new NotFoundException("Author not found"));
        Instant now = now();
        Document doc = Document.builder()
                .id(UUID.randomUUID().toString())
                .title(title)
                .content(content)
                .status(s)
                .priority(p)
                .author(author)
                .createdAt(now)
                .updatedAt(now)
                .build();
        repo.save(doc);
        log.info("Document {} created by user {}", doc.getId(), authorId);
        return doc;
    }

    @Transactional(readOnly = true)
    public Document get(String id) {
        return repo.findById(id).orElseThrow(() -> new NotFoundException("Document not found"));
    }

    /**
     * Newest first. Blank filter values are ignored, unknown ones rejected.
     */
    @Transactional(readOnly = true)
    public List<Document> list(String status, String priority) {
        Map<String, String> errors = new LinkedHashMap<>();
        DocumentStatus s = isBlank(status) ? null : parseStatus(status, errors);
        DocumentPriority p = isBlank(priority) ? null : parsePriority(priority, errors);
        if (!errors.isEmpty()) throw new ValidationException(errors);
        return repo.filter(s, p);
    }

    /**
     * Documents grouped by board column, in column order, each column newest first.
     */
    @Transactional(readOnly = true)
    public Map<DocumentStatus, List<Document>> board(String priority) {
        Map<DocumentStatus, List<Document>> columns = new EnumMap<>(DocumentStatus.class);
        for (DocumentStatus s : DocumentStatus.values()) columns.put(s, new ArrayList<>());
        for (Document d : list(null, priority)) columns.get(d.getStatus()).add(d);
        return columns;
    }

    @Transactional
    public Document update(String id, Long requesterId, Role requesterRole, DocumentPatch patch) {
        DocumentPatch p = patch == null ? new DocumentPatch() : patch;
        Map<String, String> errors = new LinkedHashMap<>();
        if (p.getTitle() != null) checkTitle(p.getTitle(), errors);
        if (p.getContent() != null) checkContent(p.getContent(), errors);
        DocumentStatus status = p.getStatus() == null ? null : parseStatus(p.getStatus(), errors);
        DocumentPriority priority = p.getPriority() == null ? null : parsePriority(p.getPriority(), errors);
        if (!errors.isEmpty()) throw new ValidationException(errors);

        Document doc = get(id);
        checkCanModify(doc, requesterId, requesterRole, "edit");

        if (p.getTitle() != null) doc.setTitle(p.getTitle());
        if (p.getContent() != null) doc.setContent(p.getContent());
        if (status != null) doc.setStatus(status);
        if (priority != null) doc.setPriority(priority);
        doc.setUpdatedAt(nextUpdatedAt(doc.getUpdatedAt()));
        repo.save(doc);
        log.info("Document {} updated by user {}", id, requesterId);
        return doc;
    }

    @Transactional
    public void delete(String id, Long requesterId, Role requesterRole) {
        Document doc = get(id);
        checkCanModify(doc, requesterId, requesterRole, "delete");
        repo.delete(doc);
        repo.flush();
        log.info("Document {} deleted by user {}", id, requesterId);
    }

    private void checkCanModify(Document doc, Long requesterId, Role requesterRole, String action) {
        boolean author = requesterId != null && requesterId.equals(doc.getAuthorId());
        if (!author && requesterRole != Role.ADMIN) {
            log.warn("User {} may not {} document {}", requesterId, action, doc.getId());
            throw new ForbiddenException("Forbidden: You can only " + action + " your own documents");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    // strictly after the previous value even when the clock has not moved
    private Instant nextUpdatedAt(Instant previous) {
        Instant now = now();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    private static void checkTitle(String title, Map<String, String> errors) {
        if (isBlank(title)) errors.put("title", "Title is required");
        else if (title.length() > Document.MAX_TITLE_LENGTH) errors.put("title", "Title too long");
    }

    private static void checkContent(String content, Map<String, String> errors) {
        if (isBlank(content)) errors.put("content", "Content is required");
    }

    private static DocumentStatus parseStatus(String value, Map<String, String> errors) {
        try {
            return DocumentStatus.fromName(value);
        } catch (IllegalArgumentException e) {
            errors.put("status", "Status must be one of TODO, IN_PROGRESS, DONE");
            return null;
        }
    }

    private static DocumentPriority parsePriority(String value, Map<String, String> errors) {
        try {
            return DocumentPriority.fromName(value);
        } catch (IllegalArgumentException e) {
            errors.put("priority", "Priority must be one of LOW, MEDIUM, HIGH, URGENT");
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
