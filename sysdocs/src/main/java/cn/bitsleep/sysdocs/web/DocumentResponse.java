package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.domain.Document;
import cn.bitsleep.sysdocs.domain.DocumentPriority;
import cn.bitsleep.sysdocs.domain.DocumentStatus;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;

import java.time.Instant;

public record DocumentResponse(String id,
                               String title,
                               String content,
                               DocumentStatus status,
                               DocumentPriority priority,
                               Long authorId,
                               Author author,
                               Instant createdAt,
                               Instant updatedAt) {

    public record Author(Long id, String name, String email, Role role) {
        static Author from(User u) { return new Author(u.getId(), u.getName(), u.getEmail(), u.getRole()); }
    }

    public static DocumentResponse from(Document d) {
        return new DocumentResponse(d.getId(), d.getTitle(), d.getContent(), d.getStatus(), d.getPriority(),
                d.getAuthorId(), Author.from(d.getAuthor()), d.getCreatedAt(), d.getUpdatedAt());
    }
}
