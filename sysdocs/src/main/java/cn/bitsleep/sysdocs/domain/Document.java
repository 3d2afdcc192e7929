package cn.bitsleep.sysdocs.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    public static final int MAX_TITLE_LENGTH = 200;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id; // UUID as string

    @Column(name = "title", nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DocumentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private DocumentPriority priority;

    @ManyToOne(optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_documents_author"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;

    // set by DocumentService from the application clock
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Long getAuthorId() { return author == null ? null : author.getId(); }
}
