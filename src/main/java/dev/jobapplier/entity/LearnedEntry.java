package dev.jobapplier.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A learned question/answer pair. One row per normalized question text.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "question_bank", indexes = {
        @Index(name = "idx_question_norm", columnList = "question_normalized"),
        @Index(name = "idx_similarity_hash", columnList = "similarity_hash")
})
public class LearnedEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2048)
    private String question;

    @Column(name = "question_normalized", nullable = false, unique = true, length = 2048)
    private String questionNormalized;

    @Column(nullable = false, length = 8192)
    private String answer;

    @Column(name = "job_title")
    private String jobTitle;

    private String company;

    @Column(name = "job_context", length = 4096)
    private String jobContext;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_used")
    private LocalDateTime lastUsedAt;

    @Column(name = "times_used", nullable = false)
    private int timesUsed;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "similarity_hash", length = 64)
    private String fingerprintHash;
}
