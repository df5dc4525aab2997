package dev.jobapplier.repository;

import dev.jobapplier.entity.LearnedEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the learned question bank.
 */
@Repository
public interface LearnedEntryRepository extends JpaRepository<LearnedEntry, Long> {

    Optional<LearnedEntry> findByQuestionNormalized(String questionNormalized);

    /**
     * Most used entries first, most recently used breaking ties.
     */
    @Query("SELECT e FROM LearnedEntry e ORDER BY e.timesUsed DESC, e.lastUsedAt DESC")
    List<LearnedEntry> findMostUsed(Pageable pageable);
}
