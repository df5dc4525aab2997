package dev.jobapplier.service;

import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.entity.LearnedEntry;
import dev.jobapplier.model.JobContext;
import dev.jobapplier.model.LearnedMatch;
import dev.jobapplier.repository.LearnedEntryRepository;
import dev.jobapplier.util.QuestionFingerprint;
import dev.jobapplier.util.TextSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable question/answer cache backed by the {@code question_bank} table.
 * <p>
 * Rows are created and updated, never deleted. Assumes a single writer per database file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearnedAnswerStore {

    private final LearnedEntryRepository repository;
    private final MatchingConfig matchingConfig;

    /**
     * Find the entry for a question: exact normalized match first, then the most similar entry at or above
     * {@code threshold}. Among equally similar entries the most used one wins.
     *
     * @param question  raw or normalized question text
     * @param threshold minimum Jaccard similarity for a near-duplicate
     * @return the entry with the similarity that selected it
     */
    @Transactional(readOnly = true)
    public Optional<LearnedMatch> findMatch(String question, double threshold) {
        String normalized = TextSimilarity.normalize(question);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        Optional<LearnedEntry> exact = repository.findByQuestionNormalized(normalized);
        if (exact.isPresent()) {
            return Optional.of(new LearnedMatch(exact.get(), 1.0));
        }

        LearnedMatch best = null;
        for (LearnedEntry entry : repository.findAll()) {
            double similarity = TextSimilarity.jaccard(normalized, entry.getQuestionNormalized());
            if (similarity < threshold) {
                continue;
            }
            if (best == null
                    || similarity > best.similarity()
                    || (similarity == best.similarity() && entry.getTimesUsed() > best.entry().getTimesUsed())) {
                best = new LearnedMatch(entry, similarity);
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<LearnedEntry> lookup(String question, double threshold) {
        return findMatch(question, threshold).map(LearnedMatch::entry);
    }

    /**
     * Store an answer. An exact match takes the new answer and job context; a near-duplicate keeps its answer.
     * Either way the existing row's usage is bumped instead of inserting a second one.
     *
     * @return the stored row
     */
    @Transactional
    public LearnedEntry upsert(String question, String answer, JobContext context) {
        String normalized = TextSimilarity.normalize(question);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Question must contain at least one word");
        }
        JobContext job = context == null ? JobContext.empty() : context;
        LocalDateTime now = LocalDateTime.now();

        Optional<LearnedMatch> existing = findMatch(normalized, matchingConfig.getLearnedMergeThreshold());
        if (existing.isPresent()) {
            LearnedEntry entry = existing.get().entry();
            boolean exact = normalized.equals(entry.getQuestionNormalized());
            if ((exact || isBlank(entry.getAnswer())) && !isBlank(answer)) {
                entry.setAnswer(answer);
            }
            if (exact) {
                entry.setJobTitle(job.getJobTitle());
                entry.setCompany(job.getCompany());
                entry.setJobContext(job.toPromptContext());
            }
            entry.setTimesUsed(entry.getTimesUsed() + 1);
            entry.setLastUsedAt(now);
            log.debug("Updated learned entry {} ({} uses)", entry.getId(), entry.getTimesUsed());
            return repository.save(entry);
        }

        LearnedEntry entry = LearnedEntry.builder()
                .question(question.trim())
                .questionNormalized(normalized)
                .answer(answer == null ? "" : answer)
                .jobTitle(job.getJobTitle())
                .company(job.getCompany())
                .jobContext(job.toPromptContext())
                .fingerprintHash(QuestionFingerprint.of(normalized))
                .createdAt(now)
                .lastUsedAt(now)
                .timesUsed(1)
                .successCount(0)
                .build();
        LearnedEntry saved = repository.save(entry);
        log.info("Learned new answer for '{}'", question.trim());
        return saved;
    }

    @Transactional
    public void recordUsage(Long id) {
        repository.findById(id).ifPresent(entry -> {
            entry.setTimesUsed(entry.getTimesUsed() + 1);
            entry.setLastUsedAt(LocalDateTime.now());
            repository.save(entry);
        });
    }

    /**
     * Count a submitted answer as a success for the entry behind the question.
     *
     * @return true when an entry was found
     */
    @Transactional
    public boolean recordSuccess(String question) {
        Optional<LearnedEntry> entry = lookup(question, matchingConfig.getLearnedMergeThreshold());
        entry.ifPresent(e -> {
            e.setSuccessCount(e.getSuccessCount() + 1);
            repository.save(e);
        });
        return entry.isPresent();
    }

    /**
     * Most used entries, most recently used first on ties.
     */
    @Transactional(readOnly = true)
    public List<LearnedEntry> topEntries(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findMostUsed(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
