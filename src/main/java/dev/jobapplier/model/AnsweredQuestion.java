package dev.jobapplier.model;

/**
 * Final answer for a question. A skipped question always carries an empty answer and must not be submitted.
 */
public record AnsweredQuestion(
        Question question,
        String answer,
        AnswerSource source,
        double confidenceScore,
        String reason) {

    public AnsweredQuestion {
        if (source == AnswerSource.SKIPPED) {
            answer = "";
        }
    }

    public static AnsweredQuestion answered(Question question, String answer, AnswerSource source, double score) {
        return new AnsweredQuestion(question, answer, source, score, null);
    }

    public static AnsweredQuestion skipped(Question question, double score, String reason) {
        return new AnsweredQuestion(question, "", AnswerSource.SKIPPED, score, reason);
    }

    public boolean isSkipped() {
        return source == AnswerSource.SKIPPED;
    }
}
