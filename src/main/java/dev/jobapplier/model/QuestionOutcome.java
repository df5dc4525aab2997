package dev.jobapplier.model;

/**
 * What happened when a question widget on the page was answered.
 *
 * @param answered       the answer decision
 * @param status         whether the widget was filled
 * @param reason         reason code for skips and failures
 * @param selectStrategy strategy that chose a {@code <select>} option, null for other inputs
 */
public record QuestionOutcome(
        AnsweredQuestion answered,
        FillStatus status,
        String reason,
        SelectStrategy selectStrategy) {

    public static QuestionOutcome skipped(AnsweredQuestion answered) {
        return new QuestionOutcome(answered, FillStatus.SKIPPED, answered.reason(), null);
    }
}
