package dev.jobapplier.ai;

import dev.jobapplier.model.JobContext;

final class AnswerPrompt {

    static final String SYSTEM_MESSAGE = "You are an expert at answering job application questions.";

    private AnswerPrompt() {
    }

    static String build(String question, JobContext context) {
        StringBuilder prompt = new StringBuilder()
                .append("Answer this job application question professionally and concisely:\n\n")
                .append("Question: ").append(question);
        String jobContext = context == null ? "" : context.toPromptContext();
        if (!jobContext.isBlank()) {
            prompt.append("\n\nJob Context:\n").append(jobContext);
        }
        return prompt.append("\n\nProvide only the answer, no explanation.").toString();
    }

    static String clean(String content) {
        return content == null ? "" : content.trim();
    }
}
