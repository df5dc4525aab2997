package dev.jobapplier.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * What is known about the listing being applied to. Passed to the answer generator and stored with
 * learned answers.
 */
@Value
@Builder
public class JobContext {

    private static final int DESCRIPTION_SNIPPET_LENGTH = 500;

    String jobTitle;
    String company;
    String location;
    String jobDescription;

    public static JobContext empty() {
        return JobContext.builder().build();
    }

    public String getJobDescriptionSnippet() {
        if (jobDescription == null) {
            return "";
        }
        return jobDescription.length() > DESCRIPTION_SNIPPET_LENGTH
                ? jobDescription.substring(0, DESCRIPTION_SNIPPET_LENGTH)
                : jobDescription;
    }

    /**
     * Multi-line summary used in prompts and persisted as {@code job_context}; empty when nothing is known.
     */
    public String toPromptContext() {
        List<String> parts = new ArrayList<>();
        if (jobTitle != null && !jobTitle.isBlank()) {
            parts.add("Job Title: " + jobTitle);
        }
        if (company != null && !company.isBlank()) {
            parts.add("Company: " + company);
        }
        if (location != null && !location.isBlank()) {
            parts.add("Location: " + location);
        }
        String snippet = getJobDescriptionSnippet();
        if (!snippet.isBlank()) {
            parts.add("Job Description: " + snippet);
        }
        return String.join("\n", parts);
    }
}
