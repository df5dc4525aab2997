package dev.jobapplier.model;

/**
 * Reason codes recorded in fill reports and question outcomes.
 */
public final class FormFillReasons {

    public static final String NO_LABEL = "no_label";
    public static final String NO_ANSWER = "no_answer";
    public static final String LOW_CONFIDENCE = "low_confidence";
    public static final String FILE_NOT_FOUND = "file_not_found";
    public static final String FILL_FAILED = "fill_failed";
    public static final String SELECT_FAILED = "select_failed";
    public static final String CLICK_FAILED = "click_failed";
    public static final String NO_INPUT = "no_input";
    public static final String NO_TEXT = "no_text";
    public static final String OTHER_OPTION = "other_option";

    private FormFillReasons() {
    }
}
