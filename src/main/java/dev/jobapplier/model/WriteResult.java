package dev.jobapplier.model;

/**
 * Result of writing one value into a page element.
 */
public record WriteResult(boolean success, String reason, SelectStrategy selectStrategy) {

    public static WriteResult ok() {
        return new WriteResult(true, null, null);
    }

    public static WriteResult selected(SelectStrategy strategy) {
        return new WriteResult(true, null, strategy);
    }

    public static WriteResult failed(String reason) {
        return new WriteResult(false, reason, null);
    }

    /**
     * The element is a radio option for a different answer in the same group; it was left alone on purpose.
     */
    public static WriteResult otherOption() {
        return new WriteResult(false, FormFillReasons.OTHER_OPTION, null);
    }

    public boolean isOtherOption() {
        return !success && FormFillReasons.OTHER_OPTION.equals(reason);
    }
}
