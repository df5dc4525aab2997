package dev.jobapplier.util;

import org.openqa.selenium.WebElement;

/**
 * Null-safe reads from Selenium elements. Stale or detached elements read as blank.
 */
public final class Elements {

    private Elements() {
    }

    public static String attr(WebElement element, String name) {
        try {
            String v = element.getAttribute(name);
            return v == null ? "" : v.trim();
        } catch (RuntimeException e) {
            return "";
        }
    }

    public static String tagName(WebElement element) {
        try {
            String tag = element.getTagName();
            return tag == null ? "" : tag.trim();
        } catch (RuntimeException e) {
            return "";
        }
    }

    /**
     * Visible text, falling back to {@code innerText} for elements Selenium reports as empty.
     */
    public static String text(WebElement element) {
        try {
            String text = element.getText();
            if (text != null && !text.isBlank()) {
                return text.trim();
            }
        } catch (RuntimeException e) {
            return attr(element, "innerText");
        }
        return attr(element, "innerText");
    }
}
