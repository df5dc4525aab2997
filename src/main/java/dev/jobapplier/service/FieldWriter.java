package dev.jobapplier.service;

import dev.jobapplier.model.FieldType;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.SelectStrategy;
import dev.jobapplier.model.WriteResult;
import dev.jobapplier.util.Elements;
import dev.jobapplier.util.TextSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Select;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Writes values into form inputs: typing, option selection, checking and file upload.
 * <p>
 * Methods never throw for a single element; a failed write comes back as a {@link WriteResult} with a reason.
 */
@Slf4j
@Component
public class FieldWriter {

    private static final By INPUTS = By.xpath(".//input|.//select|.//textarea");

    private static final Set<String> AFFIRMATIVE = Set.of("yes", "y", "true", "1", "on", "checked", "agree");

    public WriteResult write(WebElement element, FieldType type, String value) {
        switch (type) {
            case SELECT:
                return selectOption(element, value)
                        .map(WriteResult::selected)
                        .orElseGet(() -> WriteResult.failed(FormFillReasons.SELECT_FAILED));
            case CHECKBOX:
                return setChecked(element, isAffirmative(value));
            case RADIO:
                return chooseRadio(element, value);
            case FILE:
                return uploadFile(element, value);
            default:
                return fillText(element, value);
        }
    }

    public WriteResult fillText(WebElement element, String value) {
        try {
            element.clear();
            element.sendKeys(value);
            return WriteResult.ok();
        } catch (RuntimeException e) {
            log.warn("Failed to type into field: {}", e.getMessage());
            return WriteResult.failed(FormFillReasons.FILL_FAILED);
        }
    }

    /**
     * Select by visible text first, then by option value.
     *
     * @return the strategy that worked, empty when neither did
     */
    public Optional<SelectStrategy> selectOption(WebElement element, String value) {
        Select select;
        try {
            select = new Select(element);
        } catch (RuntimeException e) {
            log.warn("Element is not a usable select: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            select.selectByVisibleText(value);
            return Optional.of(SelectStrategy.VISIBLE_TEXT);
        } catch (NoSuchElementException e) {
            log.debug("No option with visible text '{}', trying value", value);
        } catch (RuntimeException e) {
            log.warn("Select by visible text failed: {}", e.getMessage());
        }
        try {
            select.selectByValue(value);
            return Optional.of(SelectStrategy.VALUE);
        } catch (RuntimeException e) {
            log.warn("Could not select '{}' by text or value", value);
            return Optional.empty();
        }
    }

    public WriteResult setChecked(WebElement element, boolean checked) {
        try {
            if (element.isSelected() != checked) {
                element.click();
            }
            return WriteResult.ok();
        } catch (RuntimeException e) {
            log.warn("Failed to toggle checkbox: {}", e.getMessage());
            return WriteResult.failed(FormFillReasons.CLICK_FAILED);
        }
    }

    /**
     * Sends the absolute path of an existing file to a file input. The path is checked before the element is
     * touched.
     */
    public WriteResult uploadFile(WebElement element, String path) {
        if (path == null || path.isBlank()) {
            return WriteResult.failed(FormFillReasons.FILE_NOT_FOUND);
        }
        Path file = Paths.get(path.trim());
        if (!Files.isRegularFile(file)) {
            log.warn("File to upload not found: {}", file);
            return WriteResult.failed(FormFillReasons.FILE_NOT_FOUND);
        }
        try {
            element.sendKeys(file.toAbsolutePath().toString());
            log.info("Uploaded {}", file.getFileName());
            return WriteResult.ok();
        } catch (RuntimeException e) {
            log.warn("Upload failed for {}: {}", file.getFileName(), e.getMessage());
            return WriteResult.failed(FormFillReasons.FILL_FAILED);
        }
    }

    /**
     * Writes an answer into the input belonging to a question container.
     * Radio groups pick the option whose value or label matches the answer.
     */
    public WriteResult applyAnswer(WebElement questionElement, String answer) {
        List<WebElement> inputs;
        try {
            inputs = questionElement.findElements(INPUTS);
        } catch (RuntimeException e) {
            log.warn("Could not look up inputs of question: {}", e.getMessage());
            return WriteResult.failed(FormFillReasons.NO_INPUT);
        }
        if (inputs.isEmpty()) {
            return WriteResult.failed(FormFillReasons.NO_INPUT);
        }

        WebElement first = inputs.get(0);
        FieldType type = FieldType.of(Elements.tagName(first), Elements.attr(first, "type"));
        if (type != FieldType.RADIO) {
            return write(first, type, answer);
        }
        for (WebElement radio : inputs) {
            if (optionMatches(radio, answer)) {
                return setChecked(radio, true);
            }
        }
        return WriteResult.failed(FormFillReasons.NO_ANSWER);
    }

    public static boolean isAffirmative(String value) {
        return value != null && AFFIRMATIVE.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    // grouped radios are each reported as a field; only the option matching the answer is checked
    private WriteResult chooseRadio(WebElement radio, String value) {
        if (optionMatches(radio, value)) {
            return setChecked(radio, true);
        }
        if (isStandaloneRadio(radio) && isAffirmative(value)) {
            return setChecked(radio, true);
        }
        return WriteResult.otherOption();
    }

    // no value attribute means the browser submits "on", so the radio carries no option of its own
    private boolean isStandaloneRadio(WebElement radio) {
        String value = Elements.attr(radio, "value");
        return value.isEmpty() || "on".equalsIgnoreCase(value);
    }

    private boolean optionMatches(WebElement radio, String answer) {
        return TextSimilarity.sameNormalized(answer, Elements.attr(radio, "value"))
                || TextSimilarity.sameNormalized(answer, Elements.attr(radio, "aria-label"));
    }
}
