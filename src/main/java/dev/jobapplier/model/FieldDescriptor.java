package dev.jobapplier.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.openqa.selenium.WebElement;

import java.util.List;

/**
 * A form field found on the page. Label candidates are ordered most authoritative first
 * (aria-label, name, id, placeholder, associated label text).
 */
@Value
@Builder
public class FieldDescriptor {

    WebElement element;
    @Singular
    List<String> labelCandidates;
    FieldType fieldType;
    boolean required;

    public boolean isMatchable() {
        return !labelCandidates.isEmpty();
    }

    /**
     * Key used in fill reports: the first label candidate, or a positional key for unlabeled fields.
     */
    public String displayKey(int index) {
        return labelCandidates.isEmpty() ? "field_" + index : labelCandidates.get(0);
    }
}
