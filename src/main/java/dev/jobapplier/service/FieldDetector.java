package dev.jobapplier.service;

import dev.jobapplier.model.FieldDescriptor;
import dev.jobapplier.model.FieldType;
import dev.jobapplier.util.Elements;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the interactive fields of a form and collects every label source for each of them.
 */
@Slf4j
@Component
public class FieldDetector {

    private static final By FIELDS = By.xpath(".//input|.//select|.//textarea");
    private static final By ANCESTOR_LABEL = By.xpath("ancestor::label");

    private static final Set<String> IGNORED_INPUT_TYPES = Set.of("hidden", "submit", "button", "reset", "image");

    /**
     * Detect the fillable fields under {@code form}, in document order.
     * Label candidates are aria-label, name, id, placeholder, then the associated {@code <label>} text.
     *
     * @param form form element, or the driver itself to scan the whole page
     * @return descriptors, empty when the form has no fillable field
     */
    public List<FieldDescriptor> detectFields(SearchContext form) {
        List<WebElement> elements;
        try {
            elements = form.findElements(FIELDS);
        } catch (RuntimeException e) {
            log.warn("Could not enumerate form fields: {}", e.getMessage());
            return List.of();
        }

        List<FieldDescriptor> fields = new ArrayList<>();
        for (WebElement element : elements) {
            try {
                String tag = Elements.tagName(element);
                String type = Elements.attr(element, "type");
                if ("input".equalsIgnoreCase(tag) && IGNORED_INPUT_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                fields.add(describe(form, element, FieldType.of(tag, type)));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable field: {}", e.getMessage());
            }
        }

        log.debug("Detected {} fields", fields.size());
        return fields;
    }

    private FieldDescriptor describe(SearchContext form, WebElement element, FieldType type) {
        Map<String, String> candidates = new LinkedHashMap<>();
        addCandidate(candidates, Elements.attr(element, "aria-label"));
        addCandidate(candidates, Elements.attr(element, "name"));
        String id = Elements.attr(element, "id");
        addCandidate(candidates, id);
        addCandidate(candidates, Elements.attr(element, "placeholder"));
        addCandidate(candidates, associatedLabel(form, element, id));

        boolean required = element.getAttribute("required") != null
                || "true".equalsIgnoreCase(Elements.attr(element, "aria-required"));

        return FieldDescriptor.builder()
                .element(element)
                .labelCandidates(candidates.values())
                .fieldType(type)
                .required(required)
                .build();
    }

    private String associatedLabel(SearchContext form, WebElement element, String id) {
        try {
            if (!id.isBlank()) {
                for (WebElement label : form.findElements(By.cssSelector("label[for='" + id.replace("'", "\\'") + "']"))) {
                    String text = Elements.text(label);
                    if (!text.isBlank()) {
                        return text;
                    }
                }
            }
            for (WebElement label : element.findElements(ANCESTOR_LABEL)) {
                String text = Elements.text(label);
                if (!text.isBlank()) {
                    return text;
                }
            }
        } catch (RuntimeException e) {
            log.debug("Label lookup failed: {}", e.getMessage());
        }
        return "";
    }

    // first occurrence wins, compared case-insensitively
    private void addCandidate(Map<String, String> candidates, String value) {
        if (value != null && !value.isBlank()) {
            candidates.putIfAbsent(value.trim().toLowerCase(Locale.ROOT), value.trim());
        }
    }
}
