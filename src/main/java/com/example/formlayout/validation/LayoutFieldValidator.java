package com.example.formlayout.validation;

import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutWarning;
import com.example.formlayout.store.FormFieldRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Last check before a layout goes to the store:
 *  1. every size is a pixel count
 *  2. every referenced code exists on the form (when the form's fields are known)
 *  3. fields of the form that the layout leaves out are reported, not added
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutFieldValidator {

    private final FormFieldRegistry fieldRegistry;

    /**
     * @return warnings for form fields missing from the layout
     * @throws InvalidFieldSizeException  on a malformed size
     * @throws UnknownFieldCodeException on a code the form does not define
     */
    public List<LayoutWarning> check(String appId, List<? extends LayoutNode> layout) {
        FieldSizeValidator.validate(layout);

        Set<String> known = fieldRegistry.fieldCodes(appId);
        if (known.isEmpty()) {
            log.debug("No field registry entries for app {}, field codes not checked", appId);
            return List.of();
        }

        Set<String> used = LayoutFieldCollector.collectFieldCodes(layout);
        Set<String> unknown = new LinkedHashSet<>(used);
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new UnknownFieldCodeException(appId, unknown);
        }

        List<LayoutWarning> warnings = new ArrayList<>();
        for (String code : known) {
            if (!used.contains(code)) {
                warnings.add(new LayoutWarning("layout", "field \"" + code + "\" is defined on the form but not placed"));
            }
        }
        if (!warnings.isEmpty()) {
            log.warn("Layout of app {} leaves out {} form field(s)", appId, warnings.size());
        }
        return warnings;
    }
}
