package com.example.formlayout.validation;

import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldSize;
import com.example.formlayout.model.LayoutNode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Field sizes are pixel counts written as decimal strings; anything else is refused by the store.
 */
public final class FieldSizeValidator {

    private static final Pattern PIXELS = Pattern.compile("[1-9][0-9]*");

    private FieldSizeValidator() {}

    /**
     * @throws InvalidFieldSizeException for the first bad value found
     */
    public static void validate(List<? extends LayoutNode> layout) {
        LayoutFieldCollector.forEachFieldElement(layout, fe -> {
            if (fe instanceof Field) {
                validate((Field) fe);
            }
        });
    }

    public static void validate(Field field) {
        FieldSize size = field.getSize();
        if (size == null) {
            return;
        }
        check(field, "width", size.getWidth());
        check(field, "height", size.getHeight());
        check(field, "innerHeight", size.getInnerHeight());
    }

    private static void check(Field field, String name, String value) {
        if (value == null) {
            return;
        }
        if (!PIXELS.matcher(value.trim()).matches()) {
            throw new InvalidFieldSizeException("size." + name + " of field \"" + field.getCode()
                    + "\" must be a positive integer string, got \"" + value + "\"");
        }
    }
}
