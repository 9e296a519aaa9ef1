package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Row implements LayoutNode {

    private List<FieldElement> fields = new ArrayList<>();

    public static Row of(FieldElement element) {
        List<FieldElement> fields = new ArrayList<>();
        fields.add(element);
        return new Row(fields);
    }

    @Override
    public String getType() {
        return LayoutTypes.ROW;
    }

    @Override
    public Row copy() {
        List<FieldElement> copied = new ArrayList<>(fields.size());
        for (FieldElement f : fields) {
            copied.add(f.copy());
        }
        return new Row(copied);
    }
}
