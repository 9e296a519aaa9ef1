package com.example.formlayout.parser;

import com.example.formlayout.model.LayoutElement;
import com.example.formlayout.model.LayoutWarning;

import java.util.List;

public record ParsedElement(LayoutElement element, List<LayoutWarning> warnings, List<LayoutWarning> notices) {}
