package com.example.formlayout.api;

import com.example.formlayout.service.LayoutToolService;
import com.example.formlayout.service.LayoutTools;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tools")
public class LayoutToolController {

    private final LayoutToolService tools;

    public LayoutToolController(LayoutToolService tools) {
        this.tools = tools;
    }

    @GetMapping
    public List<String> list() {
        return LayoutTools.ALL;
    }

    @PostMapping("/{name}")
    public JsonNode call(@PathVariable String name, @RequestBody(required = false) JsonNode args) {
        return tools.handle(name, args);
    }
}
