package com.example.formlayout.config;

import com.example.formlayout.builder.FormLayoutBuilder;
import com.example.formlayout.editor.LayoutEditor;
import com.example.formlayout.id.IdGenerator;
import com.example.formlayout.id.SequentialIdGenerator;
import com.example.formlayout.id.UuidIdGenerator;
import com.example.formlayout.parser.LayoutNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Slf4j
@Configuration
public class LayoutEngineConfig {

    @Bean
    public IdGenerator idGenerator(LayoutProperties props) {
        String strategy = props.getIdStrategy() == null ? "uuid" : props.getIdStrategy().trim().toLowerCase(Locale.ROOT);
        return switch (strategy) {
            case "uuid" -> new UuidIdGenerator();
            case "sequential" -> new SequentialIdGenerator();
            default -> throw new IllegalStateException(
                    "form-layout.id-strategy must be uuid or sequential, got: " + props.getIdStrategy());
        };
    }

    @Bean
    public LayoutNormalizer layoutNormalizer(IdGenerator idGenerator, LayoutProperties props) {
        if (props.isStrict()) {
            log.info("Layout normalizer runs in strict mode: malformed layouts are rejected");
        }
        return new LayoutNormalizer(idGenerator, props.isStrict());
    }

    @Bean
    public FormLayoutBuilder formLayoutBuilder(IdGenerator idGenerator) {
        return new FormLayoutBuilder(idGenerator);
    }

    @Bean
    public LayoutEditor layoutEditor() {
        return new LayoutEditor();
    }
}
