package com.cardpack.core.template;

import com.cardpack.core.TemplateLoadException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link BaseTemplateLoader#tryLoad(java.nio.file.Path)}: either a template or the reason it
 * could not be loaded.
 */
public final class TemplateLoadResult {
    private final BaseTemplate template;
    private final TemplateLoadException error;

    private TemplateLoadResult(BaseTemplate template, TemplateLoadException error) {
        this.template = template;
        this.error = error;
    }

    public static TemplateLoadResult success(BaseTemplate template) {
        return new TemplateLoadResult(Objects.requireNonNull(template, "template"), null);
    }

    public static TemplateLoadResult failure(TemplateLoadException error) {
        return new TemplateLoadResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return template != null;
    }

    public Optional<BaseTemplate> template() {
        return Optional.ofNullable(template);
    }

    public Optional<TemplateLoadException> error() {
        return Optional.ofNullable(error);
    }

    public BaseTemplate orElseThrow() throws TemplateLoadException {
        if (error != null) {
            throw error;
        }
        return template;
    }
}
