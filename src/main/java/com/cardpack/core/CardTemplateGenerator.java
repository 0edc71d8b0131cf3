package com.cardpack.core;

import com.cardpack.core.pack.BatchPacker;
import com.cardpack.core.pack.PackagerSettings;
import com.cardpack.core.pack.UnitPackager;
import com.cardpack.core.photo.ImageIoProber;
import com.cardpack.core.photo.ImageProber;
import com.cardpack.core.template.BaseTemplate;
import com.cardpack.core.template.BaseTemplateLoader;
import com.cardpack.core.template.TemplateLoadResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for callers: load a base template once, then turn ordered card-face images into
 * .etdx print templates.
 */
public final class CardTemplateGenerator {
    private final BaseTemplate template;
    private final UnitPackager unitPackager;
    private final BatchPacker batchPacker;

    public CardTemplateGenerator(BaseTemplate template, PackagerSettings settings, ImageProber prober) {
        this.template = Objects.requireNonNull(template, "template");
        this.unitPackager = new UnitPackager(template, settings, prober);
        this.batchPacker = new BatchPacker(unitPackager);
    }

    public static CardTemplateGenerator loadTemplate(Path sourceDir) throws TemplateLoadException {
        return loadTemplate(sourceDir, PackagerSettings.defaults());
    }

    public static CardTemplateGenerator loadTemplate(Path sourceDir, PackagerSettings settings) throws TemplateLoadException {
        return new CardTemplateGenerator(BaseTemplateLoader.load(sourceDir), settings, new ImageIoProber());
    }

    /**
     * Same as {@link #loadTemplate(Path)} but reports a missing or malformed template as a value.
     */
    public static TemplateLoadResult tryLoadTemplate(Path sourceDir) {
        return BaseTemplateLoader.tryLoad(sourceDir);
    }

    public BaseTemplate template() {
        return template;
    }

    public Path pack(List<Path> images, Path outputDir, String unitName) throws PackagingException {
        return unitPackager.pack(images, outputDir, unitName);
    }

    public List<Path> batchPack(List<Path> orderedImages, Path outputDir, String baseName) throws PackagingException {
        return batchPacker.batchPack(orderedImages, outputDir, baseName);
    }
}
