package com.cardpack.core.template;

import com.cardpack.core.TemplateLoadException;
import com.cardpack.logging.AppLogger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads an extracted .etdx template directory: {@code projectinfo.json}, the {@code BaseData} assets and
 * one page descriptor that serves as the structural skeleton for every generated page.
 */
public final class BaseTemplateLoader {
    private static final Logger LOGGER = AppLogger.get();

    private BaseTemplateLoader() {
    }

    public static BaseTemplate load(Path sourceDir) throws TemplateLoadException {
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new TemplateLoadException(sourceDir, "Template directory not found");
        }
        Path projectInfoFile = sourceDir.resolve(BaseTemplate.PROJECT_INFO_FILENAME);
        if (!Files.isRegularFile(projectInfoFile)) {
            throw new TemplateLoadException(projectInfoFile, "Template is missing " + BaseTemplate.PROJECT_INFO_FILENAME);
        }
        Path baseData = sourceDir.resolve(BaseTemplate.BASE_DATA_DIRNAME);
        if (!Files.isDirectory(baseData)) {
            throw new TemplateLoadException(baseData, "Template is missing the " + BaseTemplate.BASE_DATA_DIRNAME + " folder");
        }

        String projectInfo = readText(projectInfoFile);
        parseJson(projectInfoFile, projectInfo);

        Path pageDir = findSkeletonPage(sourceDir);
        Path pageInfoFile = pageDir.resolve(BaseTemplate.PAGE_INFO_FILENAME);
        JSONObject pageDocument = parseJson(pageInfoFile, readText(pageInfoFile));
        PageSkeleton skeleton;
        try {
            skeleton = PageSkeleton.of(pageDocument);
        } catch (IllegalArgumentException ex) {
            throw new TemplateLoadException(pageInfoFile, ex.getMessage(), ex);
        }

        LOGGER.fine("Loaded base template from " + sourceDir + " using page skeleton " + pageDir.getFileName());
        return new BaseTemplate(sourceDir, projectInfo, skeleton, baseData);
    }

    public static TemplateLoadResult tryLoad(Path sourceDir) {
        try {
            return TemplateLoadResult.success(load(sourceDir));
        } catch (TemplateLoadException ex) {
            return TemplateLoadResult.failure(ex);
        }
    }

    /**
     * The first page folder by name that carries an {@code _info.json}. Which page is picked does not
     * matter, only that the choice is stable across runs.
     */
    private static Path findSkeletonPage(Path sourceDir) throws TemplateLoadException {
        List<Path> candidates;
        try (Stream<Path> stream = Files.list(sourceDir)) {
            candidates = stream
                .filter(Files::isDirectory)
                .filter(p -> !isReserved(p.getFileName().toString()))
                .filter(p -> Files.isRegularFile(p.resolve(BaseTemplate.PAGE_INFO_FILENAME)))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new TemplateLoadException(sourceDir, "Could not list template directory", ex);
        }
        if (candidates.isEmpty()) {
            throw new TemplateLoadException(sourceDir, "No page template found in base template directory");
        }
        return candidates.get(0);
    }

    private static boolean isReserved(String name) {
        return name.equals(BaseTemplate.BASE_DATA_DIRNAME)
            || name.startsWith(".")
            || name.equalsIgnoreCase("__MACOSX");
    }

    private static String readText(Path file) throws TemplateLoadException {
        try {
            return Files.readString(file);
        } catch (IOException ex) {
            throw new TemplateLoadException(file, "Could not read template file", ex);
        }
    }

    private static JSONObject parseJson(Path file, String content) throws TemplateLoadException {
        try {
            return new JSONObject(content);
        } catch (JSONException ex) {
            throw new TemplateLoadException(file, "Malformed JSON (" + ex.getMessage() + ")", ex);
        }
    }
}
