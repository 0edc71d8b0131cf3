package com.cardpack.core.template;

import org.json.JSONObject;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable base template shared by every unit a generator produces.
 */
public final class BaseTemplate {
    public static final String PROJECT_INFO_FILENAME = "projectinfo.json";
    public static final String PAGE_INFO_FILENAME = "_info.json";
    public static final String BASE_DATA_DIRNAME = "BaseData";

    private final Path sourceDirectory;
    private final String projectInfo;
    private final PageSkeleton pageSkeleton;
    private final Path baseDataDirectory;

    /**
     * @param projectInfo raw {@code projectinfo.json} text, written back into archives unchanged
     */
    public BaseTemplate(Path sourceDirectory, String projectInfo, PageSkeleton pageSkeleton, Path baseDataDirectory) {
        this.sourceDirectory = Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        this.projectInfo = Objects.requireNonNull(projectInfo, "projectInfo");
        this.pageSkeleton = Objects.requireNonNull(pageSkeleton, "pageSkeleton");
        this.baseDataDirectory = Objects.requireNonNull(baseDataDirectory, "baseDataDirectory");
    }

    public Path sourceDirectory() {
        return sourceDirectory;
    }

    /** Returns a fresh copy on every call. */
    public JSONObject projectInfo() {
        return new JSONObject(projectInfo);
    }

    public String projectInfoText() {
        return projectInfo;
    }

    public PageSkeleton pageSkeleton() {
        return pageSkeleton;
    }

    public Path baseDataDirectory() {
        return baseDataDirectory;
    }
}
