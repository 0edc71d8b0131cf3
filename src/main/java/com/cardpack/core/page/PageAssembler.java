package com.cardpack.core.page;

import com.cardpack.core.photo.PhotoRecord;
import com.cardpack.core.template.PageSkeleton;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fills the page skeleton with the two cards stacked on one side of the sheet.
 */
public final class PageAssembler {
    private final PageSkeleton skeleton;

    public PageAssembler(PageSkeleton skeleton) {
        this.skeleton = Objects.requireNonNull(skeleton, "skeleton");
    }

    public PageDocument assemble(String pageId, PhotoRecord first, PhotoRecord second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.workspaceSlot() != 1 || second.workspaceSlot() != 2) {
            throw new IllegalArgumentException("Page photos must occupy workspace slots 1 and 2 in order, got "
                + first.workspaceSlot() + " and " + second.workspaceSlot());
        }
        List<JSONObject> photos = new ArrayList<>(2);
        photos.add(first.toJson());
        photos.add(second.toJson());
        return new PageDocument(pageId, skeleton.withPhotos(photos));
    }
}
