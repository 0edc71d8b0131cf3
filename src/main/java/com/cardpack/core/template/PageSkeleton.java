package com.cardpack.core.template;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * Structural shape of a page {@code _info.json}. Held as serialized text so no caller can mutate the
 * shared skeleton; every {@link #withPhotos(List)} call parses a fresh value and replaces only the
 * photo list.
 */
public final class PageSkeleton {
    public static final String PAPER_KEY = "editedPaperSize";
    public static final String PHOTOS_KEY = "photos";

    private final String json;

    private PageSkeleton(String json) {
        this.json = json;
    }

    /**
     * @throws IllegalArgumentException when the document has no {@value #PAPER_KEY} object to hold photos
     */
    public static PageSkeleton of(JSONObject document) {
        Objects.requireNonNull(document, "document");
        if (document.optJSONObject(PAPER_KEY) == null) {
            throw new IllegalArgumentException("Page descriptor has no '" + PAPER_KEY + "' object");
        }
        return new PageSkeleton(document.toString());
    }

    public JSONObject withPhotos(List<JSONObject> photos) {
        JSONObject page = new JSONObject(json);
        JSONArray array = new JSONArray();
        for (JSONObject photo : photos) {
            array.put(photo);
        }
        page.getJSONObject(PAPER_KEY).put(PHOTOS_KEY, array);
        return page;
    }

    public JSONObject toJson() {
        return new JSONObject(json);
    }
}
