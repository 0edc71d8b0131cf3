package com.cardpack.core.page;

import org.json.JSONObject;

/**
 * One physical card side, ready to be written as {@code <pageId>/_info.json}.
 */
public record PageDocument(String pageId, JSONObject json) {
    public String toJsonString() {
        return json.toString();
    }
}
