package com.cardpack.core.photo;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * One card face placed on a page: which image, which of the two stacked card slots, and the placement
 * values the print software reads from {@code _info.json}.
 */
public record PhotoRecord(String imagePath,
                          double originalWidth,
                          double originalHeight,
                          List<Double> center,
                          List<Integer> cropRect,
                          double scale,
                          int workspaceSlot) {

    public PhotoRecord {
        center = List.copyOf(center);
        cropRect = List.copyOf(cropRect);
    }

    public JSONObject toJson() {
        JSONObject photo = new JSONObject();
        photo.put("angle", 0);
        photo.put("center", new JSONArray(center));

        JSONObject effectInfo = new JSONObject();
        effectInfo.put("blur", 0);
        effectInfo.put("transparency", 0);
        photo.put("effectInfo", effectInfo);

        photo.put("originalsize", new JSONArray().put(originalWidth).put(originalHeight));
        photo.put("zindex", 0);
        photo.put("frameIndex", -1);
        photo.put("imagePath", imagePath);
        photo.put("workSpaceNumber", workspaceSlot);

        JSONObject apfInfo = new JSONObject();
        apfInfo.put("saturation", 0);
        apfInfo.put("brightness", 0);
        apfInfo.put("level", 5);
        apfInfo.put("contrast", 0);
        apfInfo.put("mode", "standard");
        apfInfo.put("sharpness", 0);
        photo.put("apfInfo", apfInfo);

        JSONObject crop = new JSONObject();
        crop.put("type", 1);
        crop.put("rect", new JSONArray(cropRect));
        photo.put("crop", crop);

        photo.put("scale", scale);
        return photo;
    }
}
