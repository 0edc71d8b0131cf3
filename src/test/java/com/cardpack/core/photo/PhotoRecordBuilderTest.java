package com.cardpack.core.photo;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PhotoRecordBuilderTest {

    @Test
    void scaleIsTheDpiCorrectionForAnySize() {
        assertEquals(1.2, PhotoRecordBuilder.scaleFor(1016, 638));
        assertEquals(1.2, PhotoRecordBuilder.scaleFor(638, 1016));
        assertEquals(1.2, PhotoRecordBuilder.scaleFor(2550, 3300));
        assertEquals(1.2, PhotoRecordBuilder.scaleFor(1, 1));
    }

    @Test
    void placementComesFromTemplateConstantsNotImageSize() {
        PhotoRecord small = PhotoRecordBuilder.build("A/a.png", 1, new ImageSize(10, 10));
        PhotoRecord large = PhotoRecordBuilder.build("B/b.png", 2, new ImageSize(2550, 3300));

        assertEquals(small.center(), large.center());
        assertEquals(List.of(0.4488523602485657, 0.7050654292106628), small.center());
        assertEquals(List.of(0, 0, 1016, 638), large.cropRect());
        assertEquals(2550.0, large.originalWidth());
        assertEquals(3300.0, large.originalHeight());
    }

    @Test
    void writesTheKeysThePrintSoftwareReads() {
        JSONObject json = PhotoRecordBuilder.build("0F2E/front_1.png", 2, new ImageSize(1016, 638)).toJson();

        assertEquals(0, json.getInt("angle"));
        assertEquals(0.4488523602485657, json.getJSONArray("center").getDouble(0));
        assertEquals(0.7050654292106628, json.getJSONArray("center").getDouble(1));
        assertEquals(0, json.getJSONObject("effectInfo").getInt("blur"));
        assertEquals(0, json.getJSONObject("effectInfo").getInt("transparency"));
        assertEquals(1016.0, json.getJSONArray("originalsize").getDouble(0));
        assertEquals(638.0, json.getJSONArray("originalsize").getDouble(1));
        assertEquals(0, json.getInt("zindex"));
        assertEquals(-1, json.getInt("frameIndex"));
        assertEquals("0F2E/front_1.png", json.getString("imagePath"));
        assertEquals(2, json.getInt("workSpaceNumber"));

        JSONObject apf = json.getJSONObject("apfInfo");
        assertEquals(0, apf.getInt("saturation"));
        assertEquals(0, apf.getInt("brightness"));
        assertEquals(5, apf.getInt("level"));
        assertEquals(0, apf.getInt("contrast"));
        assertEquals("standard", apf.getString("mode"));
        assertEquals(0, apf.getInt("sharpness"));

        JSONObject crop = json.getJSONObject("crop");
        assertEquals(1, crop.getInt("type"));
        assertEquals(638, crop.getJSONArray("rect").getInt(3));
        assertEquals(1.2, json.getDouble("scale"));
        assertEquals(11, json.length());
    }

    @Test
    void rejectsSlotsOutsideTheTwoCardPositions() {
        assertThrows(IllegalArgumentException.class, () -> PhotoRecordBuilder.build("A/a.png", 0, new ImageSize(1, 1)));
        assertThrows(IllegalArgumentException.class, () -> PhotoRecordBuilder.build("A/a.png", 3, new ImageSize(1, 1)));
    }
}
