package com.cardpack.core.pack;

import com.cardpack.core.ImageReadException;
import com.cardpack.core.TemplateFixtures;
import com.cardpack.core.ValidationException;
import com.cardpack.core.photo.ImageIoProber;
import com.cardpack.core.template.BaseTemplateLoader;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchPackerTest {

    @TempDir
    Path tempDir;

    private BatchPacker batchPacker;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        UnitPackager packager = new UnitPackager(
            BaseTemplateLoader.load(TemplateFixtures.createTemplate(tempDir.resolve("template_base"))),
            PackagerSettings.defaults(),
            new ImageIoProber());
        batchPacker = new BatchPacker(packager);
        outputDir = tempDir.resolve("out");
    }

    @Test
    void packsEachGroupOfFourInOrder() throws IOException {
        List<Path> images = cards(8);

        List<Path> archives = batchPacker.batchPack(images, outputDir, "kay");

        assertEquals(List.of(outputDir.resolve("kay1.etdx"), outputDir.resolve("kay2.etdx")), archives);
        for (int unit = 0; unit < archives.size(); unit++) {
            List<String> names = imageNames(archives.get(unit));
            List<String> expected = new ArrayList<>();
            // front page: card fronts, back page: card backs
            expected.add(images.get(4 * unit).getFileName().toString());
            expected.add(images.get(4 * unit + 2).getFileName().toString());
            expected.add(images.get(4 * unit + 1).getFileName().toString());
            expected.add(images.get(4 * unit + 3).getFileName().toString());
            assertEquals(expected, names);
        }
    }

    @Test
    void streamNotDivisibleByFourIsRejectedBeforeAnyWork() throws IOException {
        List<Path> images = cards(6);

        assertThrows(ValidationException.class, () -> batchPacker.batchPack(images, outputDir, "kay"));

        assertFalse(Files.exists(outputDir));
    }

    @Test
    void paddedStreamOfSixBecomesTwoArchives() throws IOException {
        List<Path> images = ImageStreamPadder.pad(cards(6));

        List<Path> archives = batchPacker.batchPack(images, outputDir, "kay");

        assertEquals(2, archives.size());
        assertEquals(List.of("card5.png", "card5.png", "card6.png", "card6.png"), imageNames(archives.get(1)));
    }

    @Test
    void emptyStreamProducesNothing() throws IOException {
        assertTrue(batchPacker.batchPack(List.of(), outputDir, "kay").isEmpty());
    }

    @Test
    void failedGroupStopsTheBatchButKeepsEarlierArchives() throws IOException {
        List<Path> images = cards(12);
        Files.writeString(images.get(5), "corrupt");

        ImageReadException ex = assertThrows(ImageReadException.class,
            () -> batchPacker.batchPack(images, outputDir, "kay"));

        assertEquals("kay2", ex.getUnitName());
        assertTrue(Files.exists(outputDir.resolve("kay1.etdx")));
        assertFalse(Files.exists(outputDir.resolve("kay2.etdx")));
        assertFalse(Files.exists(outputDir.resolve("kay3.etdx")), "Later groups must not run");
    }

    private List<Path> cards(int count) throws IOException {
        List<Path> images = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            images.add(TemplateFixtures.writePng(tempDir.resolve("src/card" + i + ".png"), 40, 25));
        }
        return images;
    }

    // File names in page order: front slot 1, front slot 2, back slot 1, back slot 2.
    private static List<String> imageNames(Path archive) throws IOException {
        JSONArray pages = new JSONArray(TemplateFixtures.readEntry(archive, "page.json"));
        List<String> names = new ArrayList<>();
        for (int p = 0; p < pages.length(); p++) {
            JSONObject page = new JSONObject(TemplateFixtures.readEntry(archive, pages.getString(p) + "/_info.json"));
            JSONArray photos = page.getJSONObject("editedPaperSize").getJSONArray("photos");
            for (int i = 0; i < photos.length(); i++) {
                String imagePath = photos.getJSONObject(i).getString("imagePath");
                names.add(imagePath.substring(imagePath.indexOf('/') + 1));
            }
        }
        return names;
    }
}
