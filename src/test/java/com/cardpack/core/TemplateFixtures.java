package com.cardpack.core;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.json.JSONArray;
import org.json.JSONObject;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Builds extracted base templates and card images on disk for tests.
 */
public final class TemplateFixtures {
    public static final String SKELETON_PAGE_ID = "0A1B2C3D-0000-4000-8000-000000000001";
    public static final String OTHER_PAGE_ID = "FFFFFFFF-0000-4000-8000-000000000002";
    public static final String PROJECT_INFO = "{\"version\":\"1.4.0\",\"paperType\":\"idcard\",\"name\":\"base\"}";

    private TemplateFixtures() {
    }

    /**
     * Writes a template with two page folders, so the skeleton choice is observable, and a small
     * BaseData tree.
     */
    public static Path createTemplate(Path root) throws IOException {
        Files.createDirectories(root);
        Files.writeString(root.resolve("projectinfo.json"), PROJECT_INFO);
        Files.writeString(root.resolve("page.json"), new JSONArray().put(SKELETON_PAGE_ID).put(OTHER_PAGE_ID).toString());

        Path baseData = root.resolve("BaseData");
        Files.createDirectories(baseData.resolve("frames"));
        Files.writeString(baseData.resolve("layout.json"), "{\"cards\":2}");
        Files.writeString(baseData.resolve("frames/none.txt"), "no frame");

        writePage(root.resolve(SKELETON_PAGE_ID), "skeleton");
        writePage(root.resolve(OTHER_PAGE_ID), "other");
        return root;
    }

    public static void writePage(Path pageDir, String marker) throws IOException {
        Files.createDirectories(pageDir);
        JSONObject paper = new JSONObject();
        paper.put("width", 1016);
        paper.put("height", 1276);
        paper.put("photos", new JSONArray().put(new JSONObject().put("imagePath", "OLD/" + marker + ".png")));
        JSONObject page = new JSONObject();
        page.put("marker", marker);
        page.put("editedPaperSize", paper);
        page.put("background", new JSONObject().put("color", "#FFFFFF"));
        Files.writeString(pageDir.resolve("_info.json"), page.toString());
    }

    public static Path writePng(Path file, int width, int height) throws IOException {
        Files.createDirectories(file.getParent());
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLUE);
            g.fillRect(0, 0, Math.max(1, width / 2), Math.max(1, height / 2));
        } finally {
            g.dispose();
        }
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    public static List<Path> writePngs(Path dir, int width, int height, String... names) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String name : names) {
            files.add(writePng(dir.resolve(name), width, height));
        }
        return files;
    }

    /**
     * Writes a PDF with one labelled card face per page, alternating front and back. Pages are
     * 243 x 153 pt, so at 72 DPI they render to exactly that many pixels.
     */
    public static Path writeCardPdf(Path target, int pages) throws IOException {
        Files.createDirectories(target.getParent());
        try (PDDocument document = new PDDocument()) {
            for (int i = 1; i <= pages; i++) {
                PDPage page = new PDPage(new PDRectangle(243, 153));
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(PDType1Font.HELVETICA_BOLD, 12);
                    stream.newLineAtOffset(20, 100);
                    stream.showText("CARD " + ((i + 1) / 2) + (i % 2 == 1 ? " FRONT" : " BACK"));
                    stream.endText();
                }
            }
            document.save(target.toFile());
        }
        return target;
    }

    public static List<String> entryNames(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                names.add(entries.nextElement().getName());
            }
        }
        return names;
    }

    public static String readEntry(Path archive, String name) throws IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry entry = zip.getEntry(name);
            if (entry == null) {
                throw new IOException("No entry " + name + " in " + archive);
            }
            return new String(zip.getInputStream(entry).readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static byte[] readEntryBytes(Path archive, String name) throws IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry entry = zip.getEntry(name);
            if (entry == null) {
                throw new IOException("No entry " + name + " in " + archive);
            }
            return zip.getInputStream(entry).readAllBytes();
        }
    }
}
