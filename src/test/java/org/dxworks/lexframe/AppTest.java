package org.dxworks.lexframe;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @Test
    void isHtml_ByExtension() {
        assertTrue(App.isHtml(Paths.get("32024R0001.html")));
        assertTrue(App.isHtml(Paths.get("dir/REGULATION.HTM")));
        assertFalse(App.isHtml(Paths.get("notes.txt")));
    }

    @Test
    void collectHtmlFiles_WalksDirectorySorted() throws IOException {
        List<Path> files = App.collectHtmlFiles(Paths.get("src/test/resources/samples"));

        assertEquals(List.of(
                Paths.get("src/test/resources/samples/consolidated/regulation.html"),
                Paths.get("src/test/resources/samples/oj/regulation.html")), files);
    }

    @Test
    void collectHtmlFiles_SingleFile() throws IOException {
        Path file = Paths.get("src/test/resources/samples/oj/regulation.html");
        assertEquals(List.of(file), App.collectHtmlFiles(file));
        assertTrue(App.collectHtmlFiles(Paths.get("src/test/resources/config/custom-config.yml")).isEmpty());
    }
}
