package org.dxworks.lexframe.html;

import org.dxworks.lexframe.LexframeException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class HtmlDocuments {

    private HtmlDocuments() {
    }

    public static HtmlNode parse(String html) {
        Document document = Jsoup.parse(html);
        return new JsoupHtmlNode(document);
    }

    public static HtmlNode parse(Path file) {
        try {
            String html = Files.readString(file, StandardCharsets.UTF_8);
            if (html.startsWith("\uFEFF")) {
                html = html.substring(1);
            }
            return parse(html);
        } catch (IOException e) {
            throw new LexframeException("Could not read " + file, e);
        }
    }
}
