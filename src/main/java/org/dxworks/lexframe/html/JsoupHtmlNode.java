package org.dxworks.lexframe.html;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link HtmlNode} backed by a jsoup element or text node. */
public final class JsoupHtmlNode implements HtmlNode {

    private final Node node;

    JsoupHtmlNode(Node node) {
        this.node = node;
    }

    static boolean isSupported(Node node) {
        return node instanceof Element || node instanceof TextNode;
    }

    @Override
    public boolean isText() {
        return node instanceof TextNode;
    }

    @Override
    public String tagName() {
        return node instanceof Element element ? element.normalName() : null;
    }

    @Override
    public String ownText() {
        return node instanceof TextNode textNode ? textNode.getWholeText() : "";
    }

    @Override
    public String attr(String name) {
        return node.attr(name);
    }

    @Override
    public List<HtmlNode> children() {
        List<HtmlNode> result = new ArrayList<>(node.childNodeSize());
        for (Node child : node.childNodes()) {
            if (isSupported(child)) {
                result.add(new JsoupHtmlNode(child));
            }
        }
        return result;
    }

    @Override
    public List<HtmlNode> select(String cssQuery) {
        if (!(node instanceof Element element)) {
            return List.of();
        }
        List<HtmlNode> result = new ArrayList<>();
        for (Element found : element.select(cssQuery)) {
            if (found != element) {
                result.add(new JsoupHtmlNode(found));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsoupHtmlNode other)) return false;
        return node == other.node;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(System.identityHashCode(node));
    }

    @Override
    public String toString() {
        return isText() ? "#text" : "<" + tagName() + (id().isEmpty() ? "" : " id=" + id()) + ">";
    }
}
