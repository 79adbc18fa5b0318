package org.dxworks.lexframe.html;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read-only view over a parsed markup tree. A node is either an element
 * (with a tag name, attributes and children) or a text node.
 */
public interface HtmlNode {

    boolean isText();

    /** Lower-case tag name, or {@code null} for text nodes. */
    String tagName();

    /** Raw text for a text node; empty for elements. */
    String ownText();

    /** Attribute value, or an empty string when absent. */
    String attr(String name);

    /** Element and text children in document order. */
    List<HtmlNode> children();

    /** Descendant elements matching a CSS query, in document order. */
    List<HtmlNode> select(String cssQuery);

    default boolean isElement() {
        return !isText();
    }

    default boolean is(String tag) {
        return tag.equals(tagName());
    }

    default String id() {
        return attr("id");
    }

    default List<String> classNames() {
        String value = attr("class").trim();
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(value.split("\\s+"));
    }

    default boolean hasClass(String className) {
        return classNames().contains(className);
    }

    default List<HtmlNode> childElements() {
        List<HtmlNode> result = new ArrayList<>();
        for (HtmlNode child : children()) {
            if (child.isElement()) {
                result.add(child);
            }
        }
        return result;
    }

    default List<HtmlNode> childElements(String tag) {
        List<HtmlNode> result = new ArrayList<>();
        for (HtmlNode child : children()) {
            if (child.is(tag)) {
                result.add(child);
            }
        }
        return result;
    }

    default HtmlNode firstChild(String tag) {
        for (HtmlNode child : children()) {
            if (child.is(tag)) {
                return child;
            }
        }
        return null;
    }

    default HtmlNode selectFirst(String cssQuery) {
        List<HtmlNode> found = select(cssQuery);
        return found.isEmpty() ? null : found.get(0);
    }
}
