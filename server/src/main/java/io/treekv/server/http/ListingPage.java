// file: server/src/main/java/io/treekv/server/http/ListingPage.java
package io.treekv.server.http;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTML rendering of a bucket listing: a title with the bucket path and one
 * link per child, or an "Empty bucket." note. All text is HTML-escaped.
 */
public final class ListingPage {
    public static final String CONTENT_TYPE = "text/html; charset=utf-8";

    private ListingPage() {
        // utility
    }

    public static byte[] render(String basePath, List<String> names) {
        StringBuilder html = new StringBuilder();
        html.append("<html>\n<head>\n<meta charset=\"UTF-8\">\n");
        html.append("<style>\n")
                .append(".body { padding: 10px; font-family: sans-serif; }\n")
                .append("h3 { font-weight: normal; }\n")
                .append(".item { list-style: none; padding: 2px; }\n")
                .append("</style>\n");
        html.append("<title>").append(escapeHtml(basePath)).append("</title>\n</head>\n");
        html.append("<body>\n<div class=\"body\">\n");
        html.append("<div class=\"title\"><h3>").append(escapeHtml(basePath)).append("</h3></div>\n");
        if (names.isEmpty()) {
            html.append("<div class=\"info\"><h3>Empty bucket.</h3></div>\n");
        } else {
            html.append("<ul>\n");
            for (String name : names) {
                html.append("<div class=\"item\"><li><a href=\"")
                        .append(escapeHtml(join(basePath, name)))
                        .append("\">")
                        .append(escapeHtml(name))
                        .append("</a></li></div>\n");
            }
            html.append("</ul>\n");
        }
        html.append("</div>\n</body>\n</html>\n");
        return html.toString().getBytes(StandardCharsets.UTF_8);
    }

    /** "/a/" + "b" -> "/a/b"; repeated slashes collapse. */
    static String join(String basePath, String name) {
        StringBuilder sb = new StringBuilder();
        for (String seg : (basePath + "/" + name).split("/")) {
            if (!seg.isEmpty()) {
                sb.append('/').append(seg);
            }
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    static String escapeHtml(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
