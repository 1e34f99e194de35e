// file: server/src/main/java/io/treekv/server/http/Listings.java
package io.treekv.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Content negotiation for bucket listings.
 * <p>
 * The first Accept line picks one representation:
 *  - absent, "*&#47;*", "text/*", "text/plain..." -> one name per line
 *  - "application/json..."                       -> JSON array
 *  - "application/xml..."                        -> &lt;bucket&gt;&lt;key&gt;...&lt;/key&gt;&lt;/bucket&gt;
 *  - "text/html..."                              -> {@link ListingPage}
 *  - anything else                               -> one name per line
 * Names are emitted in the order given (the engine's key order).
 */
public final class Listings {
    public static final String JSON = "application/json; charset=utf-8";
    public static final String XML = "application/xml; charset=utf-8";
    static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private static final XMLOutputFactory XML_OUT = XMLOutputFactory.newFactory();

    private final ObjectMapper json;

    public Listings(ObjectMapper json) {
        this.json = json;
    }

    public ResourceResponse render(String accept, String basePath, List<String> names) {
        String a = accept == null ? "" : accept;
        if (isText(a)) {
            return text(names);
        }
        if (a.startsWith("application/json")) {
            return new ResourceResponse(200).header("Content-Type", JSON).body(toJson(names));
        }
        if (a.startsWith("application/xml")) {
            return new ResourceResponse(200).header("Content-Type", XML).body(toXml(names));
        }
        if (a.startsWith("text/html")) {
            return new ResourceResponse(200)
                    .header("Content-Type", ListingPage.CONTENT_TYPE)
                    .body(ListingPage.render(basePath, names));
        }
        return text(names);
    }

    private static boolean isText(String accept) {
        return accept.isEmpty()
                || accept.startsWith("text/*")
                || accept.startsWith("text/plain")
                || accept.startsWith("*/*");
    }

    private static ResourceResponse text(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String n : names) {
            sb.append(n).append('\n');
        }
        return new ResourceResponse(200)
                .header("Content-Type", ResourceResponse.TEXT_PLAIN)
                .body(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private byte[] toJson(List<String> names) {
        try {
            return (json.writeValueAsString(names) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode listing", e);
        }
    }

    static byte[] toXml(List<String> names) {
        StringWriter out = new StringWriter();
        out.write(XML_HEADER);
        try {
            XMLStreamWriter xml = XML_OUT.createXMLStreamWriter(out);
            xml.writeStartElement("bucket");
            for (String n : names) {
                xml.writeCharacters("\n  ");
                xml.writeStartElement("key");
                xml.writeCharacters(n);
                xml.writeEndElement();
            }
            if (!names.isEmpty()) {
                xml.writeCharacters("\n");
            }
            xml.writeEndElement();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("cannot encode listing", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
