package com.sitemapper.app.render;

import com.sitemapper.core.model.LinkReport;
import com.sitemapper.core.model.Status;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.Writer;
import java.time.ZoneOffset;

/**
 * sitemap 형식 urlset. 표준 loc 외에 상태 필드(laststatus, lastchecked,
 * reachable, crawlable, reachable_error)와 connects/link 를 덧붙인다.
 */
public final class SitemapXmlRenderer implements ReportRenderer {

    static final String NS = "http://www.sitemaps.org/schemas/sitemap/0.9";

    private static final String ITEM_INDENT = "\n\t\t";

    private final XMLOutputFactory factory = XMLOutputFactory.newFactory();

    @Override
    public void render(Iterable<LinkReport> reports, Writer out) throws IOException {
        try {
            XMLStreamWriter w = factory.createXMLStreamWriter(out);
            w.writeStartDocument("UTF-8", "1.0");
            w.writeCharacters("\n");
            w.writeStartElement("urlset");
            w.writeDefaultNamespace(NS);
            for (LinkReport r : reports) {
                writeUrl(w, r);
            }
            w.writeCharacters("\n");
            w.writeEndElement();
            w.writeEndDocument();
            w.flush();
            w.close();
            out.write('\n');
            out.flush();
        } catch (XMLStreamException e) {
            throw new IOException("sitemap render failed: " + e.getMessage(), e);
        }
    }

    private static void writeUrl(XMLStreamWriter w, LinkReport r) throws XMLStreamException {
        Status s = r.getStatus();
        w.writeCharacters("\n\t");
        w.writeStartElement("url");
        element(w, ITEM_INDENT, "loc", r.getPath().toString());
        element(w, ITEM_INDENT, "laststatus", String.valueOf(s.getLastStatusCode()));
        element(w, ITEM_INDENT, "lastchecked", s.getObservedAt().atOffset(ZoneOffset.UTC).toString());
        element(w, ITEM_INDENT, "reachable", String.valueOf(s.isLive()));
        element(w, ITEM_INDENT, "crawlable", String.valueOf(s.isCrawlable()));
        if (s.reason() != null) element(w, ITEM_INDENT, "reachable_error", s.reason());

        w.writeCharacters("\n\t\t");
        w.writeStartElement("connects");
        for (LinkReport kid : r.getChildren()) {
            element(w, "\n\t\t\t", "link", kid.getPath().toString());
        }
        w.writeCharacters("\n\t\t");
        w.writeEndElement();
        w.writeCharacters("\n\t");
        w.writeEndElement();
    }

    private static void element(XMLStreamWriter w, String indent, String name, String text) throws XMLStreamException {
        w.writeCharacters(indent);
        w.writeStartElement(name);
        w.writeCharacters(text);
        w.writeEndElement();
    }
}
