package io.simconvert.core.codec;

import io.simconvert.core.error.DocumentParseException;
import io.simconvert.core.error.DocumentWriteException;
import io.simconvert.core.model.Node;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamProperties;
import org.codehaus.stax2.XMLStreamReader2;
import org.codehaus.stax2.XMLStreamWriter2;

/**
 * Reads and writes simulation documents as XML with Woodstox/StAX2.
 *
 * <p>
 * Reading:
 * <ul>
 * <li>single streaming pass, no DTD processing, no external entities;
 * <li>namespace declarations and prefixed names are kept verbatim as attributes and tags;
 * <li>whitespace-only text is dropped, so indentation never becomes part of the tree;
 * <li>a CDATA section marks the element's text as CDATA so it is written back the same way;
 * <li>comments and processing instructions are not carried into the tree.
 * </ul>
 *
 * <p>
 * Writing is compact and deterministic: no indentation, attributes and children in tree order,
 * empty elements self-closed.
 *
 * <p>
 * Thread-safe: one factory pair per thread.
 */
public final class XmlDocumentCodec {

    private static final ThreadLocal<XMLInputFactory2> INPUT_FACTORY = ThreadLocal.withInitial(() -> {
        XMLInputFactory2 f = (XMLInputFactory2) XMLInputFactory.newInstance();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
        f.setProperty(XMLInputFactory2.P_REPORT_CDATA, Boolean.TRUE);
        return f;
    });

    private static final ThreadLocal<XMLOutputFactory2> OUTPUT_FACTORY = ThreadLocal.withInitial(() -> {
        XMLOutputFactory2 f = (XMLOutputFactory2) XMLOutputFactory.newInstance();
        f.setProperty(XMLOutputFactory.IS_REPAIRING_NAMESPACES, Boolean.FALSE);
        f.setProperty(XMLStreamProperties.XSP_NAMESPACE_AWARE, Boolean.FALSE);
        return f;
    });

    private final boolean writeDeclaration;

    /** Creates a codec that writes without an XML declaration. */
    public XmlDocumentCodec() {
        this(false);
    }

    /**
     * Creates a codec.
     *
     * @param writeDeclaration whether {@link #write(Node, OutputStream)} and
     *                         {@link #write(Node)} emit {@code <?xml version="1.0"?>}
     */
    public XmlDocumentCodec(boolean writeDeclaration) {
        this.writeDeclaration = writeDeclaration;
    }

    // ---------- Reading ----------

    /**
     * Parses an XML string.
     *
     * @throws DocumentParseException if the text is not well-formed XML
     */
    public Node read(String xml) {
        return read(new StringReader(xml), null);
    }

    /**
     * Parses XML from a byte stream; the encoding is taken from the XML declaration. The stream
     * is not closed.
     *
     * @param source file or resource name for error messages, may be null
     * @throws DocumentParseException if the bytes are not well-formed XML
     */
    public Node read(InputStream in, String source) {
        XMLStreamReader2 r = null;
        try {
            r = (XMLStreamReader2) INPUT_FACTORY.get().createXMLStreamReader(in);
            return readTree(r, source);
        } catch (XMLStreamException e) {
            throw new DocumentParseException(describe(e, source), e, source);
        } finally {
            closeQuietly(r);
        }
    }

    /**
     * Parses XML from a character stream. The reader is not closed.
     *
     * @param source file or resource name for error messages, may be null
     * @throws DocumentParseException if the text is not well-formed XML
     */
    public Node read(Reader reader, String source) {
        XMLStreamReader2 r = null;
        try {
            r = (XMLStreamReader2) INPUT_FACTORY.get().createXMLStreamReader(reader);
            return readTree(r, source);
        } catch (XMLStreamException e) {
            throw new DocumentParseException(describe(e, source), e, source);
        } finally {
            closeQuietly(r);
        }
    }

    private static Node readTree(XMLStreamReader2 r, String source) throws XMLStreamException {
        Deque<PendingElement> stack = new ArrayDeque<>();
        Node root = null;
        while (r.hasNext()) {
            int event = r.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    Node node = new Node(qualified(r.getPrefix(), r.getLocalName()));
                    for (int i = 0; i < r.getAttributeCount(); i++) {
                        node.setAttribute(
                                qualified(r.getAttributePrefix(i), r.getAttributeLocalName(i)),
                                r.getAttributeValue(i));
                    }
                    if (stack.isEmpty()) {
                        root = node;
                    } else {
                        stack.peek().node.addChild(node);
                    }
                    stack.push(new PendingElement(node));
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.SPACE -> {
                    if (!stack.isEmpty()) {
                        stack.peek().onText(r.getText());
                    }
                }
                case XMLStreamConstants.CDATA -> {
                    if (!stack.isEmpty()) {
                        stack.peek().onCData(r.getText());
                    }
                }
                case XMLStreamConstants.END_ELEMENT -> stack.pop().finish();
                default -> {
                    /* comments, processing instructions, document events */
                }
            }
        }
        if (root == null) {
            throw new DocumentParseException(describe("document has no root element", source), source);
        }
        return root;
    }

    /** Collects the text of one open element until its end tag. */
    private static final class PendingElement {
        final Node node;
        final StringBuilder plain = new StringBuilder();
        final StringBuilder all = new StringBuilder();
        final StringBuilder cdata = new StringBuilder();
        boolean sawCData;

        PendingElement(Node node) {
            this.node = node;
        }

        void onText(String text) {
            plain.append(text);
            all.append(text);
        }

        void onCData(String text) {
            sawCData = true;
            cdata.append(text);
            all.append(text);
        }

        void finish() {
            boolean plainIsBlank = plain.toString().isBlank();
            if (sawCData && plainIsBlank) {
                node.setCData(cdata.toString());
            } else if (sawCData) {
                node.setCData(all.toString());
            } else if (!plainIsBlank) {
                node.setText(plain.toString());
            }
        }
    }

    // ---------- Writing ----------

    /**
     * Serialises a tree to a string.
     *
     * @throws DocumentWriteException if the tree cannot be written
     */
    public String write(Node root) {
        StringWriter out = new StringWriter();
        write(root, out);
        return out.toString();
    }

    /**
     * Serialises a tree to a byte stream as UTF-8. The stream is flushed, not closed.
     *
     * @throws DocumentWriteException if the tree cannot be written
     */
    public void write(Node root, OutputStream out) {
        XMLStreamWriter2 w = null;
        try {
            w = (XMLStreamWriter2) OUTPUT_FACTORY.get().createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            writeDocument(root, w, StandardCharsets.UTF_8.name());
        } catch (XMLStreamException e) {
            throw new DocumentWriteException("Failed to write document <" + root.tag() + ">: " + e.getMessage(), e);
        } finally {
            closeQuietly(w);
        }
    }

    /**
     * Serialises a tree to a character stream. The writer is flushed, not closed.
     *
     * @throws DocumentWriteException if the tree cannot be written
     */
    public void write(Node root, Writer out) {
        XMLStreamWriter2 w = null;
        try {
            w = (XMLStreamWriter2) OUTPUT_FACTORY.get().createXMLStreamWriter(out);
            writeDocument(root, w, null);
        } catch (XMLStreamException e) {
            throw new DocumentWriteException("Failed to write document <" + root.tag() + ">: " + e.getMessage(), e);
        } finally {
            closeQuietly(w);
        }
    }

    private void writeDocument(Node root, XMLStreamWriter2 w, String encoding) throws XMLStreamException {
        if (writeDeclaration) {
            if (encoding != null) {
                w.writeStartDocument(encoding, "1.0");
            } else {
                w.writeStartDocument();
            }
        }
        writeNode(root, w);
        w.writeEndDocument();
        w.flush();
    }

    private static void writeNode(Node node, XMLStreamWriter2 w) throws XMLStreamException {
        boolean empty = !node.hasChildren() && (node.text() == null || node.text().isEmpty());
        if (empty) {
            w.writeEmptyElement(node.tag());
        } else {
            w.writeStartElement(node.tag());
        }
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            w.writeAttribute(attribute.getKey(), attribute.getValue());
        }
        if (empty) {
            return;
        }
        if (node.text() != null) {
            if (node.isCData()) {
                w.writeCData(node.text());
            } else {
                w.writeCharacters(node.text());
            }
        }
        for (Node child : node.children()) {
            writeNode(child, w);
        }
        w.writeEndElement();
    }

    // ---------- helpers ----------

    private static String qualified(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static String describe(XMLStreamException e, String source) {
        return describe("malformed XML: " + e.getMessage(), source);
    }

    private static String describe(String detail, String source) {
        return source == null ? "Cannot read document, " + detail : "Cannot read document " + source + ", " + detail;
    }

    private static void closeQuietly(XMLStreamReader2 r) {
        if (r == null) return;
        try {
            r.close();
        } catch (XMLStreamException ignore) {
            // the caller owns the underlying stream
        }
    }

    private static void closeQuietly(XMLStreamWriter2 w) {
        if (w == null) return;
        try {
            w.close();
        } catch (XMLStreamException ignore) {
            // nothing left to flush
        }
    }
}
