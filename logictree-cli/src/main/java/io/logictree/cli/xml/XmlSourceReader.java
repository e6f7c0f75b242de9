package io.logictree.cli.xml;

import io.logictree.core.exception.LogicTreeFormatException;
import io.logictree.core.source.SourceNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/// Turns an XML document into a generic {@link SourceNode} tree.
///
/// Namespaced elements get `{uri}localName` tags; namespace declarations are dropped from
/// the attributes. Text content is trimmed and a blank text becomes null. DOCTYPE
/// declarations are rejected.
public final class XmlSourceReader {

    private XmlSourceReader() {}

    /// Reads a document from a file.
    ///
    /// @param path XML file, not null
    /// @return the document element as a source node, never null
    /// @throws IOException if the file cannot be read
    /// @throws LogicTreeFormatException if the content is not well-formed XML
    public static SourceNode read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    /// Reads a document from a stream.
    ///
    /// @param in XML content, not null
    /// @param sourceName name used in error messages, not null
    /// @return the document element as a source node, never null
    /// @throws IOException if the stream cannot be read
    /// @throws LogicTreeFormatException if the content is not well-formed XML
    public static SourceNode read(InputStream in, String sourceName) throws IOException {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            return toSourceNode(builder.parse(in, sourceName).getDocumentElement());
        } catch (SAXException e) {
            throw new LogicTreeFormatException(sourceName + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static SourceNode toSourceNode(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.put(localName(attr), attr.getValue());
        }

        List<SourceNode> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(toSourceNode((Element) node));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(node.getNodeValue());
                default -> {
                    // comments and processing instructions carry no tree content
                }
            }
        }

        String trimmed = text.toString().trim();
        return new SourceNode(
                tag(element), attributes, trimmed.isEmpty() ? null : trimmed, children);
    }

    private static String tag(Element element) {
        String uri = element.getNamespaceURI();
        String local = localName(element);
        return uri == null || uri.isEmpty() ? local : "{" + uri + "}" + local;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
