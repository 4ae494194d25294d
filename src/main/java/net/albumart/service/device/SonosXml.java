package net.albumart.service.device;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers for SOAP envelopes and DIDL-Lite metadata returned by Sonos players.
 * Elements are matched by local name so the mixed dc/upnp/r namespaces need no mapping.
 */
final class SonosXml {

    static final String NOT_IMPLEMENTED = "NOT_IMPLEMENTED";

    private SonosXml() {
    }

    static Document parse(String xml) throws DeviceQueryException {
        if (xml == null || xml.isBlank()) {
            throw new DeviceQueryException("Empty XML document");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new DeviceQueryException("Malformed XML from device: " + e.getMessage(), e);
        }
    }

    /**
     * Text of the first descendant with the given local name, or empty.
     */
    static String firstText(Node root, String localName) {
        Element element = firstElement(root, localName);
        return element == null ? "" : element.getTextContent().trim();
    }

    static Element firstElement(Node root, String localName) {
        NodeList all = descendants(root);
        for (int i = 0; i < all.getLength(); i++) {
            Node node = all.item(i);
            if (localName.equals(localNameOf(node))) {
                return (Element) node;
            }
        }
        return null;
    }

    static List<Element> elements(Node root, String localName) {
        List<Element> matches = new ArrayList<>();
        NodeList all = descendants(root);
        for (int i = 0; i < all.getLength(); i++) {
            Node node = all.item(i);
            if (localName.equals(localNameOf(node))) {
                matches.add((Element) node);
            }
        }
        return matches;
    }

    /**
     * Treats Sonos' {@code NOT_IMPLEMENTED} placeholder as absent.
     */
    static boolean isMissing(String value) {
        return value == null || value.isBlank() || NOT_IMPLEMENTED.equals(value.trim());
    }

    static String escape(String value) {
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }

    private static NodeList descendants(Node root) {
        if (root instanceof Document document) {
            return document.getElementsByTagName("*");
        }
        return ((Element) root).getElementsByTagName("*");
    }

    private static String localNameOf(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
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
}
