package com.arxmlviewer.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads XML files into namespace-aware DOM documents.
 *
 * <p>External entities and external DTDs are never resolved. Warnings and
 * recoverable errors are logged at debug level; fatal errors surface as
 * {@link SAXException}.
 */
public final class XmlDocuments {

    private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

    private XmlDocuments() {
        // Utility class
    }

    /**
     * Parses a file into a DOM document.
     *
     * @param file XML file
     * @return parsed document
     * @throws IOException if the file cannot be read
     * @throws SAXException if the content is not well-formed XML
     */
    public static Document load(Path file) throws IOException, SAXException {
        try (InputStream in = Files.newInputStream(file)) {
            Document document = newDocumentBuilder().parse(in, file.toUri().toString());
            document.getDocumentElement().normalize();
            return document;
        }
    }

    /**
     * Creates a hardened, namespace-aware document builder.
     *
     * @return new document builder
     */
    public static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
    }

    /**
     * Returns the local name of an element node, falling back to the node name
     * for documents parsed without namespace awareness.
     *
     * @param node DOM node
     * @return local name
     */
    public static String localName(org.w3c.dom.Node node) {
        String localName = node.getLocalName();
        return localName != null ? localName : node.getNodeName();
    }

    private static final class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            log.debug("XML error at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
