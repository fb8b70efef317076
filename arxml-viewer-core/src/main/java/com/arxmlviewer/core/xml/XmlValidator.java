package com.arxmlviewer.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap pre-parse checks for ARXML files.
 *
 * <p>The AUTOSAR check is a heuristic on the root element and its namespace
 * declarations, not schema validation. None of these methods throw.
 */
public final class XmlValidator {

    private static final Logger log = LoggerFactory.getLogger(XmlValidator.class);

    private static final Set<String> AUTOSAR_ROOTS = Set.of("AUTOSAR", "MSRSW");

    private XmlValidator() {
        // Utility class
    }

    /**
     * Checks whether a file is well-formed XML.
     *
     * @param file path to check
     * @return true only if the document parses without error
     */
    public static boolean isValidXml(Path file) {
        try {
            XmlDocuments.load(file);
            return true;
        } catch (IOException | SAXException e) {
            log.debug("Not valid XML: {} ({})", file, e.getMessage());
            return false;
        }
    }

    /**
     * Checks whether a file looks like an AUTOSAR document.
     *
     * @param file path to check
     * @return true if the root is {@code AUTOSAR}/{@code MSRSW} or a declared namespace mentions autosar
     */
    public static boolean isAutosarXml(Path file) {
        try {
            return isAutosarDocument(XmlDocuments.load(file));
        } catch (IOException | SAXException e) {
            log.debug("Cannot check AUTOSAR format of {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Applies the AUTOSAR heuristic to an already parsed document.
     *
     * @param document parsed document
     * @return true if the document looks like AUTOSAR
     */
    public static boolean isAutosarDocument(Document document) {
        Element root = document.getDocumentElement();
        if (root == null) {
            return false;
        }
        if (AUTOSAR_ROOTS.contains(XmlDocuments.localName(root))) {
            return true;
        }
        return NamespaceResolver.fromRoot(root).declaredNamespaces().values().stream()
            .anyMatch(uri -> uri != null && uri.toLowerCase(Locale.ROOT).contains("autosar"));
    }

    /**
     * Collects basic information about an XML file.
     *
     * @param file path to inspect
     * @return info record; {@code valid=false} with an error message if parsing fails
     */
    public static XmlInfo getXmlInfo(Path file) {
        try {
            Document document = XmlDocuments.load(file);
            Element root = document.getDocumentElement();
            return new XmlInfo(
                true,
                XmlDocuments.localName(root),
                root.getNamespaceURI(),
                document.getXmlEncoding(),
                document.getXmlVersion(),
                NamespaceResolver.fromRoot(root).declaredNamespaces(),
                document.getElementsByTagName("*").getLength(),
                null
            );
        } catch (IOException | SAXException e) {
            log.debug("Cannot read XML info from {}: {}", file, e.getMessage());
            return XmlInfo.invalid(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
