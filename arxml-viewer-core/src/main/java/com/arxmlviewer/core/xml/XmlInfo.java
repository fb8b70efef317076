package com.arxmlviewer.core.xml;

import java.util.Map;

/**
 * Quick diagnostics about an XML file.
 *
 * @param valid whether the document is well-formed
 * @param rootElement local name of the root element, null if invalid
 * @param namespace namespace URI of the root element, null if none
 * @param encoding declared encoding, null if not declared
 * @param xmlVersion declared XML version
 * @param namespaces namespaces declared on the root, default namespace under {@code ""}
 * @param elementCount number of elements in the document
 * @param error parse error message when invalid, otherwise null
 */
public record XmlInfo(
    boolean valid,
    String rootElement,
    String namespace,
    String encoding,
    String xmlVersion,
    Map<String, String> namespaces,
    int elementCount,
    String error
) {
    public XmlInfo {
        namespaces = namespaces == null ? Map.of() : Map.copyOf(namespaces);
    }

    /**
     * Creates the record returned for a document that could not be parsed.
     *
     * @param error parse error message
     * @return invalid info
     */
    public static XmlInfo invalid(String error) {
        return new XmlInfo(false, null, null, null, null, Map.of(), 0, error);
    }
}
