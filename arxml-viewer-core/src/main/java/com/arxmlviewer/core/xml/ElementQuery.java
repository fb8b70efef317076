package com.arxmlviewer.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Namespace-safe element lookups relative to any element of one document.
 *
 * <p>Path expressions are written without prefixes ({@code "ELEMENTS"},
 * {@code "DESC/L-2"}); when the document has a primary namespace the steps are
 * qualified with the resolver's synthetic prefix before evaluation.
 *
 * <p>No public method throws. Malformed expressions and evaluation failures
 * are logged at debug level and treated as "no match".
 *
 * <p>Instances are not thread-safe.
 */
public class ElementQuery {

    private static final Logger log = LoggerFactory.getLogger(ElementQuery.class);

    private final NamespaceResolver namespaces;
    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public ElementQuery(NamespaceResolver namespaces) {
        this.namespaces = Objects.requireNonNull(namespaces, "namespaces must not be null");
        this.xpath = XPathFactory.newInstance().newXPath();
        this.xpath.setNamespaceContext(namespaces);
    }

    public NamespaceResolver namespaces() {
        return namespaces;
    }

    /**
     * Finds the first element matching a path.
     *
     * @param parent context element, may be null
     * @param path location path relative to the parent
     * @return first match in document order
     */
    public Optional<Element> findElement(Element parent, String path) {
        QueryResult result = evaluate(parent, path);
        return result.matches().isEmpty() ? Optional.empty() : Optional.of(result.matches().get(0));
    }

    /**
     * Finds all elements matching a path.
     *
     * @param parent context element, may be null
     * @param path location path relative to the parent
     * @return matches in document order, empty if none
     */
    public List<Element> findElements(Element parent, String path) {
        return evaluate(parent, path).matches();
    }

    /**
     * Returns the trimmed text of the first element matching a path.
     *
     * <p>Only the element's own text and CDATA children are read; text inside
     * nested elements such as {@code <BR/>} or {@code <E>} markup is not included.
     *
     * @param parent context element
     * @param path location path
     * @param defaultValue value used when nothing matches or the text is blank
     * @return text content or default
     */
    public String getText(Element parent, String path, String defaultValue) {
        return findElement(parent, path)
            .map(ElementQuery::ownText)
            .map(String::trim)
            .filter(text -> !text.isEmpty())
            .orElse(defaultValue);
    }

    /**
     * Returns the trimmed text of the first element matching a path, or an empty string.
     *
     * @param parent context element
     * @param path location path
     * @return text content or {@code ""}
     */
    public String getText(Element parent, String path) {
        return getText(parent, path, "");
    }

    /**
     * Returns an attribute of the first element matching a path.
     *
     * @param parent context element
     * @param path location path
     * @param attributeName attribute name
     * @param defaultValue value used when nothing matches or the attribute is absent
     * @return attribute value or default
     */
    public String getAttribute(Element parent, String path, String attributeName, String defaultValue) {
        return findElement(parent, path)
            .filter(element -> element.hasAttribute(attributeName))
            .map(element -> element.getAttribute(attributeName))
            .orElse(defaultValue);
    }

    private static String ownText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            short type = child.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        return text.toString();
    }

    /**
     * Returns the direct element children of a node in document order.
     *
     * @param parent parent element, may be null
     * @return child elements
     */
    public List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        if (parent == null) {
            return children;
        }
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) child);
            }
        }
        return children;
    }

    private QueryResult evaluate(Element parent, String path) {
        if (parent == null || path == null || path.isBlank()) {
            return QueryResult.EMPTY;
        }
        String prepared = prepare(path);
        try {
            XPathExpression expression = compiled.get(prepared);
            if (expression == null) {
                expression = xpath.compile(prepared);
                compiled.put(prepared, expression);
            }
            NodeList nodes = (NodeList) expression.evaluate(parent, XPathConstants.NODESET);
            List<Element> elements = new ArrayList<>(nodes.getLength());
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node.getNodeType() == Node.ELEMENT_NODE) {
                    elements.add((Element) node);
                }
            }
            return new QueryResult(elements, null);
        } catch (XPathExpressionException | RuntimeException e) {
            QueryResult failed = QueryResult.failure(e.getMessage());
            log.debug("XPath query failed: {} (prepared: {}), error: {}", path, prepared, failed.error());
            return failed;
        }
    }

    private String prepare(String path) {
        if (!namespaces.requiresQualification()) {
            return path;
        }
        return XPathQualifier.qualify(path, namespaces.syntheticPrefix().orElseThrow());
    }

    /**
     * Outcome of one evaluation: matches, or the reason the query could not run.
     */
    private record QueryResult(List<Element> matches, String error) {
        static final QueryResult EMPTY = new QueryResult(List.of(), null);

        static QueryResult failure(String error) {
            return new QueryResult(List.of(), error == null ? "unknown error" : error);
        }
    }
}
