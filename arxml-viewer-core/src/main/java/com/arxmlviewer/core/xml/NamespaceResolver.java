package com.arxmlviewer.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prefix to namespace URI mapping extracted from a document root.
 *
 * <p>XPath cannot select elements in an unnamed default namespace. When the
 * root declares one, the resolver also registers it under a synthetic prefix
 * ({@value #SYNTHETIC_PREFIX} unless that prefix is already bound to another
 * URI) so that path expressions can address it explicitly. A root element bound
 * through an explicit prefix gets the same treatment, which makes prefixed and
 * default-namespace documents query alike.
 *
 * <p>One instance serves exactly one parsed document.
 */
public final class NamespaceResolver implements NamespaceContext {

    private static final Logger log = LoggerFactory.getLogger(NamespaceResolver.class);

    /** Preferred synthetic prefix for the document's primary namespace */
    public static final String SYNTHETIC_PREFIX = "ar";

    /** Key used for the default namespace in {@link #declaredNamespaces()} */
    public static final String DEFAULT_NAMESPACE_KEY = "";

    private final Map<String, String> declared;
    private final Map<String, String> namespaces;
    private final String defaultNamespace;
    private final String syntheticPrefix;

    private NamespaceResolver(Map<String, String> declared, String defaultNamespace, String primaryNamespace) {
        this.declared = Collections.unmodifiableMap(new LinkedHashMap<>(declared));
        this.defaultNamespace = defaultNamespace;

        Map<String, String> all = new LinkedHashMap<>();
        declared.forEach((prefix, uri) -> {
            if (!DEFAULT_NAMESPACE_KEY.equals(prefix)) {
                all.put(prefix, uri);
            }
        });
        String prefix = null;
        if (primaryNamespace != null && !primaryNamespace.isEmpty()) {
            prefix = choosePrefix(all, primaryNamespace);
            all.put(prefix, primaryNamespace);
        }
        this.syntheticPrefix = prefix;
        this.namespaces = Collections.unmodifiableMap(all);
    }

    /**
     * Builds a resolver from the namespace declarations on a root element.
     *
     * @param root document root element
     * @return resolver; empty if the root declares no namespaces
     */
    public static NamespaceResolver fromRoot(Element root) {
        Map<String, String> declared = new LinkedHashMap<>();
        String defaultNamespace = null;

        NamedNodeMap attributes = root.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            if (XMLConstants.XMLNS_ATTRIBUTE.equals(attr.getName())) {
                defaultNamespace = attr.getValue();
                declared.put(DEFAULT_NAMESPACE_KEY, attr.getValue());
            } else {
                declared.put(attr.getLocalName(), attr.getValue());
            }
        }

        String primary = defaultNamespace != null && !defaultNamespace.isEmpty()
            ? defaultNamespace
            : root.getNamespaceURI();

        NamespaceResolver resolver = new NamespaceResolver(declared, defaultNamespace, primary);
        log.debug("Extracted namespaces: {}", resolver.namespaces);
        return resolver;
    }

    /**
     * Creates a resolver with no namespaces.
     *
     * @return empty resolver
     */
    public static NamespaceResolver empty() {
        return new NamespaceResolver(Map.of(), null, null);
    }

    private static String choosePrefix(Map<String, String> bound, String uri) {
        String candidate = SYNTHETIC_PREFIX;
        int suffix = 1;
        while (bound.containsKey(candidate) && !bound.get(candidate).equals(uri)) {
            candidate = SYNTHETIC_PREFIX + suffix++;
        }
        return candidate;
    }

    /**
     * Returns the namespaces exactly as declared on the root, default namespace under {@code ""}.
     *
     * @return declared prefix to URI map
     */
    public Map<String, String> declaredNamespaces() {
        return declared;
    }

    /**
     * Returns the prefixes usable in path expressions, including the synthetic one.
     *
     * @return prefix to URI map
     */
    public Map<String, String> namespaces() {
        return namespaces;
    }

    public Optional<String> defaultNamespace() {
        return Optional.ofNullable(defaultNamespace).filter(uri -> !uri.isEmpty());
    }

    /**
     * Returns the synthetic prefix bound to the document's primary namespace.
     *
     * @return prefix, empty if the document uses no namespace on its root
     */
    public Optional<String> syntheticPrefix() {
        return Optional.ofNullable(syntheticPrefix);
    }

    /**
     * Returns true if unprefixed path segments must be qualified before querying.
     *
     * @return true if a synthetic prefix is registered
     */
    public boolean requiresQualification() {
        return syntheticPrefix != null;
    }

    @Override
    public String getNamespaceURI(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("Prefix cannot be null");
        }
        if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
            return XMLConstants.XML_NS_URI;
        }
        if (XMLConstants.XMLNS_ATTRIBUTE.equals(prefix)) {
            return XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
        }
        String uri = namespaces.get(prefix);
        return uri != null ? uri : XMLConstants.NULL_NS_URI;
    }

    @Override
    public String getPrefix(String namespaceURI) {
        if (namespaceURI == null) {
            throw new IllegalArgumentException("Namespace URI cannot be null");
        }
        return namespaces.entrySet().stream()
            .filter(e -> e.getValue().equals(namespaceURI))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(null);
    }

    @Override
    public Iterator<String> getPrefixes(String namespaceURI) {
        return namespaces.entrySet().stream()
            .filter(e -> e.getValue().equals(namespaceURI))
            .map(Map.Entry::getKey)
            .iterator();
    }
}
