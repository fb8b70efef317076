package com.arxmlviewer.core.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Qualifies unprefixed element steps of a location path with a namespace prefix.
 *
 * <p>Rules per step:
 * <ul>
 *   <li>steps starting with {@code @}, {@code *} or {@code .} are left alone</li>
 *   <li>an axis such as {@code child::} or {@code descendant::} is kept and its
 *       node test is qualified; {@code attribute::} and {@code namespace::} steps are left alone</li>
 *   <li>node tests that already carry a prefix, wildcards and node-type tests
 *       such as {@code text()} are left alone</li>
 *   <li>otherwise the name is prefixed; a trailing predicate is copied verbatim</li>
 * </ul>
 *
 * <p>The path is split on {@code /} only outside predicates, parentheses and
 * string literals, so {@code A[B/C='x/y']} stays a single step.
 */
public final class XPathQualifier {

    private static final String AXIS_SEPARATOR = "::";

    /** Axes whose node tests never name elements */
    private static final Set<String> NON_ELEMENT_AXES = Set.of("attribute::", "namespace::");

    private XPathQualifier() {
        // Utility class
    }

    /**
     * Qualifies every eligible step of an expression.
     *
     * @param expression location path, may be null
     * @param prefix namespace prefix; null or empty leaves the expression unchanged
     * @return qualified expression
     */
    public static String qualify(String expression, String prefix) {
        if (expression == null || expression.isBlank() || prefix == null || prefix.isEmpty()) {
            return expression;
        }
        List<String> steps = splitSteps(expression);
        List<String> qualified = new ArrayList<>(steps.size());
        for (String step : steps) {
            qualified.add(qualifyStep(step, prefix));
        }
        return String.join("/", qualified);
    }

    /**
     * Splits a location path into steps, keeping empty steps produced by
     * leading or doubled slashes.
     *
     * @param expression location path
     * @return steps in order
     */
    static List<String> splitSteps(String expression) {
        List<String> steps = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            switch (c) {
                case '\'', '"' -> {
                    quote = c;
                    current.append(c);
                }
                case '[', '(' -> {
                    depth++;
                    current.append(c);
                }
                case ']', ')' -> {
                    depth = Math.max(0, depth - 1);
                    current.append(c);
                }
                case '/' -> {
                    if (depth == 0) {
                        steps.add(current.toString());
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                default -> current.append(c);
            }
        }
        steps.add(current.toString());
        return steps;
    }

    private static String qualifyStep(String step, String prefix) {
        if (step.isEmpty()) {
            return step;
        }
        char first = step.charAt(0);
        if (first == '@' || first == '*' || first == '.') {
            return step;
        }

        int bracket = step.indexOf('[');
        String name = bracket >= 0 ? step.substring(0, bracket) : step;
        String predicate = bracket >= 0 ? step.substring(bracket) : "";

        String axis = "";
        int axisEnd = name.indexOf(AXIS_SEPARATOR);
        if (axisEnd >= 0) {
            axis = name.substring(0, axisEnd + AXIS_SEPARATOR.length());
            name = name.substring(axisEnd + AXIS_SEPARATOR.length());
            if (NON_ELEMENT_AXES.contains(axis.trim())) {
                return step;
            }
        }

        if (name.isBlank() || name.equals("*") || name.contains(":") || name.contains("(")) {
            return step;
        }
        return axis + prefix + ":" + name + predicate;
    }
}
