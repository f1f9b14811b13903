package org.pyta.json;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SourceSpan;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.MalformedInputException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the untyped JSON form of a Python {@code ast} module into a {@link SyntaxTree}.
 *
 * <ul>
 *     <li>an object with a {@code _type} naming a known node class becomes a node; the key it
 *     sits under in its parent becomes the node's field;</li>
 *     <li>operator and context objects ({@code {"_type": "Load"}}) become attributes holding
 *     their class name; lists of them are joined with commas;</li>
 *     <li>lists of strings (such as the names of a {@code global} statement) are joined with
 *     commas;</li>
 *     <li>other scalars become attributes; {@code null} values and {@code null} list entries
 *     are skipped.</li>
 * </ul>
 *
 * The JSON type of a constant's {@code value} decides its {@code type} attribute; exporters
 * supply {@code valueType} for constants JSON cannot express ({@code bytes}, {@code complex},
 * {@code ellipsis}).
 */
final class AstConverter {
    private static final String TYPE = "_type";
    private static final String VALUE_TYPE = "valueType";
    private static final Set<String> POSITION_KEYS = Set.of("lineno", "col_offset", "end_lineno", "end_col_offset");
    private static final Set<String> IGNORED_KEYS = Set.of("type_ignores", "type_comment");

    private final SyntaxTree.Builder builder;

    private AstConverter(String fileName) {
        this.builder = SyntaxTree.builder(fileName);
    }

    static SyntaxTree convert(String fileName, Object json) {
        var converter = new AstConverter(fileName);
        if (!(json instanceof Map<?, ?> root)) {
            throw malformed(SourceSpan.FILE_START, "the document is not a JSON object");
        }
        converter.node(root, SyntaxNode.NO_PARENT, "", SourceSpan.FILE_START);
        return converter.builder.build();
    }

    private void node(Map<?, ?> object, int parent, String field, SourceSpan near) {
        var kind = kindOf(object, near);
        var span = span(object, near);
        var here = span == null
                   ? near
                   : span;

        var attributes = new LinkedHashMap<String, String>();
        var children = new ArrayList<Map.Entry<String, Object>>();
        for (var entry : object.entrySet()) {
            var key = String.valueOf(entry.getKey());
            var value = entry.getValue();
            if (key.equals(TYPE) || key.equals(VALUE_TYPE) || POSITION_KEYS.contains(key) || IGNORED_KEYS.contains(key)
                || value == null || value instanceof List<?> list && list.isEmpty()) {
                continue;
            }
            if (kind == NodeKind.CONSTANT && key.equals("value")) {
                attributes.put("value", constantText(value));
                attributes.put("type", constantType(object, value));
            } else if (isNode(value) || isNodeList(value)) {
                children.add(Map.entry(key, value));
            } else {
                attributes.put(key, attributeText(value, here));
            }
        }
        if (kind == NodeKind.CONSTANT && !attributes.containsKey("type")) {
            attributes.put("type", constantType(object, null));
            attributes.put("value", "None");
        }

        var index = builder.add(parent, field, kind, span, attributes);
        for (var child : children) {
            if (child.getValue() instanceof List<?> list) {
                for (var element : list) {
                    if (element instanceof Map<?, ?> map) {
                        node(map, index, child.getKey(), here);
                    }
                }
            } else {
                node((Map<?, ?>) child.getValue(), index, child.getKey(), here);
            }
        }
    }

    private static NodeKind kindOf(Map<?, ?> object, SourceSpan near) {
        var type = object.get(TYPE);
        if (!(type instanceof String name)) {
            throw malformed(near, "object without a '_type' key");
        }
        return NodeKind.fromPythonName(name)
                       .orElseThrow(() -> malformed(near, "unknown node type '" + name + "'"));
    }

    private static SourceSpan span(Map<?, ?> object, SourceSpan near) {
        if (!(object.get("lineno") instanceof Number line)) {
            return null;
        }
        var column = intValue(object.get("col_offset"), 0);
        var endLine = intValue(object.get("end_lineno"), line.intValue());
        var endColumn = intValue(object.get("end_col_offset"), column);
        try {
            return SourceSpan.sourceSpan(line.intValue(), column, endLine, endColumn);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException(new AnalysisError.MalformedInput(near, e.getMessage()), e);
        }
    }

    private static int intValue(Object value, int fallback) {
        return value instanceof Number number
               ? number.intValue()
               : fallback;
    }

    private static boolean isNode(Object value) {
        return value instanceof Map<?, ?> map && map.get(TYPE) instanceof String name && NodeKind.fromPythonName(name)
                                                                                                  .isPresent();
    }

    private static boolean isNodeList(Object value) {
        return value instanceof List<?> list && list.stream()
                                                    .anyMatch(AstConverter::isNode);
    }

    private static String attributeText(Object value, SourceSpan near) {
        if (value instanceof Map<?, ?> map) {
            return operatorName(map, near);
        }
        if (value instanceof List<?> list) {
            var parts = new ArrayList<String>();
            for (var element : list) {
                if (element != null) {
                    parts.add(attributeText(element, near));
                }
            }
            return String.join(",", parts);
        }
        return scalarText(value);
    }

    private static String operatorName(Map<?, ?> map, SourceSpan near) {
        if (map.get(TYPE) instanceof String name && map.size() == 1) {
            return name;
        }
        throw malformed(near, "unknown node type '" + map.get(TYPE) + "'");
    }

    private static String scalarText(Object value) {
        if (value instanceof Boolean bool) {
            return bool
                   ? "True"
                   : "False";
        }
        return String.valueOf(value);
    }

    private static String constantText(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return scalarText(value);
    }

    private static String constantType(Map<?, ?> object, Object value) {
        if (object.get(VALUE_TYPE) instanceof String declared) {
            return declared;
        }
        if (value == null) {
            return "NoneType";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
            return "int";
        }
        if (value instanceof Number) {
            return "float";
        }
        return "str";
    }

    private static MalformedInputException malformed(SourceSpan span, String detail) {
        return new MalformedInputException(new AnalysisError.MalformedInput(span, detail));
    }
}
