package org.dxworks.apislice.analyzer;

import org.treesitter.TSNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    public static String readSource(Path file) throws IOException {
        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }
        return sourceCode;
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets, so the text is cut from the encoded source
     * rather than from the Java string.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();

        if (startByte < 0) startByte = 0;
        if (endByte > sourceBytes.length) endByte = sourceBytes.length;
        if (startByte >= endByte) return "";

        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /** 1-based first line of the node. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based last line of the node. */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /** Named children of {@code parent}, in order; empty for a null node. */
    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> children = new ArrayList<>();
        if (parent == null || parent.isNull()) return children;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.isNamed()) children.add(child);
        }
        return children;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> matching = new ArrayList<>();
        for (TSNode child : namedChildren(parent)) {
            if (nodeType.equals(child.getType())) matching.add(child);
        }
        return matching;
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        List<TSNode> matching = findAllChildren(parent, nodeType);
        return matching.isEmpty() ? null : matching.get(0);
    }

    public static List<TSNode> findAllDescendants(TSNode root, String nodeType) {
        return findAllDescendantsOfTypes(root, nodeType);
    }

    /** Pre-order, so results come back in source order. */
    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (root == null || root.isNull()) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (parent == null || parent.isNull()) return null;
        // getFieldNameForChild(i) expects the index among all children, anonymous ones included
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn = parent.getFieldNameForChild(i);
            if (fieldName.equals(fn)) return parent.getChild(i);
        }
        return null;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (node == null || node.isNull()) return false;
        return isTypeOneOf(node.getType(), types);
    }

    /**
     * Strips one pair of matching quotes ({@code '}, {@code "} or backtick).
     */
    public static String stripQuotes(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if (first == last && (first == '\'' || first == '"' || first == '`')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    /**
     * Literal value of a {@code string} or {@code template_string} node, or {@code null}
     * for interpolated templates and any other node type.
     */
    public static String literalValue(byte[] sourceBytes, TSNode node) {
        if (isNodeTypeOneOf(node, "string")) {
            return stripQuotes(getNodeText(sourceBytes, node));
        }
        if (isNodeTypeOneOf(node, "template_string")) {
            String text = getNodeText(sourceBytes, node);
            if (text == null || text.contains("${")) return null;
            return stripQuotes(text);
        }
        return null;
    }
}
