package org.dxworks.apislice.analyzer;

import org.dxworks.apislice.Dialect;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterHelperTest {

    private static final String TWO_STATEMENTS = "function handler(req, res) {}\napp.get('/ping', handler);\n";

    @Test
    void namedChildrenReturnsEachChildInOrder() {
        TSNode root = parse(TWO_STATEMENTS);

        List<TSNode> children = TreeSitterHelper.namedChildren(root);

        assertEquals(List.of("function_declaration", "expression_statement"),
                children.stream().map(TSNode::getType).collect(Collectors.toList()));
        assertEquals(1, TreeSitterHelper.startLine(children.get(0)));
        assertEquals(2, TreeSitterHelper.startLine(children.get(1)));
    }

    @Test
    void namedChildrenSkipsPunctuation() {
        TSNode root = parse(TWO_STATEMENTS);
        TSNode call = TreeSitterHelper.findAllDescendants(root, "call_expression").get(0);
        TSNode arguments = TreeSitterHelper.getChildByFieldName(call, "arguments");

        List<TSNode> args = TreeSitterHelper.namedChildren(arguments);

        byte[] bytes = TWO_STATEMENTS.getBytes(StandardCharsets.UTF_8);
        assertEquals(List.of("'/ping'", "handler"),
                args.stream().map(n -> TreeSitterHelper.getNodeText(bytes, n)).collect(Collectors.toList()));
        assertEquals("/ping", TreeSitterHelper.literalValue(bytes, args.get(0)));
    }

    @Test
    void descendantsComeBackInSourceOrder() {
        String source = "function a() { b(); }\nfunction c() { d(); }\n";
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);

        List<TSNode> calls = TreeSitterHelper.findAllDescendants(parse(source), "call_expression");

        assertEquals(List.of("b()", "d()"),
                calls.stream().map(n -> TreeSitterHelper.getNodeText(bytes, n)).collect(Collectors.toList()));
    }

    @Test
    void nullNodesHaveNoChildren() {
        assertTrue(TreeSitterHelper.namedChildren(null).isEmpty());
        assertTrue(TreeSitterHelper.findAllDescendants(null, "identifier").isEmpty());
    }

    private static TSNode parse(String source) {
        TSTree tree = TreeSitterGrammars.parse(Dialect.PLAIN_SCRIPT, source);
        assertNotNull(tree);
        return tree.getRootNode();
    }
}
