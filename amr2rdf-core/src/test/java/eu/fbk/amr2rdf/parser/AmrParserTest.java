package eu.fbk.amr2rdf.parser;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.MalformedInputException;
import eu.fbk.amr2rdf.node.Node;
import eu.fbk.amr2rdf.node.NodeStatus;
import eu.fbk.amr2rdf.node.NodeType;

public class AmrParserTest {

    private static final String WANT_GO = "(w / want-01 :arg0 (b / boy) :arg1 (g / go-02 :arg0 b))";

    @Test
    public void testReentrancy() {
        final AmrDocument document = new AmrParser().parseDocument(WANT_GO);
        final Node root = document.getRoot();

        Assert.assertEquals("want-01", root.getLabel());
        Assert.assertEquals(NodeType.VERB, root.getType());
        Assert.assertEquals("want.01", root.getVerb());
        Assert.assertEquals(3, document.getBindings().size());
        Assert.assertTrue(document.getDiagnostics().isEmpty());

        final Node boy = document.getNode("b");
        final Node go = document.getNode("g");
        Assert.assertEquals(NodeType.NOUN, boy.getType());
        Assert.assertSame(boy, root.getChild(":arg0"));
        Assert.assertSame(boy, go.getChild(":arg0"));
        Assert.assertTrue(boy.isReentrant());
        Assert.assertEquals(3, root.preOrder().size());
    }

    @Test
    public void testSameChildTwice() {
        final AmrDocument document = new AmrParser().parseDocument(
                "(s / see-01 :ARG0 (i / i) :ARG1 i)");
        final Node root = document.getRoot();
        final Node i = document.getNode("i");
        Assert.assertTrue(document.getDiagnostics().isEmpty());
        Assert.assertEquals(2, root.getChildren().size());
        Assert.assertSame(i, root.getChild(":arg0"));
        Assert.assertSame(i, root.getChild(":arg1"));
        Assert.assertTrue(i.isReentrant());
    }

    @Test
    public void testSameChildTwiceForward() {
        final AmrDocument document = new AmrParser().parseDocument(
                "(a / see-01 :ARG0 b :ARG1 (b / boy))");
        final Node root = document.getRoot();
        final Node boy = document.getNode("b");
        Assert.assertTrue(document.getDiagnostics().isEmpty());
        Assert.assertEquals("boy", boy.getLabel());
        Assert.assertEquals(2, root.getChildren().size());
        Assert.assertSame(boy, root.getChild(":arg0"));
        Assert.assertSame(boy, root.getChild(":arg1"));
    }

    @Test
    public void testNormalization() {
        final String text = "# ::snt The boy wants to go\n(W / Want-01\n\t:ARG0 (B / Boy))";
        final Node root = new AmrParser().parse(text);
        Assert.assertEquals("want-01", root.getLabel());
        Assert.assertEquals("boy", root.getChild(":arg0").getLabel());
        Assert.assertEquals("w", root.getVar());
    }

    @Test
    public void testConstants() {
        final Node root = new AmrParser().parse("(c / city :name (n / name :op1 \"New York\") "
                + ":polarity - :quant 5 :value 1/2)");
        final Node name = root.getChild(":name").getChild(":op1");
        Assert.assertTrue(name.isConstant());
        Assert.assertTrue(name.isQuoted());
        Assert.assertEquals("New York", name.getLabel());
        Assert.assertEquals("-", root.getChild(":polarity").getLabel());
        Assert.assertEquals("5", root.getChild(":quant").getLabel());
        Assert.assertEquals("1/2", root.getChild(":value").getLabel());
    }

    @Test
    public void testForwardReference() {
        final AmrDocument document = new AmrParser()
                .parseDocument("(w / want-01 :arg0 b :arg1 (g / go-02 :arg0 (b / boy)))");
        final Node root = document.getRoot();
        final Node boy = root.getChild(":arg0");
        Assert.assertEquals("boy", boy.getLabel());
        Assert.assertEquals(NodeStatus.OK, boy.getStatus());
        Assert.assertSame(boy, document.getNode("g").getChild(":arg0"));
        Assert.assertTrue(document.getDiagnostics().isEmpty());
    }

    @Test(expected = MalformedInputException.class)
    public void testUnmatchedClosingParenthesis() {
        new AmrParser().parse("(b / boy))");
    }

    @Test
    public void testUnmatchedClosingParenthesisOffset() {
        try {
            new AmrParser().parse("(b / boy))");
            Assert.fail();
        } catch (final MalformedInputException ex) {
            Assert.assertEquals(9, ex.getOffset());
        }
    }

    @Test(expected = MalformedInputException.class)
    public void testUnterminatedString() {
        new AmrParser().parse("(p / person :name (n / name :op1 \"John))");
    }

    @Test(expected = MalformedInputException.class)
    public void testNoGraph() {
        new AmrParser().parse("boy");
    }

    @Test(expected = MalformedInputException.class)
    public void testEmpty() {
        new AmrParser().parse("# only a comment\n");
    }

    @Test
    public void testMissingClosingParenthesis() {
        final AmrDocument document = new AmrParser()
                .parseDocument("(w / want-01 :arg0 (b / boy)");
        Assert.assertEquals("want-01", document.getRoot().getLabel());
        Assert.assertEquals("boy", document.getRoot().getChild(":arg0").getLabel());
        Assert.assertEquals(1, document.getDiagnostics().size());
        Assert.assertEquals(Diagnostic.Kind.MALFORMED_NODE, document.getDiagnostics().get(0)
                .getKind());
    }

    @Test
    public void testUnresolvedReference() {
        final AmrDocument document = new AmrParser().parseDocument("(w / want-01 :arg0 x1)");
        final Node ref = document.getRoot().getChild(":arg0");
        Assert.assertEquals(NodeStatus.ERROR, ref.getStatus());
        Assert.assertEquals(1, document.getDiagnostics().size());
        final Diagnostic diagnostic = document.getDiagnostics().get(0);
        Assert.assertEquals(Diagnostic.Kind.UNRESOLVED_REFERENCE, diagnostic.getKind());
        Assert.assertEquals(":arg0", diagnostic.getRelation());
        Assert.assertEquals(ref.getId(), diagnostic.getNodeId());
    }

    @Test
    public void testDuplicateVariable() {
        final AmrDocument document = new AmrParser()
                .parseDocument("(a / boy :arg0 (a / girl))");
        Assert.assertEquals("boy", document.getNode("a").getLabel());
        Assert.assertEquals(NodeStatus.ERROR, document.getRoot().getChild(":arg0").getStatus());
        Assert.assertEquals(Diagnostic.Kind.MALFORMED_NODE, document.getDiagnostics().get(0)
                .getKind());
    }

    @Test
    public void testDepthBudget() {
        final AmrDocument document = new AmrParser(2, 100)
                .parseDocument("(a / x :arg0 (b / y :arg0 (c / z :arg0 (d / w))) :arg1 (e / v))");
        final Node root = document.getRoot();
        final Node pruned = root.getChild(":arg0").getChild(":arg0");
        Assert.assertEquals(NodeStatus.ERROR, pruned.getStatus());
        Assert.assertNull(document.getNode("c"));
        Assert.assertNull(document.getNode("d"));
        Assert.assertEquals("v", root.getChild(":arg1").getLabel());
        Assert.assertEquals(Diagnostic.Kind.BUDGET_EXCEEDED, document.getDiagnostics().get(0)
                .getKind());
    }

    @Test
    public void testNodeBudget() {
        final AmrDocument document = new AmrParser(100, 2)
                .parseDocument("(a / x :arg0 (b / y) :arg1 (c / z))");
        Assert.assertNotNull(document.getNode("b"));
        Assert.assertNull(document.getNode("c"));
        Assert.assertEquals(Diagnostic.Kind.BUDGET_EXCEEDED, document.getDiagnostics().get(0)
                .getKind());
    }

    @Test
    public void testMultiSentence() {
        final Node root = new AmrParser().parse("(b / boy) (g / girl)");
        Assert.assertEquals(AmrParser.MULTI_SENTENCE, root.getLabel());
        Assert.assertFalse(root.isVisible());
        Assert.assertTrue(root.isSynthetic());
        Assert.assertEquals(2, root.getChildren().size());
        Assert.assertEquals("boy", root.getChild(":snt1").getLabel());
        Assert.assertEquals("girl", root.getChild(":snt2").getLabel());
    }

    @Test
    public void testExplicitMultiSentence() {
        final Node root = new AmrParser()
                .parse("(m / multi-sentence :snt1 (b / boy) :snt2 (g / girl))");
        Assert.assertFalse(root.isVisible());
        Assert.assertFalse(root.isSynthetic());
        Assert.assertEquals("girl", root.getChild(":snt2").getLabel());
    }

    @Test
    public void testMissingConcept() {
        final AmrDocument document = new AmrParser().parseDocument("(w / want-01 :arg0 (b))");
        final Node node = document.getRoot().getChild(":arg0");
        Assert.assertTrue(node.isMalformed());
        Assert.assertEquals(Diagnostic.Kind.MALFORMED_NODE, document.getDiagnostics().get(0)
                .getKind());
    }

}
