package eu.fbk.amr2rdf.translation;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.amr2rdf.Configuration;
import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.parser.AmrParser;
import eu.fbk.amr2rdf.vocabulary.BOXING;
import eu.fbk.amr2rdf.vocabulary.DUL;
import eu.fbk.amr2rdf.vocabulary.FRED;
import eu.fbk.amr2rdf.vocabulary.QUANT;

public class TranslatorTest {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private static final String PBRS = "https://w3id.org/framester/data/propbank-3.4.0/RoleSet/";

    private static final String PBLR = "https://w3id.org/framester/data/propbank-3.4.0/LocalRole/";

    private static final String VN_ROLE = "http://www.ontologydesignpatterns.org/ont/vn/abox/role/vnrole.owl#";

    private static Translation translate(final String amr) {
        return new Translator().translate(new AmrParser().parseDocument(amr));
    }

    private static URI fred(final String localName) {
        return FACTORY.createURI(FRED.NAMESPACE + localName);
    }

    private static URI uri(final String namespace, final String localName) {
        return FACTORY.createURI(namespace + localName);
    }

    private static void assertTriple(final Model graph, final Resource subject,
            final URI predicate, final org.openrdf.model.Value object) {
        Assert.assertTrue("Missing " + subject + " " + predicate + " " + object + " in "
                + graph, graph.contains(subject, predicate, object));
    }

    private static boolean hasDiagnostic(final Translation translation,
            final Diagnostic.Kind kind) {
        for (final Diagnostic diagnostic : translation.getDiagnostics()) {
            if (diagnostic.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void testWantGo() {
        final Translation translation = translate(
                "(w / want-01 :arg0 (b / boy) :arg1 (g / go-02 :arg0 b))");
        final Model graph = translation.getGraph();

        Assert.assertEquals(1, graph.filter(null, RDF.TYPE, fred("Boy")).size());
        assertTriple(graph, fred("boy"), RDF.TYPE, fred("Boy"));
        assertTriple(graph, fred("want"), RDF.TYPE, uri(PBRS, "want-01"));
        assertTriple(graph, uri(PBRS, "want-01"), RDFS.SUBCLASSOF, DUL.EVENT);
        assertTriple(graph, fred("want"), uri(PBLR, "want.01.wanter"), fred("boy"));
        assertTriple(graph, fred("want"), uri(PBLR, "want.01.thing_wanted"), fred("go"));
        assertTriple(graph, fred("go"), RDF.TYPE, uri(PBRS, "go-02"));
        assertTriple(graph, fred("go"), uri(PBLR, "go.02.goer"), fred("boy"));
        assertTriple(translation.getSuppressedGraph(), uri(PBLR, "want.01.wanter"),
                RDF.TYPE, OWL.OBJECTPROPERTY);
        Assert.assertFalse(graph.contains(fred("boy"), DUL.HAS_QUALITY, fred("Topic")));
        Assert.assertTrue(translation.getDiagnostics().isEmpty());
    }

    @Test
    public void testSharedPronoun() {
        final Translation translation = translate(
                "(w / want-01 :ARG0 (i / i) :ARG1 (g / go-02 :ARG0 i))");
        final Model graph = translation.getGraph();
        Assert.assertEquals(1, graph.filter(null, RDF.TYPE, fred("Person")).size());
        assertTriple(graph, fred("want"), uri(PBLR, "want.01.wanter"), fred("person"));
        assertTriple(graph, fred("go"), uri(PBLR, "go.02.goer"), fred("person"));
    }

    @Test
    public void testExactRuleBeforePreposition() {
        final Translation translation = translate(
                "(s / sleep-01 :location (h / house) :prep-at (n / night))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("sleep"), uri(VN_ROLE, "Location"), fred("house"));
        assertTriple(graph, fred("sleep"), fred("at"), fred("night"));
        Assert.assertTrue(graph.filter(null, fred("location"), null).isEmpty());
    }

    @Test
    public void testUnknownRelation() {
        final Translation translation = translate("(b / boy :foo (c / cat))");
        assertTriple(translation.getGraph(), fred("boy"), fred("foo"), fred("cat"));
        Assert.assertTrue(hasDiagnostic(translation, Diagnostic.Kind.UNMAPPED_CONSTRUCT));
    }

    @Test
    public void testUnknownFrame() {
        final Translation translation = translate("(f / frobnicate-01 :arg0 (b / boy))");
        assertTriple(translation.getGraph(), fred("frobnicate"),
                FACTORY.createURI("https://w3id.org/framester/schema/propbank/ARG0"),
                fred("boy"));
        Assert.assertTrue(hasDiagnostic(translation, Diagnostic.Kind.UNMAPPED_CONSTRUCT));
    }

    @Test
    public void testInverseRelation() {
        final Translation translation = translate("(b / boy :arg0-of (s / sleep-01))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("sleep"), uri(PBLR, "sleep.01.sleeper"), fred("boy"));
        Assert.assertTrue(graph.filter(fred("boy"), null, fred("sleep")).isEmpty());
    }

    @Test
    public void testReflexiveArguments() {
        final Translation translation = translate("(s / see-01 :ARG0 (i / i) :ARG1 i)");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("see"), uri(PBLR, "see.01.viewer"), fred("person"));
        assertTriple(graph, fred("see"), uri(PBLR, "see.01.thing_viewed"), fred("person"));
        Assert.assertEquals(1, graph.filter(null, RDF.TYPE, fred("Person")).size());
    }

    @Test
    public void testNamedEntity() {
        final Translation translation = translate(
                "(p / person :name (n / name :op1 \"John\" :op2 \"Smith\"))");
        final Model graph = translation.getGraph();
        final URI john = fred("John_Smith");
        assertTriple(graph, john, RDF.TYPE, fred("Person"));
        assertTriple(graph, fred("Person"), RDFS.SUBCLASSOF, DUL.PERSON);
        assertTriple(graph, john, RDFS.LABEL, FACTORY.createLiteral("John Smith",
                XMLSchema.STRING));
        Assert.assertTrue(graph.filter(null, RDF.TYPE, fred("Name")).isEmpty());
        Assert.assertFalse(translation.getSuppressedGraph().isEmpty());
    }

    @Test
    public void testPolarity() {
        final Translation translation = translate("(g / go-02 :arg0 (b / boy) :polarity -)");
        assertTriple(translation.getGraph(), fred("go"), BOXING.HAS_TRUTH_VALUE, BOXING.FALSE);
    }

    @Test
    public void testLocation() {
        final Translation translation = translate(
                "(l / live-01 :arg0 (b / boy) :location (c / city :name (n / name "
                        + ":op1 \"Rome\") :wiki \"Rome\"))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("live"), uri(VN_ROLE, "Location"), fred("Rome"));
        assertTriple(graph, fred("Rome"), OWL.SAMEAS,
                FACTORY.createURI("http://dbpedia.org/resource/Rome"));
        assertTriple(graph, fred("City"), RDFS.SUBCLASSOF,
                FACTORY.createURI("http://schema.org/City"));
    }

    @Test
    public void testWikidata() {
        final Translation translation = translate(
                "(c / city :wiki \"Q220\" :name (n / name :op1 \"Rome\"))");
        assertTriple(translation.getGraph(), fred("Rome"), OWL.SAMEAS,
                FACTORY.createURI("http://www.wikidata.org/entity/Q220"));
    }

    @Test
    public void testNoWiki() {
        final Translation translation = translate(
                "(c / city :wiki - :name (n / name :op1 \"Rome\"))");
        Assert.assertTrue(translation.getGraph().filter(null, OWL.SAMEAS, null).isEmpty());
    }

    @Test
    public void testOrganizationRole() {
        final Translation translation = translate("(h / have-org-role-91 "
                + ":arg0 (p / person :name (n / name :op1 \"Obama\")) "
                + ":arg1 (c / country :name (n2 / name :op1 \"USA\")) "
                + ":arg2 (p2 / president))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("Obama"), DUL.HAS_ROLE, fred("president"));
        assertTriple(graph, fred("president"), FRED.OF, fred("USA"));
        Assert.assertTrue(graph.filter(null, RDF.TYPE, uri(PBRS, "have-org-role-91")).isEmpty());
        Assert.assertTrue(graph.filter(fred("have-org-role"), null, null).isEmpty());
        assertTriple(translation.getSuppressedGraph(), fred("have-org-role"), RDF.TYPE,
                uri(PBRS, "have-org-role-91"));
    }

    @Test
    public void testMissingRole() {
        final Translation translation = translate(
                "(h / have-org-role-91 :arg0 (p / person) :arg1 (c / company))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("person"), DUL.HAS_ROLE, fred("role"));
        assertTriple(graph, fred("role"), FRED.OF, fred("company"));
        assertTriple(graph, fred("role"), RDF.TYPE, fred("Role"));
        Assert.assertEquals("role", translation.getRoot().getChild(":arg2").getLabel());
    }

    @Test
    public void testReifiedRelation() {
        final Translation translation = translate(
                "(b / be-located-at-91 :arg1 (c / cat) :arg2 (h / house))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("cat"), uri(VN_ROLE, "Location"), fred("house"));
        Assert.assertTrue(graph.filter(fred("be-located-at"), null, null).isEmpty());
    }

    @Test
    public void testReifiedRelationMissingArgument() {
        final Translation translation = translate("(b / be-located-at-91 :arg1 (c / cat))");
        Assert.assertTrue(hasDiagnostic(translation, Diagnostic.Kind.MALFORMED_NODE));
        Assert.assertTrue(translation.getGraph().filter(fred("cat"), uri(VN_ROLE, "Location"),
                null).isEmpty());
    }

    @Test
    public void testAdjectiveModifier() {
        final Translation translation = translate("(g / giraffe :mod (t / tall))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("giraffe"), DUL.HAS_QUALITY, fred("Tall"));
        Assert.assertTrue(graph.filter(fred("tall"), null, null).isEmpty());
    }

    @Test
    public void testDemonstrativeModifier() {
        final Translation translation = translate("(b / book :mod (t / that))");
        assertTriple(translation.getGraph(), fred("book"), QUANT.HAS_DETERMINER, fred("That"));
    }

    @Test
    public void testCompositeModifier() {
        final Translation translation = translate("(h / house :mod (s / stone))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("house"), RDF.TYPE, fred("StoneHouse"));
        assertTriple(graph, fred("StoneHouse"), RDFS.SUBCLASSOF, fred("House"));
        assertTriple(graph, fred("StoneHouse"), DUL.ASSOCIATED_WITH, fred("Stone"));
        Assert.assertFalse(graph.contains(fred("house"), RDF.TYPE, fred("House")));
        Assert.assertTrue(graph.filter(fred("stone"), null, null).isEmpty());
        Assert.assertTrue(graph.filter(fred("house"), DUL.ASSOCIATED_WITH, null).isEmpty());
    }

    @Test
    public void testCompositeModifierEntityType() {
        final Translation translation = translate("(b / boy :mod (s / school))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("boy"), RDF.TYPE, fred("SchoolBoy"));
        assertTriple(graph, fred("SchoolBoy"), RDFS.SUBCLASSOF, fred("Boy"));
        assertTriple(graph, fred("SchoolBoy"), DUL.ASSOCIATED_WITH, fred("School"));
        assertTriple(graph, fred("School"), RDFS.SUBCLASSOF, DUL.ORGANIZATION);
    }

    @Test
    public void testCompositeModifierDomain() {
        final Translation translation = translate(
                "(t / teacher :mod (m / music) :domain (b / boy))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("boy"), RDF.TYPE, fred("MusicTeacher"));
        assertTriple(graph, fred("MusicTeacher"), RDFS.SUBCLASSOF, fred("Teacher"));
        assertTriple(graph, fred("MusicTeacher"), DUL.ASSOCIATED_WITH, fred("Music"));
    }

    @Test
    public void testComparativeModifier() {
        final Translation translation = translate(
                "(b / boy :mod (t / tall :degree (m / more) :compared-to (g / girl)))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("tallBoy"), RDF.TYPE, fred("TallBoy"));
        assertTriple(graph, fred("tallBoy"), DUL.HAS_QUALITY, fred("more"));
        assertTriple(graph, fred("tallBoy"), fred("than"), fred("girl"));
        Assert.assertTrue(graph.filter(null, null, fred("Tall")).isEmpty());
        Assert.assertTrue(graph.filter(fred("boy"), null, null).isEmpty());
    }

    @Test
    public void testDomainQuality() {
        final Translation translation = translate("(h / happy :domain (b / boy))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("boy"), DUL.HAS_QUALITY, fred("Happy"));
        Assert.assertTrue(graph.filter(null, DUL.HAS_QUALITY, fred("Topic")).isEmpty());
    }

    @Test
    public void testDomainType() {
        final Translation translation = translate("(t / teacher :domain (b / boy))");
        assertTriple(translation.getGraph(), fred("boy"), RDF.TYPE, fred("Teacher"));
    }

    @Test
    public void testPronoun() {
        final Translation translation = translate("(s / sleep-01 :arg0 (s2 / she))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("person"), RDF.TYPE, fred("Person"));
        assertTriple(graph, fred("person"), DUL.HAS_QUALITY, fred("Female"));
        assertTriple(graph, fred("sleep"), uri(PBLR, "sleep.01.sleeper"), fred("person"));
        Assert.assertTrue(graph.filter(fred("she"), null, null).isEmpty());
    }

    @Test
    public void testConjunction() {
        final Translation translation = translate("(a / and :op1 (b / boy) :op2 (b2 / boy))");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("and"), RDF.TYPE, BOXING.CONJUNCT);
        assertTriple(graph, fred("and"), DUL.HAS_MEMBER, fred("boy"));
        assertTriple(graph, fred("and"), DUL.HAS_MEMBER, fred("boy_2"));
        Assert.assertEquals(2, graph.filter(null, RDF.TYPE, fred("Boy")).size());
    }

    @Test
    public void testQuantity() {
        final Translation translation = translate(
                "(m / monetary-quantity :quant 5 :unit (d / dollar))");
        final Literal five = FACTORY.createLiteral("5", XMLSchema.DECIMAL);
        assertTriple(translation.getGraph(), fred("monetary-quantity"), DUL.HAS_DATA_VALUE,
                five);
        assertTriple(translation.getSuppressedGraph(), DUL.HAS_DATA_VALUE, RDF.TYPE,
                OWL.DATATYPEPROPERTY);
    }

    @Test
    public void testQuantifier() {
        final Translation translation = translate("(b / boy :quant 3)");
        assertTriple(translation.getGraph(), fred("boy"), QUANT.HAS_QUANTIFIER,
                FACTORY.createLiteral("3", XMLSchema.DECIMAL));
    }

    @Test
    public void testTopic() {
        final Translation translation = translate("(b / boy :mod (t / tall))");
        assertTriple(translation.getGraph(), fred("boy"), DUL.HAS_QUALITY, fred("Topic"));
    }

    @Test
    public void testTopicDisabled() {
        final Translator translator = new Translator(Configuration.builder()
                .topicEnabled(false).build(), RuleTable.getDefault());
        final Translation translation = translator.translate(new AmrParser().parse("(b / boy)"));
        Assert.assertFalse(translation.getGraph().contains(fred("boy"), DUL.HAS_QUALITY,
                fred("Topic")));
    }

    @Test
    public void testMultiSentence() {
        final Translation translation = translate("(b / boy) (g / girl)");
        final Model graph = translation.getGraph();
        assertTriple(graph, fred("boy"), DUL.HAS_QUALITY, fred("Topic"));
        assertTriple(graph, fred("girl"), DUL.HAS_QUALITY, fred("Topic"));
        Assert.assertTrue(graph.filter(null, fred("sentence1"), null).isEmpty());
    }

    @Test
    public void testCustomNamespace() {
        final String namespace = "http://example.org/fred#";
        final Translator translator = new Translator(Configuration.builder()
                .namespace(namespace).build(), RuleTable.getDefault());
        final Translation translation = translator.translate(new AmrParser().parse("(b / boy)"));
        Assert.assertTrue(translation.getGraph().contains(
                FACTORY.createURI(namespace + "boy"), RDF.TYPE,
                FACTORY.createURI(namespace + "Boy")));
        Assert.assertEquals(namespace, translation.getNamespaces().get("fred"));
    }

    @Test
    public void testCustomRules() {
        final RuleTable rules = RuleTable.builder()
                .add(new Rule(Rule.Category.EXACT, ":location", null, Rule.Action.PROPERTY,
                        "fred:in", null, false)).addAll(RuleTable.getDefault()).build();
        final Translator translator = new Translator(Configuration.getDefault(), rules);
        final Translation translation = translator.translate(new AmrParser()
                .parse("(s / sleep-01 :location (h / house))"));
        assertTriple(translation.getGraph(), fred("sleep"), fred("in"), fred("house"));
    }

    @Test
    public void testUnresolvedReference() {
        final Translation translation = translate("(w / want-01 :arg0 x1)");
        final Model graph = translation.getGraph();
        Assert.assertTrue(graph.filter(null, uri(PBLR, "want.01.wanter"), null).isEmpty());
        Assert.assertTrue(hasDiagnostic(translation, Diagnostic.Kind.UNRESOLVED_REFERENCE));
        assertTriple(graph, fred("want"), RDF.TYPE, uri(PBRS, "want-01"));
    }

    @Test
    public void testDeterminism() {
        final String amr = "(w / want-01 :arg0 (b / boy) :arg1 (g / go-02 :arg0 b))";
        Assert.assertEquals(translate(amr).getGraph(), translate(amr).getGraph());
    }

}
