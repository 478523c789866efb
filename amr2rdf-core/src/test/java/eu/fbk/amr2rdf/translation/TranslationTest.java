package eu.fbk.amr2rdf.translation;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.amr2rdf.Enricher;
import eu.fbk.amr2rdf.parser.AmrParser;
import eu.fbk.amr2rdf.rdf.RdfFormat;
import eu.fbk.amr2rdf.vocabulary.FRED;

public class TranslationTest {

    private static final URI BOY = ValueFactoryImpl.getInstance().createURI(FRED.NAMESPACE,
            "boy");

    private static Translation translate(final String amr) {
        return new Translator().translate(new AmrParser().parse(amr));
    }

    @Test
    public void testEnrich() {
        final Translation translation = translate("(b / boy)");
        final Translation enriched = translation.enrich(new Enricher() {

            @Override
            public Model enrich(final Model graph, final String text) {
                final Model result = new LinkedHashModel(graph);
                result.add(BOY, RDFS.COMMENT, ValueFactoryImpl.getInstance().createLiteral(text));
                return result;
            }

        }, "the boy");
        Assert.assertNotSame(translation, enriched);
        Assert.assertEquals(translation.getGraph().size() + 1, enriched.getGraph().size());
        Assert.assertTrue(enriched.getGraph().contains(BOY, RDFS.COMMENT, null));
        Assert.assertFalse(translation.getGraph().contains(BOY, RDFS.COMMENT, null));
        Assert.assertTrue(enriched.serialize(RdfFormat.NTRIPLES).contains("the boy"));
        Assert.assertSame(translation.getRoot(), enriched.getRoot());
    }

    @Test
    public void testEnrichReceivesReadOnlyGraph() {
        final Translation translation = translate("(b / boy)");
        final Translation result = translation.enrich(new Enricher() {

            @Override
            public Model enrich(final Model graph, final String text) {
                graph.clear();
                return graph;
            }

        }, "the boy");
        Assert.assertSame(translation, result);
        Assert.assertFalse(translation.getGraph().isEmpty());
    }

    @Test
    public void testEnrichFailure() {
        final Translation translation = translate("(b / boy)");
        Assert.assertSame(translation, translation.enrich(new Enricher() {

            @Override
            public Model enrich(final Model graph, final String text) throws Exception {
                throw new Exception("unavailable");
            }

        }, "the boy"));
        Assert.assertSame(translation, translation.enrich(new Enricher() {

            @Override
            public Model enrich(final Model graph, final String text) {
                return null;
            }

        }, "the boy"));
    }

    @Test
    public void testNoEnricher() {
        final Translation translation = translate("(b / boy)");
        Assert.assertSame(translation, translation.enrich(null, "the boy"));
    }

}
