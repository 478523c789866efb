package eu.fbk.amr2rdf;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.amr2rdf.rdf.RdfFormat;
import eu.fbk.amr2rdf.translation.Translation;
import eu.fbk.amr2rdf.vocabulary.FRED;

public class Amr2RdfTest {

    private static final String AMR = "(w / want-01 :arg0 (b / boy) :arg1 (g / go-02 :arg0 b))";

    @Test
    public void testTranslate() {
        final String turtle = Amr2Rdf.builder().build().translate(AMR, RdfFormat.TURTLE);
        Assert.assertTrue(turtle.contains("fred:boy"));
        Assert.assertTrue(turtle.contains("want.01.wanter"));
        Assert.assertTrue(turtle.contains("@prefix pblr:"));
    }

    @Test(expected = MalformedInputException.class)
    public void testMalformed() {
        Amr2Rdf.builder().build().translate("(b / boy))");
    }

    @Test
    public void testTranslateText() throws Exception {
        final URI boy = ValueFactoryImpl.getInstance().createURI(FRED.NAMESPACE, "boy");
        final Amr2Rdf amr2rdf = Amr2Rdf.builder().fetcher(new AmrFetcher() {

            @Override
            public String fetchAmr(final String text, final String variant) {
                Assert.assertEquals("The boy wants to go", text);
                Assert.assertEquals("spring", variant);
                return AMR;
            }

        }).enricher(new Enricher() {

            @Override
            public Model enrich(final Model graph, final String text) {
                final Model result = new LinkedHashModel(graph);
                result.add(boy, RDFS.LABEL, ValueFactoryImpl.getInstance().createLiteral("boy"));
                return result;
            }

        }).build();
        final Translation translation = amr2rdf.translateText("The boy wants to go", "spring");
        Assert.assertTrue(translation.getGraph().contains(boy, RDFS.LABEL, null));
    }

    @Test(expected = UpstreamUnavailableException.class)
    public void testUpstreamFailure() throws Exception {
        Amr2Rdf.builder().fetcher(new AmrFetcher() {

            @Override
            public String fetchAmr(final String text, final String variant)
                    throws UpstreamUnavailableException {
                throw new UpstreamUnavailableException(variant, "Connection refused");
            }

        }).build().translateText("The boy", "spring");
    }

    @Test(expected = IllegalStateException.class)
    public void testNoFetcher() throws Exception {
        Amr2Rdf.builder().build().translateText("The boy", "spring");
    }

}
