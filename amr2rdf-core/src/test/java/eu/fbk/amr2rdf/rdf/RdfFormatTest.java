package eu.fbk.amr2rdf.rdf;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.amr2rdf.SerializationException;

public class RdfFormatTest {

    @Test
    public void testForName() {
        Assert.assertEquals(RdfFormat.TURTLE, RdfFormat.forName("turtle"));
        Assert.assertEquals(RdfFormat.TURTLE, RdfFormat.forName(" TTL "));
        Assert.assertEquals(RdfFormat.NTRIPLES, RdfFormat.forName("nt"));
        Assert.assertEquals(RdfFormat.RDFXML, RdfFormat.forName("xml"));
        Assert.assertEquals(RdfFormat.N3, RdfFormat.forName("n3"));
        Assert.assertEquals(RdfFormat.JSONLD, RdfFormat.forName("json-ld"));
        Assert.assertEquals("json-ld", RdfFormat.JSONLD.toString());
    }

    @Test(expected = SerializationException.class)
    public void testUnknownFormat() {
        RdfFormat.forName("foo");
    }

}
