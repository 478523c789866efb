package eu.fbk.amr2rdf.node;

import org.junit.Assert;
import org.junit.Test;

public class CoupleTest {

    @Test
    public void testLocalNames() {
        final Couple couple = new Couple("boy");
        Assert.assertEquals(1, couple.getOccurrence());
        Assert.assertEquals("boy", couple.getLocalName());
        Assert.assertEquals(2, couple.increment());
        Assert.assertEquals("boy_2", couple.getLocalName());
        couple.increment();
        Assert.assertEquals("boy_3", couple.getLocalName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyWord() {
        new Couple("");
    }

}
