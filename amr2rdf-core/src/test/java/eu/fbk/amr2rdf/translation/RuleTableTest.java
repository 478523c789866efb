package eu.fbk.amr2rdf.translation;

import java.util.Locale;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

public class RuleTableTest {

    @Test
    public void testExactRules() {
        final RuleTable table = RuleTable.getDefault();
        final Rule location = table.lookup(":location", "city");
        Assert.assertEquals(Rule.Category.EXACT, location.getCategory());
        Assert.assertEquals(Rule.Action.PROPERTY, location.getAction());
        Assert.assertEquals("vn.role:Location", location.getPredicate());
        Assert.assertEquals("fred:of", table.lookup(":POSS", "boy").getPredicate());
        Assert.assertTrue(table.hasExactRule(":part-of"));
        Assert.assertFalse(table.hasExactRule(":arg0-of"));
    }

    @Test
    public void testValueRules() {
        final RuleTable table = RuleTable.getDefault();
        final Rule negative = table.lookup(":polarity", "-");
        Assert.assertEquals("boxing:hasTruthValue", negative.getPredicate());
        Assert.assertEquals("boxing:False", negative.getObject());
        Assert.assertEquals(Rule.Action.SKIP, table.lookup(":wiki", "-").getAction());
        Assert.assertEquals(Rule.Action.WIKI, table.lookup(":wiki", "Rome").getAction());
        Assert.assertEquals(Rule.Category.FALLBACK, table.lookup(":polarity", "+")
                .getCategory());
    }

    @Test
    public void testPatternRules() {
        final RuleTable table = RuleTable.getDefault();
        final Rule argument = table.lookup(":arg0", "boy");
        Assert.assertEquals(Rule.Category.ARGUMENT, argument.getCategory());
        Assert.assertEquals("pbschema:ARG0", argument.expandPredicate(":arg0"));
        final Rule preposition = table.lookup(":prep-at", "house");
        Assert.assertEquals(Rule.Category.PREPOSITION, preposition.getCategory());
        Assert.assertEquals("fred:at", preposition.expandPredicate(":prep-at"));
        Assert.assertEquals(Rule.Action.OPERATOR, table.lookup(":op12", "x").getAction());
        Assert.assertTrue(table.lookup(":snt2", null).isHidden());
    }

    @Test
    public void testFallback() {
        final Rule rule = RuleTable.getDefault().lookup(":foo", "bar");
        Assert.assertEquals(Rule.Category.FALLBACK, rule.getCategory());
        Assert.assertEquals("fred:foo", rule.expandPredicate(":foo"));
        Assert.assertFalse(rule.isHidden());
        final Rule empty = RuleTable.builder().build().lookup(":bar", null);
        Assert.assertEquals("fred:bar", empty.expandPredicate(":bar"));
    }

    @Test
    public void testCategoryOrder() {
        final RuleTable table = RuleTable.builder()
                .add(new Rule(Rule.Category.FALLBACK, ":(.+)", null, Rule.Action.FALLBACK,
                        "fred:$1", null, false))
                .add(new Rule(Rule.Category.EXACT, ":arg0", null, Rule.Action.PROPERTY,
                        "fred:agent", null, false)).build();
        Assert.assertEquals(Rule.Category.EXACT, table.getRules().get(0).getCategory());
        Assert.assertEquals("fred:agent", table.lookup(":arg0", null).getPredicate());
    }

    @Test
    public void testOverride() {
        final RuleTable table = RuleTable.builder()
                .add(new Rule(Rule.Category.EXACT, ":location", null, Rule.Action.PROPERTY,
                        "fred:in", null, false)).addAll(RuleTable.getDefault()).build();
        Assert.assertEquals("fred:in", table.lookup(":location", "city").getPredicate());
        Assert.assertEquals("vn.role:Time", table.lookup(":time", "date-entity")
                .getPredicate());
    }

    @Test
    public void testLocaleIndependence() {
        final Locale locale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            final RuleTable table = RuleTable.builder()
                    .add(new Rule(Rule.Category.EXACT, ":TIME-LIMIT", null,
                            Rule.Action.PROPERTY, "fred:deadline", null, false)).build();
            Assert.assertEquals("fred:deadline", table.lookup(":time-limit", null)
                    .getPredicate());
            Assert.assertEquals("fred:deadline", table.lookup(":TIME-LIMIT", null)
                    .getPredicate());
            Assert.assertTrue(table.hasExactRule(":Time-Limit"));

            final Rule parsed = Rule.parse(ImmutableList.of("preposition", ":prep-(.+)", "*",
                    "preposition", "fred:$1", "*", "hidden"));
            Assert.assertEquals(Rule.Category.PREPOSITION, parsed.getCategory());
            Assert.assertEquals(Rule.Action.PREPOSITION, parsed.getAction());
        } finally {
            Locale.setDefault(locale);
        }
    }

}
