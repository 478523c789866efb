package eu.fbk.amr2rdf.tool;

import org.junit.Assert;
import org.junit.Test;

public class CommandLineTest {

    private static CommandLine.Parser parser() {
        return CommandLine.parser().withName("test")
                .withOption("n", "number", "a number", "N", CommandLine.Type.POSITIVE_INTEGER,
                        true, false, false)
                .withOption("x", "values", "some values", "X", CommandLine.Type.STRING, true,
                        true, false)
                .withOption("q", "quiet", "a flag");
    }

    @Test
    public void testParse() {
        final CommandLine cmd = parser().parse("-n", "3", "-x", "a", "b", "-q");
        Assert.assertEquals(Integer.valueOf(3), cmd.getOptionValue("n", Integer.class));
        Assert.assertEquals(Long.valueOf(3L), cmd.getOptionValue("number", Long.class));
        Assert.assertTrue(cmd.hasOption("q"));
        Assert.assertTrue(cmd.hasOption("quiet"));
        Assert.assertEquals(2, cmd.getOptionValues("values", String.class).size());
        Assert.assertEquals("x", cmd.getOptionValue("missing", String.class, "x"));
    }

    @Test(expected = CommandLine.Exception.class)
    public void testInvalidValue() {
        parser().parse("-n", "0");
    }

    @Test(expected = CommandLine.Exception.class)
    public void testNotANumber() {
        parser().parse("-n", "three");
    }

    @Test(expected = CommandLine.Exception.class)
    public void testMultipleValues() {
        parser().parse("-x", "a", "b").getOptionValue("x", String.class);
    }

    @Test
    public void testReport() {
        Assert.assertEquals(0, CommandLine.report(new CommandLine.Exception(null)));
        Assert.assertEquals(2, CommandLine.report(new CommandLine.Exception("bad option")));
        Assert.assertEquals(1, CommandLine.report(new IllegalStateException("failure")));
    }

}
