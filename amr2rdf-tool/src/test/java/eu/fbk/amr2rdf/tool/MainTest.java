package eu.fbk.amr2rdf.tool;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

    private static final String AMR = "(w / want-01 :arg0 (b / boy) :arg1 (g / go-02 :arg0 b))";

    private static final String FRED = "http://www.ontologydesignpatterns.org/ont/fred/domain.owl#";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static String run(final byte[] input, final String... args) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        Main.run(Main.parse(args), new ByteArrayInputStream(input), out);
        return new String(out.toByteArray(), Charsets.UTF_8);
    }

    @Test
    public void testAmrOption() throws IOException {
        final String output = run(new byte[0], "-a", AMR, "-f", "nt");
        Assert.assertTrue(output.contains("<" + FRED + "boy> "
                + "<http://www.w3.org/1999/02/22-rdf-syntax-ns#type> <" + FRED + "Boy> ."));
        Assert.assertTrue(output.contains("want.01.wanter"));
    }

    @Test
    public void testStandardInput() throws IOException {
        final String output = run("(b / boy)".getBytes(Charsets.UTF_8));
        Assert.assertTrue(output.contains("@prefix fred:"));
        Assert.assertTrue(output.contains("fred:Topic"));
    }

    @Test
    public void testFiles() throws IOException {
        final File input = this.folder.newFile("input.amr");
        final File output = new File(this.folder.getRoot(), "output.nt");
        Files.asCharSink(input, Charsets.UTF_8).write("# ::snt The boy\n(b / boy)\n");
        run(new byte[0], "-i", input.getAbsolutePath(), "-o", output.getAbsolutePath(), "-f",
                "nt", "-n", "http://example.org/amr#");
        final String text = Files.asCharSource(output, Charsets.UTF_8).read();
        Assert.assertTrue(text.contains("<http://example.org/amr#boy>"));
    }

    @Test(expected = CommandLine.Exception.class)
    public void testMissingInputFile() {
        Main.parse("-i", new File(this.folder.getRoot(), "missing.amr").getAbsolutePath());
    }

    @Test(expected = eu.fbk.amr2rdf.SerializationException.class)
    public void testUnknownFormat() throws IOException {
        run(new byte[0], "-a", "(b / boy)", "-f", "foo");
    }

    @Test(expected = eu.fbk.amr2rdf.MalformedInputException.class)
    public void testMalformedInput() throws IOException {
        run(new byte[0], "-a", "(b / boy))");
    }

}
