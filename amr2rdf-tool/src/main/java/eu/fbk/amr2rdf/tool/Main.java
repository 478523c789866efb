package eu.fbk.amr2rdf.tool;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;

import com.google.common.base.Charsets;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.Amr2Rdf;
import eu.fbk.amr2rdf.Configuration;
import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.client.HttpAmrFetcher;
import eu.fbk.amr2rdf.rdf.RdfFormat;
import eu.fbk.amr2rdf.translation.Translation;

public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(final String[] args) {
        try {
            run(parse(args), System.in, System.out);
        } catch (final Throwable ex) {
            CommandLine.fail(ex);
        }
    }

    static CommandLine parse(final String... args) {
        return CommandLine
                .parser()
                .withName("amr2rdf")
                .withHeader("Translates an AMR graph in Penman notation, or the AMR obtained "
                        + "from a remote parser for a sentence, into a FRED-style RDF graph")
                .withOption("i", "input", "the file containing the AMR graph", "FILE",
                        CommandLine.Type.FILE_EXISTING, true, false, false)
                .withOption("a", "amr", "the AMR graph", "AMR", CommandLine.Type.STRING, true,
                        false, false)
                .withOption("t", "text", "the sentence to parse with the remote service",
                        "TEXT", CommandLine.Type.STRING, true, false, false)
                .withOption(null, "service",
                        "the remote AMR service: spring (default), spring-uni, usea", "NAME",
                        CommandLine.Type.STRING, true, false, false)
                .withOption("f", "format", "the output format: turtle (default), nt, xml, "
                        + "n3, json-ld", "FORMAT", CommandLine.Type.STRING, true, false, false)
                .withOption("o", "output", "the output file (default: standard output)",
                        "FILE", CommandLine.Type.FILE, true, false, false)
                .withOption("n", "namespace", "the namespace of generated names", "URI",
                        CommandLine.Type.STRING, true, false, false)
                .withFooter("The AMR graph is read from standard input if none of -i, -a, -t "
                        + "is specified.")
                .withLogger(LoggerFactory.getLogger("eu.fbk.amr2rdf")).parse(args);
    }

    static void run(final CommandLine cmd, final InputStream in, final OutputStream out)
            throws IOException {

        final File inputFile = cmd.getOptionValue("i", File.class);
        final String amrString = cmd.getOptionValue("a", String.class);
        final String text = cmd.getOptionValue("t", String.class);
        final String service = cmd.getOptionValue("service", String.class, "spring");
        final String namespace = cmd.getOptionValue("n", String.class);
        final File outputFile = cmd.getOptionValue("o", File.class);

        final Configuration configuration = Configuration.builder().namespace(namespace)
                .build();
        final RdfFormat format = RdfFormat.forName(cmd.getOptionValue("f", String.class,
                configuration.getFormat()));

        final Translation translation;
        if (text != null) {
            try (HttpAmrFetcher fetcher = HttpAmrFetcher.builder().build()) {
                final Amr2Rdf amr2rdf = Amr2Rdf.builder().configuration(configuration)
                        .fetcher(fetcher).build();
                translation = amr2rdf.translateText(text, service);
            }
        } else {
            final String amr;
            if (amrString != null) {
                amr = amrString;
            } else if (inputFile != null) {
                amr = Files.asCharSource(inputFile, Charsets.UTF_8).read();
            } else {
                amr = CharStreams.toString(new InputStreamReader(in, Charsets.UTF_8));
            }
            translation = Amr2Rdf.builder().configuration(configuration).build().translate(amr);
        }

        for (final Diagnostic diagnostic : translation.getDiagnostics()) {
            LOGGER.info("{}", diagnostic);
        }

        if (outputFile != null) {
            try (Writer writer = Files.asCharSink(outputFile, Charsets.UTF_8)
                    .openBufferedStream()) {
                translation.serialize(format, writer);
            }
            LOGGER.info("{} triples written to {}", translation.getGraph().size(), outputFile);
        } else {
            final Writer writer = new OutputStreamWriter(out, Charsets.UTF_8);
            translation.serialize(format, writer);
            writer.flush();
        }
    }

}
