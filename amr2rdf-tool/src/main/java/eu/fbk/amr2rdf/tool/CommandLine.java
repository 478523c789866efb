package eu.fbk.amr2rdf.tool;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.net.URL;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;

import ch.qos.logback.classic.Level;

/**
 * Parsed command line of the tool, with a fluent {@link Parser} for declaring options.
 * <p>
 * Options {@code -h/--help} and {@code -v/--version} are always added; {@code -V/--verbose} is
 * added when a logger is supplied to the parser, and switches that logger to level DEBUG. Help,
 * version and syntax errors halt parsing with a {@link Exception}, which {@link #fail(Throwable)}
 * maps to the process exit code.
 * </p>
 */
public final class CommandLine {

    private final List<String> args;

    private final List<String> options;

    private final Map<String, List<String>> optionValues;

    private CommandLine(final List<String> args, final Map<String, List<String>> optionValues) {

        final List<String> options = Lists.newArrayList();
        for (final String letterOrName : optionValues.keySet()) {
            if (letterOrName.length() > 1) {
                options.add(letterOrName);
            }
        }

        this.args = args;
        this.options = Ordering.natural().immutableSortedCopy(options);
        this.optionValues = optionValues;
    }

    public <T> List<T> getArgs(final Class<T> type) {
        return convert(this.args, type);
    }

    public <T> T getArg(final int index, final Class<T> type) {
        return convert(this.args.get(index), type);
    }

    public int getArgCount() {
        return this.args.size();
    }

    public List<String> getOptions() {
        return this.options;
    }

    public boolean hasOption(final String letterOrName) {
        return this.optionValues.containsKey(letterOrName);
    }

    public <T> List<T> getOptionValues(final String letterOrName, final Class<T> type) {
        final List<String> strings = MoreObjects.firstNonNull(
                this.optionValues.get(letterOrName), ImmutableList.<String>of());
        return convert(strings, type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        final List<String> strings = this.optionValues.get(letterOrName);
        if (strings == null || strings.isEmpty()) {
            return null;
        }
        if (strings.size() > 1) {
            throw new Exception("Multiple values for option '" + letterOrName + "': "
                    + Joiner.on(", ").join(strings), null);
        }
        return convert(strings.get(0), type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            @Nullable final T defaultValue) {
        final T value = getOptionValue(letterOrName, type);
        return value != null ? value : defaultValue;
    }

    public int getOptionCount() {
        return this.options.size();
    }

    @SuppressWarnings("unchecked")
    private static <T> T convert(final String string, final Class<T> type) {
        try {
            if (type == String.class) {
                return (T) string;
            } else if (type == Integer.class) {
                return (T) Integer.valueOf(string);
            } else if (type == Long.class) {
                return (T) Long.valueOf(string);
            } else if (type == Boolean.class) {
                return (T) Boolean.valueOf(string);
            } else if (type == File.class) {
                return (T) new File(string);
            }
        } catch (final Throwable ex) {
            throw new Exception("'" + string + "' is not a valid " + type.getSimpleName(), ex);
        }
        throw new Exception("Unsupported option type " + type.getSimpleName(), null);
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> convert(final List<String> strings, final Class<T> type) {
        if (type == String.class) {
            return (List<T>) strings;
        }
        final List<T> list = Lists.newArrayList();
        for (final String string : strings) {
            list.add(convert(string, type));
        }
        return ImmutableList.copyOf(list);
    }

    /**
     * Reports the failure specified and terminates the JVM: syntax errors exit with code 2,
     * other failures with code 1 and a stack trace; halting exceptions without message (help,
     * version) exit with code 0.
     *
     * @param throwable
     *            the failure
     */
    public static void fail(final Throwable throwable) {
        System.exit(report(throwable));
    }

    static int report(final Throwable throwable) {
        if (throwable instanceof Exception) {
            if (throwable.getMessage() == null) {
                return 0;
            }
            System.err.println("SYNTAX ERROR: " + throwable.getMessage());
            return 2;
        } else {
            System.err.println("EXECUTION FAILED: " + throwable.getMessage());
            throwable.printStackTrace();
            return 1;
        }
    }

    public static Parser parser() {
        return new Parser();
    }

    public static final class Parser {

        @Nullable
        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

        private final Options options;

        private final Set<String> mandatoryOptions;

        private final Map<String, Type> optionTypes;

        public Parser() {
            this.name = null;
            this.header = null;
            this.footer = null;
            this.options = new Options();
            this.mandatoryOptions = new LinkedHashSet<>();
            this.optionTypes = Maps.newHashMap();
        }

        public Parser withName(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Parser withHeader(@Nullable final String header) {
            this.header = header;
            return this;
        }

        public Parser withFooter(@Nullable final String footer) {
            this.footer = footer;
            return this;
        }

        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);

            this.options.addOption(new Option(letter, name, false, description));
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type argType,
                final boolean argRequired, final boolean multiValue, final boolean mandatory) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);
            Preconditions.checkNotNull(argName);
            Preconditions.checkNotNull(argType);

            final Option option = new Option(letter, name, true, description);
            option.setArgName(argName);
            option.setOptionalArg(!argRequired);
            option.setArgs(multiValue ? Short.MAX_VALUE : 1);
            this.options.addOption(option);
            this.optionTypes.put(name, argType);

            if (mandatory) {
                this.mandatoryOptions.add(name);
            }

            return this;
        }

        public CommandLine parse(final String... args) {

            // Add standard options
            if (this.logger != null) {
                this.options.addOption("V", "verbose", false, "enable verbose output");
            }
            this.options.addOption("v", "version", false,
                    "display version information and terminate");
            this.options.addOption("h", "help", false, "display this help message and terminate");

            // Parse options
            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new GnuParser().parse(this.options, args);
            } catch (final org.apache.commons.cli.ParseException ex) {
                System.err.println("SYNTAX ERROR: " + ex.getMessage());
                printHelp();
                throw new Exception(null);
            }

            // Handle verbose mode
            if (cmd.hasOption('V')
                    && this.logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) this.logger).setLevel(Level.DEBUG);
            }

            // Handle version and help commands. Throw an exception to halt execution
            if (cmd.hasOption('v')) {
                printVersion();
                throw new Exception(null);

            } else if (cmd.hasOption('h')) {
                printHelp();
                throw new Exception(null);
            }

            // Check that mandatory options have been specified
            for (final String name : this.mandatoryOptions) {
                if (!cmd.hasOption(name)) {
                    throw new Exception("missing mandatory option " + name);
                }
            }

            // Extract options and their arguments, validating them
            final Map<String, List<String>> optionValues = Maps.newHashMap();
            for (final Option option : cmd.getOptions()) {
                final List<String> valueList = Lists.newArrayList();
                final String[] values = cmd.getOptionValues(option.getLongOpt());
                if (values != null) {
                    for (final String value : values) {
                        final Type type = this.optionTypes.get(option.getLongOpt());
                        if (type != null && !type.validate(value)) {
                            throw new Exception("invalid value '" + value + "' for option "
                                    + option.getLongOpt());
                        }
                        valueList.add(value);
                    }
                }
                final List<String> valueSet = ImmutableList.copyOf(valueList);
                optionValues.put(option.getLongOpt(), valueSet);
                if (option.getOpt() != null) {
                    optionValues.put(option.getOpt(), valueSet);
                }
            }

            return new CommandLine(ImmutableList.copyOf(cmd.getArgList()), optionValues);
        }

        private void printVersion() {
            String version = "(development)";
            final URL url = CommandLine.class.getClassLoader().getResource(
                    "META-INF/maven/eu.fbk.amr2rdf/amr2rdf-tool/pom.properties");
            if (url != null) {
                try (InputStream stream = url.openStream()) {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version").trim();
                } catch (final IOException ex) {
                    version = "(unknown)";
                }
            }
            final String name = MoreObjects.firstNonNull(this.name, "Version");
            System.out.println(String.format("%s %s\nJava %s bit (%s) %s\n", name, version,
                    System.getProperty("sun.arch.data.model"), System.getProperty("java.vendor"),
                    System.getProperty("java.version")));
        }

        private void printHelp() {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(System.out);
            final String name = MoreObjects.firstNonNull(this.name, "java");
            formatter.printUsage(out, 80, name, this.options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, 80, this.header);
            }
            out.println();
            formatter.printOptions(out, 80, this.options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    /**
     * Halts command line processing; a null message denotes a normal termination (help,
     * version).
     */
    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, @Nullable final Throwable cause) {
            super(message, cause);
        }

    }

    public enum Type {

        STRING,

        INTEGER,

        POSITIVE_INTEGER,

        FILE,

        FILE_EXISTING;

        public boolean validate(final String string) {
            if (this == INTEGER || this == POSITIVE_INTEGER) {
                try {
                    final long n = Long.parseLong(string);
                    return this == INTEGER || n > 0L;
                } catch (final NumberFormatException ex) {
                    return false;
                }
            } else if (this == FILE) {
                final File file = new File(string);
                return !file.exists() || file.isFile();
            } else if (this == FILE_EXISTING) {
                final File file = new File(string);
                return file.exists() && file.isFile();
            }
            return true;
        }

    }

}
