package eu.fbk.amr2rdf.translation;

import java.io.IOException;
import java.net.URL;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

/**
 * Reader of the tab-separated static tables bundled with the translation engine. Empty lines and
 * lines starting with {@code #} are ignored; the value {@code *} denotes an empty cell.
 */
final class Tables {

    static final String NONE = "*";

    private static final Splitter TAB_SPLITTER = Splitter.on('\t').trimResults()
            .omitEmptyStrings();

    private static final Splitter SPACE_SPLITTER = Splitter.on(' ').trimResults()
            .omitEmptyStrings();

    private Tables() {
    }

    static URL resource(final String name) {
        final URL url = Tables.class.getResource(name);
        if (url == null) {
            throw new Error("Missing resource '" + name + "'");
        }
        return url;
    }

    static List<List<String>> read(final URL url, final int minColumns) throws IOException {
        final ImmutableList.Builder<List<String>> builder = ImmutableList.builder();
        int lineNumber = 0;
        for (final String line : Resources.readLines(url, Charsets.UTF_8)) {
            ++lineNumber;
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            final Splitter splitter = trimmed.indexOf('\t') >= 0 ? TAB_SPLITTER : SPACE_SPLITTER;
            final List<String> row = ImmutableList.copyOf(splitter.split(trimmed));
            if (row.size() < minColumns) {
                throw new IOException("Invalid line " + lineNumber + " in " + url + " (expected "
                        + minColumns + " columns): " + line);
            }
            builder.add(row);
        }
        return builder.build();
    }

    @Nullable
    static String cell(final List<String> row, final int index) {
        if (index >= row.size()) {
            return null;
        }
        final String value = row.get(index);
        return NONE.equals(value) ? null : value;
    }

}
