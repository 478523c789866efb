package eu.fbk.amr2rdf.translation;

import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup tables of PropBank rolesets and their numbered roles, used to type verb individuals and
 * to map {@code :argN} edges to local roles (e.g., {@code :arg0} of {@code want-01} is
 * {@code pblr:want.01.wanter}).
 */
public final class PropBank {

    private static final Logger LOGGER = LoggerFactory.getLogger(PropBank.class);

    @Nullable
    private static PropBank defaultInstance = null;

    private final Map<String, Frame> frames;

    private final Map<String, Role> roles;

    /**
     * Creates a new instance with the frames and roles specified.
     *
     * @param frames
     *            the frames, keyed by their roleset id
     * @param roles
     *            the roles
     */
    public PropBank(final Iterable<Frame> frames, final Iterable<Role> roles) {
        final Map<String, Frame> frameMap = Maps.newLinkedHashMap();
        for (final Frame frame : frames) {
            frameMap.put(frame.getRoleset(), frame);
        }
        final Map<String, Role> roleMap = Maps.newLinkedHashMap();
        for (final Role role : roles) {
            roleMap.put(role.getRoleset() + "/" + role.getArgument(), role);
        }
        this.frames = ImmutableMap.copyOf(frameMap);
        this.roles = ImmutableMap.copyOf(roleMap);
    }

    public static synchronized PropBank getDefault() {
        if (defaultInstance == null) {
            try {
                defaultInstance = load(Tables.resource("propbank-frames.tsv"),
                        Tables.resource("propbank-roles.tsv"));
            } catch (final IOException ex) {
                throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
            }
        }
        return defaultInstance;
    }

    /**
     * Loads frames and roles from tab-separated resources.
     *
     * @param framesURL
     *            the frames table: roleset, label, mapped frames
     * @param rolesURL
     *            the roles table: roleset, argument number, local role, generic role, thematic
     *            role
     * @return the loaded instance
     * @throws IOException
     *             on failure
     */
    public static PropBank load(final URL framesURL, final URL rolesURL) throws IOException {
        final List<Frame> frames = Lists.newArrayList();
        for (final List<String> row : Tables.read(framesURL, 2)) {
            frames.add(new Frame(row.get(0), row.get(1), row.subList(2, row.size())));
        }
        final List<Role> roles = Lists.newArrayList();
        for (final List<String> row : Tables.read(rolesURL, 3)) {
            try {
                roles.add(new Role(row.get(0), Integer.parseInt(row.get(1)), row.get(2),
                        Tables.cell(row, 3), Tables.cell(row, 4)));
            } catch (final NumberFormatException ex) {
                throw new IOException("Invalid argument number in " + rolesURL + ": " + row, ex);
            }
        }
        final PropBank result = new PropBank(frames, roles);
        LOGGER.debug("Loaded {} PropBank frames and {} roles", frames.size(), roles.size());
        return result;
    }

    /**
     * Returns the frame for the roleset specified.
     *
     * @param roleset
     *            the roleset, e.g. {@code want-01}
     * @return the frame, or null if unknown
     */
    @Nullable
    public Frame getFrame(final String roleset) {
        return this.frames.get(roleset);
    }

    /**
     * Returns the role for the roleset and argument number specified.
     *
     * @param roleset
     *            the roleset, e.g. {@code want-01}
     * @param argument
     *            the argument number, e.g. 0 for {@code :arg0}
     * @return the role, or null if unknown
     */
    @Nullable
    public Role getRole(final String roleset, final int argument) {
        return this.roles.get(roleset + "/" + argument);
    }

    @Override
    public String toString() {
        return "PropBank (" + this.frames.size() + " frames, " + this.roles.size() + " roles)";
    }

    public static final class Frame {

        private final String roleset;

        private final String label;

        private final List<String> mappedFrames;

        public Frame(final String roleset, final String label, final List<String> mappedFrames) {
            this.roleset = Preconditions.checkNotNull(roleset);
            this.label = Preconditions.checkNotNull(label);
            this.mappedFrames = ImmutableList.copyOf(mappedFrames);
        }

        public String getRoleset() {
            return this.roleset;
        }

        public String getLabel() {
            return this.label;
        }

        /**
         * Returns the names of the FrameNet and VerbAtlas frames the roleset is subsumed under.
         *
         * @return a list of {@code prefix:local} names
         */
        public List<String> getMappedFrames() {
            return this.mappedFrames;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("roleset", this.roleset)
                    .add("label", this.label).add("frames", this.mappedFrames).toString();
        }

    }

    public static final class Role {

        private final String roleset;

        private final int argument;

        private final String localRole;

        @Nullable
        private final String genericRole;

        @Nullable
        private final String thematicRole;

        public Role(final String roleset, final int argument, final String localRole,
                @Nullable final String genericRole, @Nullable final String thematicRole) {
            Preconditions.checkArgument(argument >= 0, "Invalid argument number %s", argument);
            this.roleset = Preconditions.checkNotNull(roleset);
            this.argument = argument;
            this.localRole = Preconditions.checkNotNull(localRole);
            this.genericRole = genericRole;
            this.thematicRole = thematicRole;
        }

        public String getRoleset() {
            return this.roleset;
        }

        public int getArgument() {
            return this.argument;
        }

        public String getLocalRole() {
            return this.localRole;
        }

        @Nullable
        public String getGenericRole() {
            return this.genericRole;
        }

        @Nullable
        public String getThematicRole() {
            return this.thematicRole;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).omitNullValues()
                    .add("roleset", this.roleset).add("argument", this.argument)
                    .add("local", this.localRole).add("generic", this.genericRole)
                    .add("thematic", this.thematicRole).toString();
        }

    }

}
