package eu.fbk.amr2rdf.node;

import com.google.common.base.Preconditions;

/**
 * A (word, occurrence) counter.
 * <p>
 * A {@code Couple} is created the first time a word is seen in a document, with occurrence 1,
 * and incremented each time the same word is seen again. It is used to build per-occurrence
 * local names that do not collide: the first occurrence of {@code boy} yields {@code boy}, the
 * second {@code boy_2}, and so on.
 * </p>
 */
public final class Couple {

    private final String word;

    private int occurrence;

    /**
     * Creates a new counter for the word specified, with occurrence 1.
     *
     * @param word
     *            the word, not empty
     */
    public Couple(final String word) {
        Preconditions.checkArgument(!word.isEmpty(), "Empty word");
        this.word = word;
        this.occurrence = 1;
    }

    public String getWord() {
        return this.word;
    }

    public int getOccurrence() {
        return this.occurrence;
    }

    /**
     * Increments the occurrence counter, returning the new value.
     *
     * @return the incremented occurrence
     */
    public int increment() {
        return ++this.occurrence;
    }

    /**
     * Returns the local name for the current occurrence: the word itself for the first
     * occurrence, the word followed by {@code _} and the occurrence number otherwise.
     *
     * @return the local name
     */
    public String getLocalName() {
        return this.occurrence == 1 ? this.word : this.word + "_" + this.occurrence;
    }

    @Override
    public String toString() {
        return this.word + " (" + this.occurrence + ")";
    }

}
