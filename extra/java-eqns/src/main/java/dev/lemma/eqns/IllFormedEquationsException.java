package dev.lemma.eqns;

/**
 * An equations term does not have the shape the equations encoder produces.
 *
 * <p>Never expected on terms built by a correct compiler: it means the input was corrupted
 * upstream or a pass rewrote it incorrectly. Compilation of the enclosing definition stops.</p>
 */
public final class IllFormedEquationsException extends Exception {
    private final int eqnIndex;

    public IllFormedEquationsException(String message) {
        this(message, -1);
    }

    public IllFormedEquationsException(String message, int eqnIndex) {
        super(
                eqnIndex < 0
                        ? "ill-formed equations: " + message
                        : "ill-formed equations at equation " + eqnIndex + ": " + message);
        this.eqnIndex = eqnIndex;
    }

    /** Index of the offending clause in the group, or {@code -1} if the group itself is at fault. */
    public int eqnIndex() {
        return eqnIndex;
    }
}
