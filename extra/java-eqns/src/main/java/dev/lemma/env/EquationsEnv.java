package dev.lemma.env;

import dev.lemma.expr.Expr;
import java.util.Optional;

/**
 * What the equation compiler needs to know about inductive datatypes.
 *
 * <p>Pattern-splitting code goes through this interface rather than {@link Environment}, so a
 * new flavour of inductive type only has to be taught here.</p>
 */
public interface EquationsEnv {
    static EquationsEnv of(Environment env) {
        return new EnvironmentEquationsEnv(env);
    }

    boolean isInductive(String name);

    default boolean isInductive(Expr e) {
        return e instanceof Expr.Const c && isInductive(c.name());
    }

    /** The inductive family {@code e} is a constructor of, if {@code e} is a constructor constant. */
    Optional<String> isConstructor(Expr e);

    /** @throws IllegalArgumentException if {@code inductive} is not an inductive type */
    int numParams(String inductive);

    /** @throws IllegalArgumentException if {@code inductive} is not an inductive type */
    int numIndices(String inductive);
}
