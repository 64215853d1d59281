package dev.lemma.env;

import dev.lemma.expr.Expr;
import java.util.List;
import java.util.Objects;

public sealed interface Declaration
        permits Declaration.Inductive, Declaration.Constructor, Declaration.Axiom {
    String name();

    Expr type();

    /**
     * An inductive family. {@code numParams} leading arguments are uniform across all
     * constructors; {@code numIndices} further arguments vary per constructor.
     */
    record Inductive(String name, Expr type, int numParams, int numIndices, List<String> constructors)
            implements Declaration {
        public Inductive {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(constructors, "constructors");
            constructors = List.copyOf(constructors);
            if (numParams < 0) {
                throw new IllegalArgumentException("numParams must be >= 0");
            }
            if (numIndices < 0) {
                throw new IllegalArgumentException("numIndices must be >= 0");
            }
        }
    }

    record Constructor(String name, Expr type, String inductive) implements Declaration {
        public Constructor {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(inductive, "inductive");
        }
    }

    /** Any other constant (definitions are opaque at this level). */
    record Axiom(String name, Expr type) implements Declaration {
        public Axiom {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }
}
