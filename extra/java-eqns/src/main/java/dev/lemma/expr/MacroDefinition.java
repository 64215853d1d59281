package dev.lemma.expr;

import java.util.Objects;

/** Macro kinds produced by the equations encoder. See {@link Equations}. */
public sealed interface MacroDefinition
        permits MacroDefinition.Equations,
                MacroDefinition.Equation,
                MacroDefinition.NoEquation,
                MacroDefinition.WfTactics {
    record Equations(EquationsHeader header) implements MacroDefinition {
        public Equations {
            Objects.requireNonNull(header, "header");
        }
    }

    /** {@code lhs = rhs}; args are exactly {@code [lhs, rhs]}. */
    record Equation(boolean ignoreIfUnused) implements MacroDefinition {}

    /** Marks a function of the group that has no equations; takes no args. */
    record NoEquation() implements MacroDefinition {}

    /** Wraps the user-provided well-founded tactics; one arg. */
    record WfTactics() implements MacroDefinition {}
}
