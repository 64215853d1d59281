package dev.lemma.eqns;

import dev.lemma.expr.Equations;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Finds calls from equation right-hand sides back into the group being defined. Groups without
 * such calls can be compiled structurally; the others need well-founded recursion.
 */
public final class RecursionDetector {
    private static final Logger log = Logger.getLogger(RecursionDetector.class);

    private RecursionDetector() {}

    /** True iff some rhs of {@code e} refers to a function defined by {@code e}. */
    public static boolean isRecursive(TypeContext ctx, Expr e) throws IllFormedEquationsException {
        try (UnpackedEquations ues = new UnpackedEquations(ctx, e)) {
            Set<String> fnNames = fnNames(ues);
            for (int fidx = 0; fidx < ues.numFns(); fidx++) {
                for (Expr eqn : ues.eqnsView(fidx)) {
                    if (refersTo(rhsOf(eqn), fnNames)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }

    /** Indices of the functions having at least one rhs that refers to the group. */
    public static Set<Integer> recursiveFns(TypeContext ctx, Expr e) throws IllFormedEquationsException {
        Set<Integer> result = new TreeSet<>();
        try (UnpackedEquations ues = new UnpackedEquations(ctx, e)) {
            Set<String> fnNames = fnNames(ues);
            for (int fidx = 0; fidx < ues.numFns(); fidx++) {
                for (Expr eqn : ues.eqnsView(fidx)) {
                    if (refersTo(rhsOf(eqn), fnNames)) {
                        result.add(fidx);
                        break;
                    }
                }
            }
            log.debugf("recursive functions of %s: %s", ues.header().fnNames(), result);
        }
        return result;
    }

    private static Set<String> fnNames(UnpackedEquations ues) {
        Set<String> names = new HashSet<>();
        for (int fidx = 0; fidx < ues.numFns(); fidx++) {
            names.add(ues.fn(fidx).uniqueName());
        }
        return names;
    }

    // Pattern variables stay loose bound variables here; only the function placeholders matter.
    private static Expr rhsOf(Expr eqn) {
        Expr it = eqn;
        while (it instanceof Expr.Lambda lam) {
            it = lam.body();
        }
        return Equations.equationRhs(it);
    }

    private static boolean refersTo(Expr rhs, Set<String> fnNames) {
        return Exprs.find(rhs, (t, offset) -> t instanceof Expr.Local l && fnNames.contains(l.uniqueName()))
                .isPresent();
    }
}
