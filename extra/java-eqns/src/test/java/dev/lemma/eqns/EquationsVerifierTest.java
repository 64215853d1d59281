package dev.lemma.eqns;

import static dev.lemma.eqns.EquationsFixtures.ADD;
import static dev.lemma.eqns.EquationsFixtures.NAT;
import static dev.lemma.eqns.EquationsFixtures.NAT_TO_NAT;
import static dev.lemma.eqns.EquationsFixtures.VECTOR;
import static dev.lemma.eqns.EquationsFixtures.ZERO;
import static dev.lemma.eqns.EquationsFixtures.clause;
import static dev.lemma.eqns.EquationsFixtures.noEquation;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lemma.expr.Equations;
import dev.lemma.expr.EquationsHeader;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.List;
import org.junit.jupiter.api.Test;

class EquationsVerifierTest {

    private final TypeContext ctx = new TypeContext(EquationsFixtures.natEnv());

    @Test
    void shouldAcceptEncoderOutput() {
        for (Expr group :
                List.of(
                        EquationsFixtures.mutualAB(),
                        EquationsFixtures.pred(),
                        EquationsFixtures.vectorHead(),
                        EquationsFixtures.withNoEquationAndWf(),
                        EquationsFixtures.empty())) {
            assertThatCode(() -> EquationsVerifier.verify(ctx, group)).doesNotThrowAnyException();
        }
    }

    @Test
    void shouldRejectDanglingPlaceholder() {
        BinderStack stack = new BinderStack(ctx);
        Expr.Local stray = stack.push("stray", NAT);
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(clause(List.of(ff), List.of(), Exprs.mkApp(ff, stray), stray)));
        stack.release();

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessage("ill-formed equations at equation 0: dangling placeholder `stray`");
    }

    @Test
    void shouldAcceptLivePlaceholdersOfEnclosingScope() {
        BinderStack outer = new BinderStack(ctx);
        Expr.Local m = outer.push("m", NAT);
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr.Local k = b.declareLocal("k", NAT);
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(clause(List.of(ff), List.of(k), Exprs.mkApp(ff, k), Exprs.mkApp(ADD, k, m))));

        assertThatCode(() -> EquationsVerifier.verify(ctx, group)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectFunctionTypeDependingOnSibling() {
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr.Local fg = b.declareLocal("g", Exprs.mkApp(VECTOR, NAT, Exprs.mkApp(ff, ZERO)));
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f", "g")),
                        List.of(
                                clause(List.of(ff, fg), List.of(), Exprs.mkApp(ff, ZERO), ZERO),
                                noEquation(List.of(ff, fg))));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessage(
                        "ill-formed equations at equation 0: type of function `g` depends on another function of the group");
    }

    @Test
    void shouldRejectFunctionBindersDifferingBetweenClauses() {
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr.Local wider = b.declareLocal("f", EquationsFixtures.arrow(NAT, NAT_TO_NAT));
        Expr.Local n = b.declareLocal("n", NAT);
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(
                                clause(List.of(ff), List.of(), Exprs.mkApp(ff, ZERO), ZERO),
                                clause(List.of(wider), List.of(n), Exprs.mkApp(wider, n), n)));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessage("ill-formed equations at equation 1: binder of function `f` differs from the first equation");
    }

    @Test
    void shouldRejectLooseBoundVariables() {
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(Equations.mkEquation(new Expr.Var(0), new Expr.Var(0))));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessageContaining("loose bound variables");
    }

    @Test
    void shouldRejectLhsNotHeadedByGroupFunction() {
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr.Local n = b.declareLocal("n", NAT);
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(clause(List.of(ff), List.of(n), Exprs.mkApp(EquationsFixtures.SUCC, n), n)));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessageContaining("lhs is not an application of a function of the group");
    }

    @Test
    void shouldRejectFunctionsMissingFromGroup() {
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", NAT_TO_NAT);
        Expr.Local fg = b.declareLocal("g", NAT_TO_NAT);
        Expr.Local n = b.declareLocal("n", NAT);
        List<Expr.Local> fns = List.of(ff, fg);
        Expr onlyF =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f", "g")),
                        List.of(clause(fns, List.of(n), Exprs.mkApp(ff, n), n)));
        Expr onlyG =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f", "g")),
                        List.of(clause(fns, List.of(n), Exprs.mkApp(fg, n), n)));
        Expr afterNoEquation =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f", "g")),
                        List.of(noEquation(fns), clause(fns, List.of(n), Exprs.mkApp(ff, n), n)));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, onlyF))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessage("ill-formed equations: header declares 2 function(s), equations cover 1");
        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, onlyG))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessageContaining("out of order");
        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, afterNoEquation))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessageContaining("out of order");
    }

    @Test
    void shouldRejectArityMismatch() {
        TypeContext b = new TypeContext(EquationsFixtures.natEnv());
        Expr.Local ff = b.declareLocal("f", EquationsFixtures.arrow(NAT, NAT_TO_NAT));
        Expr.Local n = b.declareLocal("n", NAT);
        List<Expr.Local> fns = List.of(ff);
        Expr group =
                Equations.mkEquations(
                        EquationsHeader.of(List.of("f")),
                        List.of(
                                clause(fns, List.of(n), Exprs.mkApp(ff, n, n), n),
                                clause(fns, List.of(n), Exprs.mkApp(ff, n), n)));

        assertThatThrownBy(() -> EquationsVerifier.verify(ctx, group))
                .isInstanceOf(IllFormedEquationsException.class)
                .hasMessage("ill-formed equations at equation 1: equation for function #0 has 1 argument(s), expected 2");
    }
}
