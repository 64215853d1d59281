package dev.lemma.env;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lemma.expr.BinderInfo;
import dev.lemma.expr.Expr;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EquationsEnvTest {
    private static final Expr TYPE = new Expr.Sort(1);
    private static final Expr NAT = new Expr.Const("nat");

    private static Environment env() {
        Expr vectorType =
                new Expr.Pi("α", TYPE, new Expr.Pi("n", NAT, TYPE, BinderInfo.DEFAULT), BinderInfo.DEFAULT);
        return Environment.empty()
                .addInductive(
                        new Declaration.Inductive("nat", TYPE, 0, 0, List.of("nat.zero", "nat.succ")),
                        List.of(
                                new Declaration.Constructor("nat.zero", NAT, "nat"),
                                new Declaration.Constructor("nat.succ", NAT, "nat")))
                .addInductive(
                        new Declaration.Inductive("vector", vectorType, 1, 1, List.of("vector.nil", "vector.cons")),
                        List.of(
                                new Declaration.Constructor("vector.nil", vectorType, "vector"),
                                new Declaration.Constructor("vector.cons", vectorType, "vector")))
                .add(new Declaration.Axiom("nat.add", NAT));
    }

    private final EquationsEnv eenv = EquationsEnv.of(env());

    @Test
    void shouldRecognizeInductives() {
        assertThat(eenv.isInductive("nat")).isTrue();
        assertThat(eenv.isInductive(NAT)).isTrue();
        assertThat(eenv.isInductive("nat.add")).isFalse();
        assertThat(eenv.isInductive("missing")).isFalse();
        assertThat(eenv.isInductive(new Expr.Var(0))).isFalse();
    }

    @Test
    void shouldMapConstructorsToTheirInductive() {
        assertThat(eenv.isConstructor(new Expr.Const("vector.cons"))).contains("vector");
        assertThat(eenv.isConstructor(new Expr.Const("nat.zero"))).contains("nat");
        assertThat(eenv.isConstructor(new Expr.Const("nat.add"))).isEmpty();
        assertThat(eenv.isConstructor(NAT)).isEmpty();
    }

    @Test
    void shouldReportParamsAndIndices() {
        assertThat(eenv.numParams("vector")).isEqualTo(1);
        assertThat(eenv.numIndices("vector")).isEqualTo(1);
        assertThat(eenv.numParams("nat")).isZero();
    }

    @Test
    void shouldRejectNonInductiveQueries() {
        assertThatThrownBy(() -> eenv.numParams("nat.add"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("`nat.add` is not an inductive type");
        assertThatThrownBy(() -> eenv.numIndices("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectDuplicateDeclarations() {
        Environment base = env();

        assertThatThrownBy(() -> base.add(new Declaration.Axiom("nat", TYPE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("duplicate declaration `nat`");
        assertThat(base.find("nat")).containsInstanceOf(Declaration.Inductive.class);
    }

    @Test
    void shouldRejectForeignConstructors() {
        assertThatThrownBy(
                        () ->
                                Environment.empty()
                                        .addInductive(
                                                new Declaration.Inductive("bool", TYPE, 0, 0, List.of("bool.tt")),
                                                List.of(new Declaration.Constructor("bool.tt", TYPE, "nat"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not belong to `bool`");
    }

    @Test
    void shouldAcceptAlternativeImplementations() {
        // Anything can stand behind the interface, e.g. a table of builtin types.
        EquationsEnv builtin =
                new EquationsEnv() {
                    @Override
                    public boolean isInductive(String name) {
                        return name.equals("unit");
                    }

                    @Override
                    public Optional<String> isConstructor(Expr e) {
                        return e.equals(new Expr.Const("unit.star")) ? Optional.of("unit") : Optional.empty();
                    }

                    @Override
                    public int numParams(String inductive) {
                        return 0;
                    }

                    @Override
                    public int numIndices(String inductive) {
                        return 0;
                    }
                };

        assertThat(builtin.isInductive(new Expr.Const("unit"))).isTrue();
        assertThat(builtin.isConstructor(new Expr.Const("unit.star"))).contains("unit");
    }
}
