package dev.lemma.env;

import dev.lemma.expr.Expr;
import java.util.Objects;
import java.util.Optional;

final class EnvironmentEquationsEnv implements EquationsEnv {
    private final Environment env;

    EnvironmentEquationsEnv(Environment env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    @Override
    public boolean isInductive(String name) {
        return env.find(name).orElse(null) instanceof Declaration.Inductive;
    }

    @Override
    public Optional<String> isConstructor(Expr e) {
        if (!(e instanceof Expr.Const c)) {
            return Optional.empty();
        }
        if (env.find(c.name()).orElse(null) instanceof Declaration.Constructor ctor) {
            return Optional.of(ctor.inductive());
        }
        return Optional.empty();
    }

    @Override
    public int numParams(String inductive) {
        return inductive(inductive).numParams();
    }

    @Override
    public int numIndices(String inductive) {
        return inductive(inductive).numIndices();
    }

    private Declaration.Inductive inductive(String name) {
        if (env.find(name).orElse(null) instanceof Declaration.Inductive ind) {
            return ind;
        }
        throw new IllegalArgumentException("`" + name + "` is not an inductive type");
    }
}
