package dev.lemma.env;

import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** Immutable declaration table. {@code add*} methods return a new environment. */
public final class Environment {
    private static final Environment EMPTY = new Environment(new TreeMap<>());

    private final NavigableMap<String, Declaration> declarations;

    private Environment(NavigableMap<String, Declaration> declarations) {
        this.declarations = declarations;
    }

    public static Environment empty() {
        return EMPTY;
    }

    public Environment add(Declaration decl) {
        Objects.requireNonNull(decl, "decl");
        if (declarations.containsKey(decl.name())) {
            throw new IllegalArgumentException("duplicate declaration `" + decl.name() + "`");
        }
        NavigableMap<String, Declaration> copy = new TreeMap<>(declarations);
        copy.put(decl.name(), decl);
        return new Environment(copy);
    }

    /**
     * Adds an inductive together with its constructors. Every constructor named by
     * {@code inductive} must appear in {@code constructors} and point back at it.
     */
    public Environment addInductive(Declaration.Inductive inductive, List<Declaration.Constructor> constructors) {
        Objects.requireNonNull(inductive, "inductive");
        Objects.requireNonNull(constructors, "constructors");
        if (constructors.size() != inductive.constructors().size()) {
            throw new IllegalArgumentException(
                    "inductive `"
                            + inductive.name()
                            + "` declares "
                            + inductive.constructors().size()
                            + " constructors, got "
                            + constructors.size());
        }
        Environment env = add(inductive);
        for (int i = 0; i < constructors.size(); i++) {
            Declaration.Constructor c = constructors.get(i);
            if (!c.inductive().equals(inductive.name()) || !c.name().equals(inductive.constructors().get(i))) {
                throw new IllegalArgumentException(
                        "constructor `" + c.name() + "` does not belong to `" + inductive.name() + "`");
            }
            env = env.add(c);
        }
        return env;
    }

    public Optional<Declaration> find(String name) {
        return Optional.ofNullable(declarations.get(name));
    }
}
