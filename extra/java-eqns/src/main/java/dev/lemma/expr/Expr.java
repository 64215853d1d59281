package dev.lemma.expr;

import java.util.List;
import java.util.Objects;

/**
 * Locally nameless terms.
 *
 * <p>Bound variables are de Bruijn indices ({@link Var}); free variables and
 * placeholders are {@link Local}s identified by their {@code uniqueName}. Equality is
 * structural.</p>
 */
public sealed interface Expr
        permits Expr.Var,
                Expr.Local,
                Expr.Const,
                Expr.Sort,
                Expr.Lit,
                Expr.App,
                Expr.Lambda,
                Expr.Pi,
                Expr.Macro {
    record Var(int index) implements Expr {
        public Var {
            if (index < 0) {
                throw new IllegalArgumentException("de Bruijn index must be >= 0");
            }
        }
    }

    record Local(String uniqueName, String ppName, Expr type, BinderInfo info) implements Expr {
        public Local {
            Objects.requireNonNull(uniqueName, "uniqueName");
            Objects.requireNonNull(ppName, "ppName");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(info, "info");
        }
    }

    record Const(String name) implements Expr {
        public Const {
            Objects.requireNonNull(name, "name");
        }
    }

    record Sort(int level) implements Expr {
        public Sort {
            if (level < 0) {
                throw new IllegalArgumentException("universe level must be >= 0");
            }
        }
    }

    /** Natural number literal. */
    record Lit(long value) implements Expr {
        public Lit {
            if (value < 0) {
                throw new IllegalArgumentException("literal must be >= 0");
            }
        }
    }

    record App(Expr fn, Expr arg) implements Expr {
        public App {
            Objects.requireNonNull(fn, "fn");
            Objects.requireNonNull(arg, "arg");
        }
    }

    record Lambda(String name, Expr domain, Expr body, BinderInfo info) implements Expr {
        public Lambda {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(info, "info");
        }
    }

    record Pi(String name, Expr domain, Expr body, BinderInfo info) implements Expr {
        public Pi {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(info, "info");
        }
    }

    record Macro(MacroDefinition definition, List<Expr> args) implements Expr {
        public Macro {
            Objects.requireNonNull(definition, "definition");
            Objects.requireNonNull(args, "args");
            args = List.copyOf(args);
        }
    }
}
