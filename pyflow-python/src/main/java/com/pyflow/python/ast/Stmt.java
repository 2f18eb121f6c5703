package com.pyflow.python.ast;

import java.util.List;

/**
 * Statement node with its first and last 1-based source line. Compound statements end on the last
 * line of their last block.
 */
public interface Stmt {

    int line();

    int endLine();

    record ExprStmt(Expr value, int line, int endLine) implements Stmt {
    }

    /** {@code t1 = t2 = value}; several targets for chained assignment. */
    record Assign(List<Expr> targets, Expr value, int line, int endLine) implements Stmt {

        public Assign {
            targets = List.copyOf(targets);
        }
    }

    /** {@code target op= value}; {@code op} is the operator without {@code =}. */
    record AugAssign(Expr target, String op, Expr value, int line, int endLine) implements Stmt {
    }

    /** {@code target: annotation = value}; value may be null. */
    record AnnAssign(Expr target, Expr annotation, Expr value, int line, int endLine) implements Stmt {
    }

    record Import(List<Alias> names, int line, int endLine) implements Stmt {

        public Import {
            names = List.copyOf(names);
        }
    }

    /** {@code from module import names}; module is null for a purely relative import. */
    record ImportFrom(String module, List<Alias> names, int level, int line, int endLine) implements Stmt {

        public ImportFrom {
            names = List.copyOf(names);
        }
    }

    /** {@code if} statement; {@code elif} chains nest as a single {@link If} in {@code orElse}. */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, int line, int endLine) implements Stmt {

        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, int line, int endLine) implements Stmt {

        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, int line, int endLine) implements Stmt {

        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record With(List<WithItem> items, List<Stmt> body, int line, int endLine) implements Stmt {

        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }
    }

    record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody,
               int line, int endLine) implements Stmt {

        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }
    }

    /** Function definition; parameters are kept as written. */
    record FunctionDef(String name, List<String> params, List<Stmt> body, List<Expr> decorators,
                       int line, int endLine) implements Stmt {

        public FunctionDef {
            params = List.copyOf(params);
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }
    }

    record ClassDef(String name, List<Expr> bases, List<Stmt> body, List<Expr> decorators,
                    int line, int endLine) implements Stmt {

        public ClassDef {
            bases = List.copyOf(bases);
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }
    }

    /** {@code return value}; value may be null. */
    record Return(Expr value, int line, int endLine) implements Stmt {
    }

    record Delete(List<Expr> targets, int line, int endLine) implements Stmt {

        public Delete {
            targets = List.copyOf(targets);
        }
    }

    /** {@code raise exc from cause}; both may be null. */
    record Raise(Expr exc, Expr cause, int line, int endLine) implements Stmt {
    }

    record Assert(Expr test, Expr message, int line, int endLine) implements Stmt {
    }

    /** {@code global} or {@code nonlocal} declaration. */
    record Global(List<String> names, boolean nonlocal, int line, int endLine) implements Stmt {

        public Global {
            names = List.copyOf(names);
        }
    }

    /** {@code pass}, {@code break} or {@code continue}. */
    record Simple(String keyword, int line, int endLine) implements Stmt {
    }
}
