package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.frontend.parser.ast.AnnAssignNode;
import org.tensorscript.compiler.frontend.parser.ast.AssignNode;
import org.tensorscript.compiler.frontend.parser.ast.AstNode;
import org.tensorscript.compiler.frontend.parser.ast.BreakNode;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;
import org.tensorscript.compiler.frontend.parser.ast.ForNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.IfNode;
import org.tensorscript.compiler.frontend.parser.ast.KeywordArg;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.ParameterNode;
import org.tensorscript.compiler.frontend.parser.ast.ReturnNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.parser.ast.TupleNode;
import org.tensorscript.compiler.frontend.parser.ast.WhileNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The default {@link LivenessOracle}: a backward live-variable analysis over one function.
 * <p>
 * {@link #analyze(FunctionDefNode)} records the live-out set of every statement, including the
 * statements of nested functions. Loops iterate to a fixpoint. Statements the analysis has not
 * seen report their own assigned names as live-out.
 */
public class LivenessAnalyzer implements LivenessOracle {

    private final Map<StmtNode, Set<String>> liveOut = new IdentityHashMap<>();

    /**
     * Runs the analysis on a function and its nested functions.
     * @param function The function definition.
     * @return This analyzer, for chaining.
     */
    public LivenessAnalyzer analyze(FunctionDefNode function) {
        liveBlock(function.body(), new LinkedHashSet<>());
        return this;
    }

    @Override
    public Set<String> liveOut(StmtNode statement) {
        Set<String> live = liveOut.get(statement);
        if (live == null) {
            return assignedNames(statement);
        }
        return Collections.unmodifiableSet(live);
    }

    @Override
    public Set<String> assignedNames(List<StmtNode> statements) {
        Set<String> result = new LinkedHashSet<>();
        for (StmtNode statement : statements) {
            collectAssigned(statement, result);
        }
        return result;
    }

    private void collectAssigned(StmtNode statement, Set<String> into) {
        if (statement instanceof AssignNode a) {
            a.targets().forEach(t -> into.addAll(lhsNames(t)));
        } else if (statement instanceof AnnAssignNode a) {
            into.add(a.target().id());
        } else if (statement instanceof IfNode i) {
            i.body().forEach(s -> collectAssigned(s, into));
            i.orelse().forEach(s -> collectAssigned(s, into));
        } else if (statement instanceof ForNode f) {
            into.addAll(lhsNames(f.target()));
            f.body().forEach(s -> collectAssigned(s, into));
        } else if (statement instanceof WhileNode w) {
            w.body().forEach(s -> collectAssigned(s, into));
        } else if (statement instanceof FunctionDefNode d) {
            into.add(d.name());
        }
    }

    @Override
    public Set<String> exposedUses(List<StmtNode> statements) {
        Set<String> live = new LinkedHashSet<>();
        for (int i = statements.size() - 1; i >= 0; i--) {
            live = exposed(statements.get(i), live);
        }
        return live;
    }

    private Set<String> exposed(StmtNode statement, Set<String> out) {
        if (statement instanceof AssignNode || statement instanceof AnnAssignNode
                || statement instanceof ReturnNode || statement instanceof IfNode) {
            return transfer(statement, out, false);
        }
        if (statement instanceof ForNode f) {
            Set<String> loopVars = lhsNames(f.target());
            Set<String> result = new LinkedHashSet<>(exposedUses(f.body()));
            result.removeAll(loopVars);
            result.addAll(used(f.iter()));
            Set<String> after = new LinkedHashSet<>(out);
            after.removeAll(loopVars);
            result.addAll(after);
            return result;
        }
        if (statement instanceof WhileNode w) {
            Set<String> result = new LinkedHashSet<>(exposedUses(w.body()));
            result.addAll(used(w.test()));
            result.addAll(out);
            return result;
        }
        if (statement instanceof FunctionDefNode d) {
            if (!out.contains(d.name())) return out;
            Set<String> result = new LinkedHashSet<>(out);
            result.remove(d.name());
            result.addAll(freeVariables(d));
            return result;
        }
        if (statement instanceof ExprStmtNode e && !e.isDocString() && !e.isPrintCall()) {
            Set<String> result = new LinkedHashSet<>(out);
            result.addAll(used(e.value()));
            return result;
        }
        return out;
    }

    @Override
    public Set<String> freeVariables(FunctionDefNode function) {
        Set<String> free = new LinkedHashSet<>(exposedUses(function.body()));
        function.parameters().stream().map(ParameterNode::name).forEach(free::remove);
        return free;
    }

    // --- backward pass recording live-out sets ---

    private Set<String> liveBlock(List<StmtNode> block, Set<String> out) {
        Set<String> live = out;
        for (int i = block.size() - 1; i >= 0; i--) {
            live = live(block.get(i), live);
        }
        return live;
    }

    private Set<String> live(StmtNode statement, Set<String> out) {
        liveOut.put(statement, out);
        if (statement instanceof ForNode f) {
            Set<String> loopVars = lhsNames(f.target());
            Set<String> previous = null;
            Set<String> current = new LinkedHashSet<>(out);
            while (!current.equals(previous)) {
                previous = current;
                Set<String> next = new LinkedHashSet<>(out);
                Set<String> bodyIn = new LinkedHashSet<>(liveBlock(f.body(), previous));
                bodyIn.removeAll(loopVars);
                next.addAll(bodyIn);
                current = next;
            }
            Set<String> result = new LinkedHashSet<>(current);
            result.addAll(used(f.iter()));
            return result;
        }
        if (statement instanceof WhileNode w) {
            Set<String> conditionVars = used(w.test());
            Set<String> previous = null;
            Set<String> current = new LinkedHashSet<>(out);
            current.addAll(conditionVars);
            while (!current.equals(previous)) {
                previous = current;
                Set<String> next = new LinkedHashSet<>(out);
                next.addAll(conditionVars);
                next.addAll(liveBlock(w.body(), previous));
                current = next;
            }
            return current;
        }
        if (statement instanceof FunctionDefNode d) {
            liveBlock(d.body(), new LinkedHashSet<>());
            Set<String> result = new LinkedHashSet<>(out);
            result.remove(d.name());
            result.addAll(freeVariables(d));
            return result;
        }
        if (statement instanceof BreakNode) {
            return out;
        }
        if (statement instanceof ExprStmtNode e) {
            if (e.isDocString() || e.isPrintCall()) return out;
            Set<String> result = new LinkedHashSet<>(out);
            result.addAll(used(e.value()));
            return result;
        }
        return transfer(statement, out, true);
    }

    // Shared by the recording pass and the exposed-uses pass for assignments, returns and conditionals.
    private Set<String> transfer(StmtNode statement, Set<String> out, boolean recording) {
        if (statement instanceof AssignNode a) {
            Set<String> result = new LinkedHashSet<>(out);
            a.targets().forEach(t -> result.removeAll(lhsNames(t)));
            result.addAll(used(a.value()));
            return result;
        }
        if (statement instanceof AnnAssignNode a) {
            Set<String> result = new LinkedHashSet<>(out);
            result.remove(a.target().id());
            result.addAll(used(a.value()));
            return result;
        }
        if (statement instanceof ReturnNode r) {
            return used(r.value());
        }
        if (statement instanceof IfNode i) {
            Set<String> result;
            if (recording) {
                result = new LinkedHashSet<>(liveBlock(i.body(), out));
                result.addAll(liveBlock(i.orelse(), out));
            } else {
                result = new LinkedHashSet<>(exposedBlock(i.body(), out));
                result.addAll(exposedBlock(i.orelse(), out));
            }
            result.addAll(used(i.test()));
            return result;
        }
        return out;
    }

    private Set<String> exposedBlock(List<StmtNode> block, Set<String> out) {
        Set<String> live = out;
        for (int i = block.size() - 1; i >= 0; i--) {
            live = exposed(block.get(i), live);
        }
        return live;
    }

    // --- helpers ---

    /**
     * @param expr An expression, or {@code null}.
     * @return The names the expression reads. The callee of a call is not a read.
     */
    static Set<String> used(ExprNode expr) {
        Set<String> result = new LinkedHashSet<>();
        collectUsed(expr, result);
        return result;
    }

    private static void collectUsed(AstNode node, Set<String> into) {
        if (node == null) return;
        if (node instanceof NameNode n) {
            into.add(n.id());
            return;
        }
        if (node instanceof CallNode call) {
            call.args().forEach(a -> collectUsed(a, into));
            for (KeywordArg keyword : call.keywords()) {
                if (keyword.value() instanceof NameNode n) into.add(n.id());
            }
            return;
        }
        for (AstNode child : node.getChildren()) {
            collectUsed(child, into);
        }
    }

    private static Set<String> lhsNames(ExprNode target) {
        Set<String> names = new LinkedHashSet<>();
        if (target instanceof NameNode n) {
            names.add(n.id());
        } else if (target instanceof TupleNode t) {
            t.elements().forEach(e -> names.addAll(lhsNames(e)));
        }
        return names;
    }
}
