package Engine;

import Engine.Expr.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of one path. The store and constraints are the ones in effect before
 * {@link #getStatement()} executes. Read-only once built.
 */
public class ExecTreeNode {
    private final List<ExecTreeNode> children;
    private final Expr statement;
    private final Map<Var, Expr> store;
    private final List<Expr> constraints;

    public ExecTreeNode(List<ExecTreeNode> children, Expr statement, SimState state) {
        this.children = List.copyOf(children);
        this.statement = statement;
        this.store = Collections.unmodifiableMap(new LinkedHashMap<>(state.getStore()));
        this.constraints = List.copyOf(state.getConstraints());
    }

    public List<ExecTreeNode> getChildren() {
        return children;
    }

    public Expr getStatement() {
        return statement;
    }

    public Map<Var, Expr> getStore() {
        return store;
    }

    public List<Expr> getConstraints() {
        return constraints;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public List<ExecTreeNode> leaves() {
        List<ExecTreeNode> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    private static void collectLeaves(ExecTreeNode node, List<ExecTreeNode> leaves) {
        if (node.isLeaf()) {
            leaves.add(node);
            return;
        }
        for (ExecTreeNode child : node.children) {
            collectLeaves(child, leaves);
        }
    }

    public int pathCount() {
        return leaves().size();
    }

    public int size() {
        int size = 1;
        for (ExecTreeNode child : children) {
            size += child.size();
        }
        return size;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int indent) {
        String pad = " ".repeat(indent);
        sb.append(pad).append("σ: ").append(store).append('\n');
        sb.append(pad).append("π: ").append(constraints).append('\n');
        sb.append(pad).append("Next Expression: ").append(statement.toShortString()).append('\n');
        for (ExecTreeNode child : children) {
            child.render(sb, indent + 2);
        }
    }
}
