package Engine;

import Engine.Expr.*;
import init.Config;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the symbolic execution tree of a program by exploring every path.
 * Blocks are flattened into the pending queue and never show up as nodes;
 * every {@code if} forks into a then-path and an else-path.
 */
public class ExecTreeBuilder {

    private final int maxDepth;

    public ExecTreeBuilder() {
        this(Config.maxTreeDepth);
    }

    public ExecTreeBuilder(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * @return the root node, or {@code null} if the program has no statements to execute
     */
    public ExecTreeNode build(Expr program) {
        long startTime = System.currentTimeMillis();
        Deque<Expr> queue = new ArrayDeque<>();
        queue.addFirst(program);
        ExecTreeNode root = build(queue, SimState.initial(program), 0);
        if (root != null) {
            Log.debug("Execution tree: " + root.size() + " nodes, " + root.pathCount() + " paths");
        }
        Log.printTime("[+] Tree built", startTime);
        return root;
    }

    private ExecTreeNode build(Deque<Expr> queue, SimState state, int depth) {
        // splice blocks into the queue first, they are transparent in the tree
        while (queue.peekFirst() instanceof Block block) {
            queue.removeFirst();
            List<Expr> stmts = block.statements();
            for (int i = stmts.size() - 1; i >= 0; i--) {
                queue.addFirst(stmts.get(i));
            }
        }
        if (queue.isEmpty()) {
            return null;
        }
        if (depth >= maxDepth) {
            throw new AnalysisException(AnalysisException.Kind.DEPTH_LIMIT,
                    "Execution tree deeper than " + maxDepth + " statements");
        }

        Expr stmt = queue.removeFirst();

        /*   ------------------------------------------------   */
        /*                         Let                          */
        /*   ------------------------------------------------   */

        if (stmt instanceof Let let) {
            // evaluate on a copy, the node keeps the store as it was before the binding
            Expr value = PartialEvaluator.evaluate(let.value(), state.copy().getStore());
            if (value == null) {
                throw AnalysisException.missingValue(let.value());
            }
            ExecTreeNode child = build(queue, state.withBinding(let.target(), value), depth + 1);
            return new ExecTreeNode(childList(child), stmt, state);
        }

        /*   ------------------------------------------------   */
        /*                          If                          */
        /*   ------------------------------------------------   */

        if (stmt instanceof If ifStmt) {
            Expr cond = PartialEvaluator.evaluate(ifStmt.condition(), state.copy().getStore());
            if (!Expression.isComparison(cond)) {
                throw AnalysisException.invalidCondition(cond != null ? cond : ifStmt.condition());
            }

            Log.debug("|- If, condition [TRUE]: " + cond);
            Deque<Expr> thenQueue = new ArrayDeque<>(queue);
            thenQueue.addFirst(ifStmt.thenBranch());
            ExecTreeNode childTrue = build(thenQueue, state.withConstraint(cond), depth + 1);

            Expr negated = Expression.negate(cond);
            Log.debug("|- If, condition [FALSE]: " + negated);
            Deque<Expr> elseQueue = new ArrayDeque<>(queue);
            if (ifStmt.hasElse()) {
                elseQueue.addFirst(ifStmt.elseBranch());
            }
            ExecTreeNode childFalse = build(elseQueue, state.withConstraint(negated), depth + 1);

            List<ExecTreeNode> children = childList(childTrue);
            if (childFalse != null) {
                children.add(childFalse);
            }
            return new ExecTreeNode(children, stmt, state);
        }

        // asserts and plain expressions: nothing to bind, nothing to fork
        ExecTreeNode child = build(queue, state, depth + 1);
        return new ExecTreeNode(childList(child), stmt, state);
    }

    private static List<ExecTreeNode> childList(ExecTreeNode child) {
        List<ExecTreeNode> children = new ArrayList<>(2);
        if (child != null) {
            children.add(child);
        }
        return children;
    }
}
