package Engine;

import Engine.Expr.Assert;
import utils.Log;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class ConstraintExtractor {

    /**
     * Collects one obligation per assertion node, depth first with the then-path before the else-path.
     * An assertion does not stop the walk; everything below it is visited too.
     */
    public static List<Obligation> collectObligations(ExecTreeNode root) {
        List<Obligation> obligations = new ArrayList<>();
        if (root != null) {
            collect(root, obligations);
        }
        Log.debug("Collected " + obligations.size() + " obligations");
        return obligations;
    }

    private static void collect(ExecTreeNode node, List<Obligation> obligations) {
        if (node.getStatement() instanceof Assert assertion) {
            // the node store is read-only, evaluate against a copy
            Assert evaluated = (Assert) PartialEvaluator.evaluate(assertion, new LinkedHashMap<>(node.getStore()));
            obligations.add(new Obligation(evaluated, node.getConstraints()));
        }
        for (ExecTreeNode child : node.getChildren()) {
            collect(child, obligations);
        }
    }
}
