package com.monolith.maven.template.ast;

import java.util.List;
import java.util.Map;

import com.monolith.maven.template.eval.ConditionEvaluator;

/**
 * A conditional group: the {@code if} branch, any {@code elseif} branches and an optional
 * {@code else} branch, in source order.
 * <p>
 * Only the body of the first branch whose condition holds is rendered. Without a match
 * and without an {@code else} the group renders nothing.
 * <p>
 * Conditions always resolve against the root context, also inside a loop body; the
 * selected body renders in the scope the group appears in.
 */
public class IfNode implements Node {

    /**
     * One branch of a conditional group. The {@code else} branch has no condition.
     */
    public static class Branch {
        private final String condition;
        private final List<Node> body;

        public Branch(String condition, List<Node> body) {
            this.condition = condition;
            this.body = List.copyOf(body);
        }

        public String getCondition() {
            return condition;
        }

        public List<Node> getBody() {
            return body;
        }

        public boolean isElse() {
            return condition == null;
        }
    }

    private final List<Branch> branches;

    public IfNode(List<Branch> branches) {
        this.branches = List.copyOf(branches);
    }

    public List<Branch> getBranches() {
        return branches;
    }

    @Override
    public void render(StringBuilder out, Map<String, Object> root, Map<String, Object> scope) {
        for (Branch branch : branches) {
            if (branch.isElse() || ConditionEvaluator.evaluate(branch.getCondition(), root)) {
                for (Node node : branch.getBody()) {
                    node.render(out, root, scope);
                }
                return;
            }
        }
    }
}
