package com.lendingledger.rules;

/**
 * One precondition of a borrow.
 *
 * Rules are Spring components ordered with {@link org.springframework.core.annotation.Order};
 * the first rule to decline decides the error reported to the borrower.
 */
public interface BorrowRule {

    /**
     * Evaluate the rule against a borrow attempt.
     *
     * @param context the borrow attempt to evaluate
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(BorrowContext context);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
