package com.lendingledger.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rules engine that evaluates all borrow rules against a borrow attempt.
 *
 * Rules are evaluated in their {@code @Order}, and the first rule that declines
 * decides the outcome; later rules are not consulted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BorrowRulesEngine {

    private final List<BorrowRule> rules;

    /**
     * Evaluate all rules against a borrow attempt.
     *
     * @param context the borrow attempt to evaluate
     * @return the first decline, or an approval if every rule approved
     */
    public RuleResult evaluateRules(BorrowContext context) {
        log.debug("Evaluating {} rules for borrow of {}", rules.size(), context.key());

        for (BorrowRule rule : rules) {
            RuleResult result = rule.evaluate(context);

            if (!result.isApproved()) {
                log.info("Rule {} declined borrow of {}: {}", rule.getRuleName(), context.key(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        log.debug("All rules approved borrow of {}", context.key());
        return RuleResult.approve();
    }

    /**
     * Evaluate all rules and throw the first decline as its exception type.
     */
    public void requireApproval(BorrowContext context) {
        RuleResult result = evaluateRules(context);
        if (!result.isApproved()) {
            throw result.toException();
        }
    }
}
