package com.quantbacktest.portfolio.domain;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Verdict of an accounting verification: passes when no issue is an error.
 */
@Value
public class AccountingReport {

    boolean pass;
    List<AccountingIssue> issues;
    List<SymbolReconciliation> symbols;
    /** Number of equity-curve rows that were reconstructed from the logs. */
    int samplesChecked;

    public long errorCount() {
        return issues.stream().filter(AccountingIssue::isError).count();
    }

    public long warningCount() {
        return issues.size() - errorCount();
    }

    public List<AccountingIssue> issuesWith(AccountingIssue.IssueCode code) {
        return issues.stream().filter(issue -> issue.getCode() == code).collect(Collectors.toList());
    }
}
