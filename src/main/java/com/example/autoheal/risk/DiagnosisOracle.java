package com.example.autoheal.risk;

import com.example.autoheal.domain.Issue;

/**
 * Root-cause and risk oracle. Implementations may be slow, may throw, and may
 * return anything; the classifier treats every answer as untrusted.
 */
public interface DiagnosisOracle {

    /** False when the oracle is not configured; the classifier then skips the call */
    boolean isAvailable();

    Diagnosis diagnose(Issue issue);
}
