package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Account;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per-run state shared by the extractors of one batch.
 * <p>
 * Holds the optional account lookup, the description vectorizer (supplied by the caller
 * or fitted during the run) and any warnings raised while extracting.
 */
public class ExtractionContext {

    private final Map<String, Account> accountsById;
    private TfidfVectorizer vectorizer;
    private final List<String> warnings = new ArrayList<>();

    public ExtractionContext(Map<String, Account> accountsById, TfidfVectorizer vectorizer) {
        this.accountsById = accountsById;
        this.vectorizer = vectorizer;
    }

    public static ExtractionContext withoutAccounts() {
        return new ExtractionContext(null, null);
    }

    public boolean hasAccounts() {
        return accountsById != null;
    }

    public Map<String, Account> getAccountsById() {
        return accountsById == null ? Collections.emptyMap() : accountsById;
    }

    public Account accountFor(String accountId) {
        return accountId == null ? null : getAccountsById().get(accountId);
    }

    public TfidfVectorizer getVectorizer() {
        return vectorizer;
    }

    void setVectorizer(TfidfVectorizer vectorizer) {
        this.vectorizer = vectorizer;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
