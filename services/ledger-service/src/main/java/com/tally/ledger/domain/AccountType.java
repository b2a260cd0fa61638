package com.tally.ledger.domain;

public enum AccountType {
    ASSET("Asset", NormalBalance.DEBIT, true),
    LIABILITY("Liability", NormalBalance.CREDIT, true),
    EQUITY("Equity", NormalBalance.CREDIT, true),
    REVENUE("Revenue", NormalBalance.CREDIT, false),
    EXPENSE("Expense", NormalBalance.DEBIT, false);

    private final String displayName;
    private final NormalBalance normalBalance;
    private final boolean balanceSheet;

    AccountType(String displayName, NormalBalance normalBalance, boolean balanceSheet) {
        this.displayName = displayName;
        this.normalBalance = normalBalance;
        this.balanceSheet = balanceSheet;
    }

    public String getDisplayName() {
        return displayName;
    }

    public NormalBalance getNormalBalance() {
        return normalBalance;
    }

    /**
     * Balance-sheet accounts carry forward across fiscal years; income accounts are closed.
     */
    public boolean isBalanceSheet() {
        return balanceSheet;
    }
}
