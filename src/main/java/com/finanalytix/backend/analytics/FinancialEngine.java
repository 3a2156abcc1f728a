package com.finanalytix.backend.analytics;

/**
 * Computes ratios, tax projections and scenarios for a business.
 *
 * <p>The import pipeline never calls this. Services that combine bank-derived cash flow with
 * accounting data feed it a {@link CashFlowSnapshot}.
 */
public interface FinancialEngine {

    FinancialAnalysis analyze(CashFlowSnapshot snapshot);
}
