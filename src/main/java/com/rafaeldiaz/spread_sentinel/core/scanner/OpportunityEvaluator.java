package com.rafaeldiaz.spread_sentinel.core.scanner;

import com.rafaeldiaz.spread_sentinel.core.analysis.ProfitCalculator;
import com.rafaeldiaz.spread_sentinel.model.ArbitrageAnalysis;
import com.rafaeldiaz.spread_sentinel.model.Direction;
import com.rafaeldiaz.spread_sentinel.model.ExecutionPlan;
import com.rafaeldiaz.spread_sentinel.model.ProfitEstimate;
import com.rafaeldiaz.spread_sentinel.model.Quote;

import java.util.Optional;

/**
 * 🧠 EVALUADOR DE OPORTUNIDADES
 * Dadas las dos cotizaciones decide: nada, o comprar barato / vender caro en UN solo sentido.
 * A->B se evalúa primero; si ambos superan el umbral (cotizaciones inconsistentes) gana A->B.
 * Sin estado: no reintenta ni controla la cadencia.
 */
public class OpportunityEvaluator {

    private final ProfitCalculator calculator;
    private final double thresholdPercent;
    private final double feeRate;

    public OpportunityEvaluator(ProfitCalculator calculator, double thresholdPercent, double feeRate) {
        this.calculator = calculator;
        this.thresholdPercent = thresholdPercent;
        this.feeRate = feeRate;
    }

    public Optional<ExecutionPlan> evaluate(Quote quoteA, Quote quoteB) {
        return analyze(quoteA, quoteB).opportunity();
    }

    public ArbitrageAnalysis analyze(Quote quoteA, Quote quoteB) {
        ProfitEstimate aToB = calculator.profitAfterFees(Direction.A_TO_B, quoteA.ask(), quoteB.bid(), feeRate);
        ProfitEstimate bToA = calculator.profitAfterFees(Direction.B_TO_A, quoteB.ask(), quoteA.bid(), feeRate);

        ExecutionPlan plan = null;
        if (aToB.netProfitPercent() > thresholdPercent) {
            plan = new ExecutionPlan(aToB, quoteA.venue(), quoteA.ask(), quoteB.venue(), quoteB.bid());
        } else if (bToA.netProfitPercent() > thresholdPercent) {
            plan = new ExecutionPlan(bToA, quoteB.venue(), quoteB.ask(), quoteA.venue(), quoteA.bid());
        }
        return new ArbitrageAnalysis(quoteA, quoteB, aToB, bToA, plan);
    }

    public double thresholdPercent() {
        return thresholdPercent;
    }
}
