package com.finance.calc;

import java.nio.file.Path;
import java.util.List;

import com.finance.calc.io.CalculationRequest;
import com.finance.calc.io.CalculationResult;
import com.finance.calc.io.CalculationRunner;
import com.finance.calc.loan.AmortizationPayment;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a batch of JSON calculation requests and logs each result.
 * <p>
 * Usage: {@code FinanceCalcDemo [requests.json]}. Without an argument the
 * bundled {@code sample_requests.json} is used.
 */
public class FinanceCalcDemo {
    private static final Logger log = LogManager.getLogger(FinanceCalcDemo.class);

    public static void main(String[] args) throws Exception {
        log.info("════════════════════════════════════════════════");
        log.info("  Financial Calculation Demo");
        log.info("════════════════════════════════════════════════");

        var runner = new CalculationRunner();
        List<CalculationRequest> requests = args.length > 0
                ? runner.parseFile(Path.of(args[0]))
                : runner.parseResource("sample_requests.json");

        int failures = 0;
        for (CalculationResult result : runner.runAll(requests)) {
            String label = result.getId() != null ? result.getId() : result.getType();
            if (!result.isSuccess()) {
                failures++;
                log.error("{}: {} [{}] {}", label, result.getErrorKind(), result.getErrorField(),
                        result.getMessage());
            } else if (result.getValue() instanceof List<?> rows) {
                logRows(label, rows);
            } else if (result.getValue() == null) {
                log.info("{}: no result", label);
            } else {
                log.info("{}: {}", label, result.getValue());
            }
        }

        log.info("Done. {} requests, {} failed", requests.size(), failures);
    }

    // First row, every 12th row and the last row, as an amortization table would show.
    private static void logRows(String label, List<?> rows) {
        log.info("{}: {} rows", label, rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object row = rows.get(i);
            int n = i + 1;
            if (row instanceof AmortizationPayment p && !(n == 1 || n % 12 == 0 || n == rows.size()))
                continue;
            log.info("  {}", row);
        }
    }
}
