package com.finance.calc.io;

import com.finance.calc.api.FinanceErrorKind;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CalculationRunnerTest {
    private final CalculationRunner runner = new CalculationRunner(
            Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC));

    @Test
    public void testRunResourceRequests() {
        List<CalculationResult> results = runner.runAll(runner.parseResource("requests.json"));
        assertEquals(4, results.size());

        CalculationResult pv = results.get(0);
        assertTrue(pv.isSuccess());
        assertEquals("PRESENT_VALUE", pv.getType());
        assertEquals(1000.0, (Double) pv.getValue(), 1e-9);

        CalculationResult noPayback = results.get(1);
        assertTrue(noPayback.isSuccess());
        assertNull(noPayback.getValue());

        CalculationResult zeroDiv = results.get(2);
        assertFalse(zeroDiv.isSuccess());
        assertEquals(FinanceErrorKind.DIVISION_BY_ZERO, zeroDiv.getErrorKind());
        assertNull(zeroDiv.getValue());

        @SuppressWarnings("unchecked")
        Map<String, Object> mortgage = (Map<String, Object>) results.get(3).getValue();
        assertEquals(1013.37, (Double) mortgage.get("monthlyPayment"), 0.01);
        assertEquals("2054-01-15", mortgage.get("payoffDate"));
    }

    @Test
    public void testFailedResultCarriesField() {
        CalculationResult r = runner.run(new CalculationRequest("bad", "present_value",
                Map.of("futureValue", 1000, "rate", 1.5, "time", 2)));
        assertFalse(r.isSuccess());
        assertEquals(FinanceErrorKind.INVALID_INPUT, r.getErrorKind());
        assertEquals("Discount rate", r.getErrorField());
        assertNotNull(r.getMessage());
    }

    @Test
    public void testLimitsOverride() {
        String json = "[{\"id\":\"a\",\"type\":\"compound_interest\","
                + "\"params\":{\"principal\":1000,\"rate\":0.05,\"frequency\":12,\"years\":30}},"
                + "{\"id\":\"b\",\"type\":\"compound_interest\","
                + "\"params\":{\"principal\":1000,\"rate\":0.05,\"frequency\":12,\"years\":30},"
                + "\"limits\":{\"maxExponent\":400}}]";
        List<CalculationResult> results = runner.runAll(runner.parse(json));

        assertFalse(results.get(0).isSuccess());
        assertEquals(FinanceErrorKind.INVALID_INPUT, results.get(0).getErrorKind());
        assertTrue(results.get(1).isSuccess());
        assertEquals(1000 * Math.pow(1 + 0.05 / 12, 360), (Double) results.get(1).getValue(), 1e-6);
    }

    @Test
    public void testArrayAndIntegerParameters() {
        CalculationResult irr = runner.run(new CalculationRequest("irr", "irr",
                Map.of("initialInvestment", 1000, "cashFlows", List.of(300, 400, 500, 600))));
        assertEquals(0.248883, (Double) irr.getValue(), 1e-6);

        CalculationResult mean = runner.run(new CalculationRequest("m", "mean",
                Map.of("numbers", List.of(1, "2", 3.0))));
        assertEquals(2.0, (Double) mean.getValue(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownType() {
        runner.run(new CalculationRequest("x", "black_scholes", Map.of()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingParameter() {
        runner.run(new CalculationRequest("x", "simple_interest", Map.of("principal", 1000, "rate", 0.05)));
    }

    @Test
    public void testNonIntegerCountRejected() {
        try {
            runner.run(new CalculationRequest("x", "depreciation",
                    Map.of("cost", 10000, "usefulLifeYears", 4.5)));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("usefulLifeYears"));
        }
    }

    @Test
    public void testNullArrayElementRejected() {
        List<CalculationRequest> requests = runner.parse(
                "[{\"id\":\"m\",\"type\":\"mean\",\"params\":{\"numbers\":[1.0, null, 3.0]}}]");
        try {
            runner.run(requests.get(0));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("numbers[1]"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        runner.parse("[{\"id\": ");
    }

    @Test
    public void testToJson() {
        CalculationResult ok = runner.run(new CalculationRequest("si", "simple_interest",
                Map.of("principal", 1000, "rate", 0.05, "time", 2)));
        String json = runner.toJson(ok);
        assertTrue(json, json.contains("\"id\":\"si\""));
        assertTrue(json, json.contains("\"success\":true"));
        assertTrue(json, json.contains("\"value\":100.0"));
        assertFalse(json, json.contains("errorKind"));

        CalculationResult failed = runner.run(new CalculationRequest("p", "probability",
                Map.of("successes", 0, "trials", 0)));
        String failedJson = runner.toJson(failed);
        assertTrue(failedJson, failedJson.contains("\"errorKind\":\"DIVISION_BY_ZERO\""));
        assertFalse(failedJson, failedJson.contains("\"value\""));
    }

    @Test
    public void testNoAnswerOmitsValue() {
        CalculationResult noPayback = runner.run(new CalculationRequest("pb", "payback_period",
                Map.of("initialCost", 1000, "cashFlows", List.of(100, 100))));
        String json = runner.toJson(noPayback);
        assertTrue(json, json.contains("\"success\":true"));
        assertFalse(json, json.contains("\"value\""));

        CalculationResult noMode = runner.run(new CalculationRequest("md", "mode",
                Map.of("numbers", List.of(1, 2, 3))));
        assertTrue(noMode.isSuccess());
        assertFalse(runner.toJson(noMode).contains("\"value\""));
    }

    @Test
    public void testBundledSampleRequests() {
        List<CalculationRequest> requests = runner.parseResource("sample_requests.json");
        List<CalculationResult> results = runner.runAll(requests);
        assertEquals(requests.size(), results.size());

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        assertEquals(1, failed);
        assertEquals("bad-rate", results.get(results.size() - 1).getId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() {
        runner.parseResource("no_such_file.json");
    }
}
