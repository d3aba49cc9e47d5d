package com.statecheck.check;

import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EqualsTest {

    @Test
    void exactMatchPasses() {
        Equals equals = new Equals();
        equals.setValue("OPEN");
        assertEquals(Severity.SUCCESS, equals.compare("OPEN", "valve.state").getSeverity());
    }

    @Test
    void mismatchReportsFailureSeverity() {
        Equals equals = new Equals();
        equals.setValue(1);
        equals.setSeverityOnFailure(Severity.WARNING);
        Result result = equals.compare(2, "m1.setpoint");
        assertEquals(Severity.WARNING, result.getSeverity());
    }

    @Test
    void numbersCompareWithinTolerance() {
        Equals equals = new Equals();
        equals.setValue(10.0);
        equals.setAtol(0.5);
        assertEquals(Severity.SUCCESS, equals.compare(10.4, "x").getSeverity());
        assertEquals(Severity.ERROR, equals.compare(10.6, "x").getSeverity());

        equals.setAtol(null);
        equals.setRtol(0.1);
        assertEquals(Severity.SUCCESS, equals.compare(10.9, "x").getSeverity());
        assertEquals(Severity.SUCCESS, equals.compare(9, "x").getSeverity());
    }

    @Test
    void integerAndDoubleCompareNumerically() {
        Equals equals = new Equals();
        equals.setValue(3);
        assertEquals(Severity.SUCCESS, equals.compare(3.0, "x").getSeverity());
    }

    @Test
    void invertNegates() {
        Equals equals = new Equals();
        equals.setValue(0);
        equals.setInvert(true);
        assertEquals(Severity.ERROR, equals.compare(0, "x").getSeverity());
        assertEquals(Severity.SUCCESS, equals.compare(1, "x").getSeverity());
    }
}
