package edu.harvard.hms.dbmi.avillach.kinetics.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentFormatExceptionTest {

    @Test
    void shouldDescribeInconsistentSeries() {
        InconsistentSeriesLengthException exception = new InconsistentSeriesLengthException("volume", 97, 50);

        assertEquals("volume", exception.getSeries());
        assertEquals(97, exception.getLength());
        assertEquals(50, exception.getExpectedLength());
        assertTrue(exception.getMessage().contains("\"volume\" has 97 values"));
        assertTrue(exception.getMessage().contains("50 data points"));
    }

    @Test
    void shouldNameMissingProperty() {
        MissingRequiredPropertyException exception = new MissingRequiredPropertyException("pressure", "shock tube");

        assertEquals("pressure", exception.getProperty());
        assertEquals("Required property \"pressure\" is missing for shock tube experiment", exception.getMessage());
    }

    @Test
    void shouldBeCatchableAsFormatException() {
        RuntimeException cause = new NumberFormatException("abc");
        ExperimentFormatException exception = assertThrows(ExperimentFormatException.class, () -> {
            throw new MissingIgnitionDefinitionException("bad amount", cause);
        });

        assertInstanceOf(MissingIgnitionDefinitionException.class, exception);
        assertSame(cause, exception.getCause());
        assertTrue(new UnrecognizedExperimentKindException("flow reactor").getMessage().contains("\"flow reactor\""));
    }
}
