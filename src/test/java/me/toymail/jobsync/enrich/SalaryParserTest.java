package me.toymail.jobsync.enrich;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SalaryParserTest {

    @Test
    public void testStructuredRange() {
        SalaryParser.Salary s = SalaryParser.parse("$120,000.00/yr - $163,000.00/yr").orElseThrow();

        assertEquals(120_000, s.min());
        assertEquals(163_000, s.max());
        assertEquals("Yearly", s.wageType());
    }

    @Test
    public void testThousandsRange() {
        SalaryParser.Salary s = SalaryParser.parse("$120-130K").orElseThrow();

        assertEquals(120_000, s.min());
        assertEquals(130_000, s.max());
    }

    @Test
    public void testSingleValueSetsBothBounds() {
        SalaryParser.Salary k = SalaryParser.parse("$130K").orElseThrow();
        assertEquals(130_000, k.min());
        assertEquals(130_000, k.max());

        SalaryParser.Salary monthly = SalaryParser.parse("$5,000 per month").orElseThrow();
        assertEquals(5_000, monthly.min());
        assertEquals(5_000, monthly.max());
        assertEquals("Monthly", monthly.wageType());
    }

    @Test
    public void testHourly() {
        SalaryParser.Salary s = SalaryParser.parse("$25 - $35 an hour").orElseThrow();

        assertEquals(25, s.min());
        assertEquals(35, s.max());
        assertEquals("Hourly", s.wageType());
    }

    @Test
    public void testNoSalary() {
        assertEquals(Optional.empty(), SalaryParser.parse("Competitive"));
        assertEquals(Optional.empty(), SalaryParser.parse(null));
    }

    @Test
    public void testFindInText_LongestMatch() {
        assertEquals(Optional.of("$90,000 - $110,000 per year"),
                SalaryParser.findInText("Pay: $90,000 - $110,000 per year plus a $5 lunch stipend"));
        assertEquals(Optional.of("$120,000.00/yr - $163,000.00/yr"),
                SalaryParser.findInText("Base pay $120,000.00/yr - $163,000.00/yr."));
        assertEquals(Optional.empty(), SalaryParser.findInText("No numbers here"));
    }
}
