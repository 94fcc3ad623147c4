package model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormatsTest {

    @Test
    void numbersAbbreviate() {
        assertEquals("999", Formats.number(999.7));
        assertEquals("1.5K", Formats.number(1500));
        assertEquals("2.50M", Formats.number(2_500_000));
        assertEquals("3.00B", Formats.number(3e9));
    }

    @Test
    void durationsPickTheLargestUnits() {
        assertEquals("45s", Formats.duration(45));
        assertEquals("2m 5s", Formats.duration(125));
        assertEquals("1h 30m", Formats.duration(5400));
    }

    @Test
    void karmaLabels() {
        assertEquals("Neutral", Formats.karmaLabel(0));
        assertEquals("Wicked", Formats.karmaLabel(-100));
        assertEquals("Saint", Formats.karmaLabel(1000));
    }

    @Test
    void logsAreCappedNewestFirst() {
        GameState s = new GameState();
        SimulationContext ctx = TestStates.ctx(ScriptedDice.quiet());
        for (int i = 0; i < EventLog.CAP + 5; i++) EventLog.info(s, ctx, "line " + i);
        assertEquals(EventLog.CAP, s.getLog().size());
        assertEquals("line " + (EventLog.CAP + 4), s.getLog().get(0).text());
    }
}
