package com.psiscript.backend.pulse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("DurationParser 测试")
class DurationParserTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("单位换算为纳秒")
    void testUnits() {
        assertEquals(20.0, DurationParser.parse("20ns"), EPS);
        assertEquals(5000.0, DurationParser.parse("5us"), EPS);
        assertEquals(1.5e6, DurationParser.parse("1.5ms"), EPS);
        assertEquals(2e9, DurationParser.parse("2s"), EPS);
        assertEquals(1.0, DurationParser.parse("1e3ps"), EPS);
        assertEquals(0.5, DurationParser.parse("500000fs"), EPS);
    }

    @Test
    @DisplayName("dt 按 1 计")
    void testDt() {
        assertEquals(3.0, DurationParser.parse("3dt"), EPS);
    }

    @Test
    @DisplayName("单位大小写不敏感，允许空白")
    void testCaseAndWhitespace() {
        assertEquals(2.0, DurationParser.parse(" 2 NS "), EPS);
        assertEquals(4000.0, DurationParser.parse("4US"), EPS);
    }

    @Test
    @DisplayName("无单位视为纳秒，未知单位乘 1")
    void testMissingAndUnknownUnit() {
        assertEquals(7.0, DurationParser.parse("7"), EPS);
        assertEquals(4.0, DurationParser.parse("4cycles"), EPS);
    }

    @Test
    @DisplayName("空文本与无法解析的文本为 0")
    void testEmpty() {
        assertEquals(0.0, DurationParser.parse(""), EPS);
        assertEquals(0.0, DurationParser.parse(null), EPS);
        assertEquals(0.0, DurationParser.parse("long"), EPS);
    }
}
