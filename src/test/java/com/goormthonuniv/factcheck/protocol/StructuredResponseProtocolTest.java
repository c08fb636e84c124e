package com.goormthonuniv.factcheck.protocol;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StructuredResponseProtocolTest {

    private final StructuredResponseProtocol protocol = new StructuredResponseProtocol();

    static String reply(String confidence, String score) {
        return """
                <RESOURCE_ANALYSIS>
                1. IPCC AR6 - VERY HIGH TRUST
                </RESOURCE_ANALYSIS>

                <TRUTH_ANALYSIS>
                Strongly supported.
                </TRUTH_ANALYSIS>

                <CONFIDENCE>
                %s
                </CONFIDENCE>

                <SCORE>
                %s
                </SCORE>
                """.formatted(confidence, score);
    }

    @Test
    void parse_extractsAllFourSections() {
        ParseResult result = protocol.parse(reply("90", "85"));

        ParseResult.Success success = assertInstanceOf(ParseResult.Success.class, result);
        StructuredResult r = success.result();
        assertEquals("1. IPCC AR6 - VERY HIGH TRUST", r.resourceAnalysis());
        assertEquals("Strongly supported.", r.truthAnalysis());
        assertEquals(90, r.confidence());
        assertEquals(85, r.score());
    }

    @Test
    void parse_isCaseInsensitive() {
        String reply = "<resource_analysis>a</resource_analysis><Truth_Analysis>b</Truth_Analysis>"
                + "<confidence>0</confidence><score>100</score>";

        ParseResult.Success success = assertInstanceOf(ParseResult.Success.class, protocol.parse(reply));
        assertEquals(0, success.result().confidence());
        assertEquals(100, success.result().score());
    }

    @Test
    void parse_reportsOnlyTheMissingTag() {
        String reply = reply("90", "85").replaceAll("(?s)<CONFIDENCE>.*</CONFIDENCE>", "");

        ParseResult.MissingTags missing = assertInstanceOf(ParseResult.MissingTags.class, protocol.parse(reply));
        assertEquals(Set.of(ResponseTag.CONFIDENCE), missing.missing());

        String message = protocol.describeFailure(missing, "model-a");
        assertTrue(message.contains("Missing tags [CONFIDENCE]"), message);
        assertTrue(message.contains("model-a"));
    }

    @Test
    void parse_reportsEveryMissingTagWithResponseSample() {
        String reply = "Sure! Here is my analysis:\n<TRUTH_ANALYSIS>fine</TRUTH_ANALYSIS>";

        ParseResult.MissingTags missing = assertInstanceOf(ParseResult.MissingTags.class, protocol.parse(reply));
        assertEquals(Set.of(ResponseTag.RESOURCE_ANALYSIS, ResponseTag.CONFIDENCE, ResponseTag.SCORE), missing.missing());
        assertFalse(missing.responseSample().contains("\n"));
        assertTrue(missing.responseSample().startsWith("Sure! Here is my analysis:"));

        String message = protocol.describeFailure(missing, "m");
        assertTrue(message.contains("[RESOURCE_ANALYSIS, CONFIDENCE, SCORE]"), message);
    }

    @Test
    void parse_truncatesResponseSample() {
        String reply = "x".repeat(1000);

        ParseResult.MissingTags missing = assertInstanceOf(ParseResult.MissingTags.class, protocol.parse(reply));
        assertEquals(StructuredResponseProtocol.RESPONSE_SAMPLE_LENGTH, missing.responseSample().length());
    }

    @Test
    void parse_unclosedTagCountsAsMissing() {
        String reply = reply("90", "85").replace("</SCORE>", "");

        ParseResult.MissingTags missing = assertInstanceOf(ParseResult.MissingTags.class, protocol.parse(reply));
        assertEquals(Set.of(ResponseTag.SCORE), missing.missing());
    }

    @ParameterizedTest
    @ValueSource(strings = {"101", "-1", "150", "abc", "85.5", ""})
    void parse_rejectsInvalidScore(String score) {
        ParseResult.RangeInvalid invalid = assertInstanceOf(ParseResult.RangeInvalid.class, protocol.parse(reply("50", score)));
        assertEquals(ResponseTag.SCORE, invalid.field());
        assertEquals(score, invalid.value());
    }

    @Test
    void parse_rejectsOutOfRangeConfidenceWithoutClamping() {
        ParseResult.RangeInvalid invalid = assertInstanceOf(ParseResult.RangeInvalid.class, protocol.parse(reply("200", "50")));
        assertEquals(ResponseTag.CONFIDENCE, invalid.field());
        assertEquals("Invalid confidence score from m: 200", protocol.describeFailure(invalid, "m"));
    }

    @Test
    void parse_acceptsBoundaryValues() {
        assertInstanceOf(ParseResult.Success.class, protocol.parse(reply("0", "0")));
        assertInstanceOf(ParseResult.Success.class, protocol.parse(reply("100", "100")));
    }

    @Test
    void structuredResult_cannotBeBuiltOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new StructuredResult("a", "b", 101, 50));
        assertThrows(IllegalArgumentException.class, () -> new StructuredResult("a", "b", 50, -1));
    }
}
