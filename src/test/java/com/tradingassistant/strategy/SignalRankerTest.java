package com.tradingassistant.strategy;

import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.model.Signal;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalRankerTest {

    @Test
    void rank_shouldOrderByCompositeDescending() {
        SignalRanker ranker = new SignalRanker(PipelineSettings.defaults());
        List<Signal> ranked = ranker.rank(List.of(
                signal("A", 60, 30),
                signal("B", 90, 30),
                signal("C", 75, 30)
        ));
        assertEquals(List.of("B", "C", "A"), tickers(ranked));
    }

    @Test
    void rank_shouldKeepInputOrderForEqualComposites() {
        SignalRanker ranker = new SignalRanker(PipelineSettings.defaults());
        List<Signal> ranked = ranker.rank(List.of(
                signal("FIRST", 70, 30),
                signal("TOP", 80, 30),
                signal("SECOND", 70, 30),
                signal("THIRD", 70, 30)
        ));
        assertEquals(List.of("TOP", "FIRST", "SECOND", "THIRD"), tickers(ranked));
    }

    @Test
    void rank_shouldDropLowScoreAndHighRisk() {
        SignalRanker ranker = new SignalRanker(PipelineSettings.defaults());
        List<Signal> ranked = ranker.rank(List.of(
                signal("WEAK", 49.99, 30),
                signal("RISKY", 95, 75.01),
                signal("EDGE", 50, 75),
                signal("GOOD", 80, 20)
        ));
        assertEquals(List.of("GOOD", "EDGE"), tickers(ranked));
    }

    @Test
    void rank_shouldTruncateToMaxSignalsPerRun() {
        PipelineSettings settings = PipelineSettings.defaults().toBuilder().maxSignalsPerRun(3).build();
        List<Signal> input = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            input.add(signal("T" + i, 60 + i, 30));
        }
        List<Signal> ranked = new SignalRanker(settings).rank(input);
        assertEquals(List.of("T7", "T6", "T5"), tickers(ranked));
    }

    @Test
    void rank_shouldReturnEmptyWhenCapIsZeroOrInputEmpty() {
        PipelineSettings none = PipelineSettings.defaults().toBuilder().maxSignalsPerRun(0).build();
        assertTrue(new SignalRanker(none).rank(List.of(signal("A", 99, 10))).isEmpty());
        assertTrue(new SignalRanker(PipelineSettings.defaults()).rank(List.of()).isEmpty());
    }

    @Test
    void rank_shouldReturnUnmodifiableList() {
        List<Signal> ranked = new SignalRanker(PipelineSettings.defaults()).rank(List.of(signal("A", 80, 20)));
        assertThrows(UnsupportedOperationException.class, () -> ranked.add(signal("B", 70, 20)));
    }

    private static Signal signal(String ticker, double composite, double risk) {
        return Signal.builder()
                .ticker(ticker)
                .sector("XLK")
                .compositeScore(composite)
                .riskScore(risk)
                .price(10.0)
                .build();
    }

    private static List<String> tickers(List<Signal> signals) {
        List<String> out = new ArrayList<>();
        for (Signal s : signals) {
            out.add(s.ticker);
        }
        return out;
    }
}
