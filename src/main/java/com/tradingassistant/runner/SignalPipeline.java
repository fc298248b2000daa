package com.tradingassistant.runner;

import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.core.RunTelemetry;
import com.tradingassistant.model.CatalystEvent;
import com.tradingassistant.model.FilterDecision;
import com.tradingassistant.model.MarketObservation;
import com.tradingassistant.model.MarketSnapshot;
import com.tradingassistant.model.NewsItem;
import com.tradingassistant.model.SectorQuote;
import com.tradingassistant.model.Signal;
import com.tradingassistant.strategy.CandidateFilter;
import com.tradingassistant.strategy.CatalystDetector;
import com.tradingassistant.strategy.RiskEstimator;
import com.tradingassistant.strategy.ScoringEngine;
import com.tradingassistant.strategy.SectorMap;
import com.tradingassistant.strategy.SignalRanker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Filter, score and rank one market snapshot into a bounded signal list.
 * <p>
 * Holds no state across runs; settings are fixed at construction.
 */
public final class SignalPipeline {
    private static final Logger LOG = LogManager.getLogger(SignalPipeline.class);

    private final PipelineSettings settings;
    private final ScoringEngine scoringEngine;
    private final RiskEstimator riskEstimator;
    private final SectorMap sectorMap;
    private final CandidateFilter candidateFilter;
    private final CatalystDetector catalystDetector;
    private final SignalRanker ranker;

    public SignalPipeline(PipelineSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("pipeline settings are required");
        }
        this.settings = settings;
        this.scoringEngine = new ScoringEngine(settings.weights);
        this.riskEstimator = new RiskEstimator();
        this.sectorMap = new SectorMap(settings.sectorOverrides, settings.defaultSector);
        this.candidateFilter = new CandidateFilter(settings);
        this.catalystDetector = new CatalystDetector(settings.catalystKeywords);
        this.ranker = new SignalRanker(settings);
    }

    public PipelineResult run(MarketSnapshot snapshot) {
        return run(snapshot, new RunTelemetry("manual", Instant.now()));
    }

    public PipelineResult run(MarketSnapshot snapshot, RunTelemetry telemetry) {
        if (snapshot == null) {
            throw new IllegalArgumentException("market snapshot is required");
        }
        LOG.info("Processing market data into signals... symbols={}", snapshot.prices.size());

        telemetry.startStep(RunTelemetry.STEP_FILTER);
        List<FilterDecision> decisions = filter(snapshot);
        List<String> eligible = eligibleTickers(decisions);
        telemetry.endStep(RunTelemetry.STEP_FILTER, decisions.size(), eligible.size(), 0);
        LOG.info("After filters: {} symbols remain", eligible.size());

        telemetry.startStep(RunTelemetry.STEP_SCORE);
        ScoreOutcome scored = scoreAll(eligible, snapshot);
        telemetry.endStep(RunTelemetry.STEP_SCORE, eligible.size(), scored.signals.size(), scored.errors);
        LOG.info("Generated {} scoring signals", scored.signals.size());

        telemetry.startStep(RunTelemetry.STEP_RANK);
        List<Signal> ranked = rank(scored.signals);
        telemetry.endStep(RunTelemetry.STEP_RANK, scored.signals.size(), ranked.size(), 0);
        LOG.info("Final ranked signals: {}", ranked.size());

        return new PipelineResult(decisions, eligible, scored.signals, ranked);
    }

    /**
     * One decision per observation, in snapshot order.
     */
    public List<FilterDecision> filter(MarketSnapshot snapshot) {
        List<FilterDecision> out = new ArrayList<>(snapshot.prices.size());
        for (MarketObservation obs : snapshot.prices.values()) {
            FilterDecision decision = candidateFilter.evaluate(obs, snapshot.fundamentals.get(obs.ticker));
            if (!decision.passed) {
                LOG.debug("  {}: rejected {} metrics={}", obs.ticker, decision.reasons, decision.metrics);
            }
            out.add(decision);
        }
        return out;
    }

    public List<String> eligibleTickers(List<FilterDecision> decisions) {
        List<String> out = new ArrayList<>();
        for (FilterDecision decision : decisions) {
            if (decision.passed) {
                out.add(decision.ticker);
            }
        }
        return out;
    }

    /**
     * Scores tickers in the given order. Output order does not depend on thread count.
     */
    public List<Signal> score(List<String> tickers, MarketSnapshot snapshot) {
        return scoreAll(tickers, snapshot).signals;
    }

    public List<Signal> rank(List<Signal> signals) {
        return ranker.rank(signals);
    }

    public Signal scoreTicker(String ticker, MarketSnapshot snapshot) {
        MarketObservation obs = snapshot.prices.get(ticker);
        if (obs == null) {
            throw new IllegalArgumentException("no market observation for ticker: " + ticker);
        }
        List<NewsItem> news = snapshot.newsFor(ticker);

        String sector = sectorMap.sectorOf(ticker);
        SectorQuote quote = snapshot.sectors.get(sector);
        double sectorPctChange = quote == null ? 0.0 : quote.percentChangeToday;

        double momentum = scoringEngine.momentumScore(obs.rsi);
        double volumeSurge = scoringEngine.volumeSurgeScore(
                obs.volume,
                obs.averageVolume20Day,
                settings.volumeSurgeThresholdPct
        );
        double relativeStrength = scoringEngine.relativeStrengthScore(
                obs.percentChangeToday,
                sectorPctChange,
                settings.relativeStrengthThresholdPct
        );

        int positive = 0;
        for (NewsItem item : news) {
            if (item.isPositive()) {
                positive++;
            }
        }
        double newsSentiment = scoringEngine.newsSentimentScore(positive, news.size());

        List<CatalystEvent> catalysts = catalystDetector.detect(news);
        double catalyst = scoringEngine.catalystScore(catalysts);

        double composite = scoringEngine.compositeScore(momentum, volumeSurge, relativeStrength, newsSentiment, catalyst);
        double risk = riskEstimator.riskScore(obs.atr, obs.price);

        return Signal.builder()
                .ticker(ticker)
                .sector(sector)
                .momentumScore(round2(momentum))
                .volumeSurgeScore(round2(volumeSurge))
                .relativeStrengthScore(round2(relativeStrength))
                .newsSentimentScore(round2(newsSentiment))
                .catalystScore(round2(catalyst))
                .compositeScore(round2(composite))
                .riskScore(round2(risk))
                .price(round2(obs.price))
                .atr(round2(obs.atr))
                .rsi(round2(obs.rsi))
                .percentChangeToday(round2(obs.percentChangeToday))
                .build();
    }

    private ScoreOutcome scoreAll(List<String> tickers, MarketSnapshot snapshot) {
        if (settings.threads <= 1 || tickers.size() <= 1) {
            return scoreSequential(tickers, snapshot);
        }
        return scoreParallel(tickers, snapshot);
    }

    private ScoreOutcome scoreSequential(List<String> tickers, MarketSnapshot snapshot) {
        ScoreOutcome outcome = new ScoreOutcome(tickers.size());
        for (String ticker : tickers) {
            try {
                outcome.signals.add(scoreTicker(ticker, snapshot));
            } catch (RuntimeException e) {
                outcome.errors++;
                LOG.warn("Scoring failed ticker={}, err={}", ticker, e.getMessage());
            }
        }
        return outcome;
    }

    private ScoreOutcome scoreParallel(List<String> tickers, MarketSnapshot snapshot) {
        int threads = Math.min(settings.threads, tickers.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ScoreOutcome outcome = new ScoreOutcome(tickers.size());
        try {
            List<Future<Signal>> futures = new ArrayList<>(tickers.size());
            for (String ticker : tickers) {
                futures.add(pool.submit(() -> scoreTicker(ticker, snapshot)));
            }
            // Collect in submission order so completion order never leaks into the result.
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcome.signals.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcome.errors++;
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("Scoring failed ticker={}, err={}", tickers.get(i), cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("scoring interrupted", e);
        } finally {
            pool.shutdownNow();
        }
        return outcome;
    }

    private static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class ScoreOutcome {
        private final List<Signal> signals;
        private int errors;

        private ScoreOutcome(int expected) {
            this.signals = new ArrayList<>(expected);
        }
    }
}
