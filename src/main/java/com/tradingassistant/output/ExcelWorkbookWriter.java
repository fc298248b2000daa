package com.tradingassistant.output;

import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.model.MarketSnapshot;
import com.tradingassistant.model.NewsItem;
import com.tradingassistant.model.Signal;
import com.tradingassistant.runner.PipelineResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Writes a run's ranked signals to an .xlsx workbook with Dashboard, Signals,
 * News and Parameters sheets.
 */
public final class ExcelWorkbookWriter {
    private static final Logger LOG = LogManager.getLogger(ExcelWorkbookWriter.class);
    private static final DateTimeFormatter DISPLAY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String SHEET_DASHBOARD = "Dashboard";
    public static final String SHEET_SIGNALS = "Signals";
    public static final String SHEET_NEWS = "News";
    public static final String SHEET_PARAMETERS = "Parameters";

    static final double BUY_SCORE_THRESHOLD = 75.0;

    private final ZoneId zone;

    public ExcelWorkbookWriter() {
        this(ZoneId.systemDefault());
    }

    public ExcelWorkbookWriter(ZoneId zone) {
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public Path write(
            Path output,
            PipelineResult result,
            MarketSnapshot snapshot,
            PipelineSettings settings,
            Instant refreshedAt
    ) throws IOException {
        LOG.info("Writing Excel workbook to {}", output);
        Path target = output.toAbsolutePath();
        Files.createDirectories(target.getParent());
        // Sheets go to a sibling temp file; the target is only replaced once the workbook is complete.
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (Workbook wb = new XSSFWorkbook()) {
                addDashboardSheet(wb, result, snapshot, refreshedAt);
                addSignalsSheet(wb, result.rankedSignals);
                addNewsSheet(wb, result.rankedSignals, snapshot);
                addParametersSheet(wb, settings);
                try (OutputStream out = Files.newOutputStream(tmp)) {
                    wb.write(out);
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Workbook saved signals={}", result.rankedSignals.size());
        return output;
    }

    private void addDashboardSheet(Workbook wb, PipelineResult result, MarketSnapshot snapshot, Instant refreshedAt) {
        Sheet ws = wb.createSheet(SHEET_DASHBOARD);
        CellStyle title = wb.createCellStyle();
        Font titleFont = wb.createFont();
        titleFont.setBold(true);
        titleFont.setFontHeightInPoints((short) 14);
        title.setFont(titleFont);

        Row header = ws.createRow(0);
        header.createCell(0).setCellValue("TRADING SIGNALS DASHBOARD");
        header.getCell(0).setCellStyle(title);

        List<Signal> ranked = result.rankedSignals;
        Instant ts = refreshedAt == null ? Instant.now() : refreshedAt;
        putPair(ws, 2, "Last Refresh", DISPLAY_TS.format(ts.atZone(zone)));
        putPair(ws, 3, "Data As Of", DISPLAY_TS.format(snapshot.asOf.atZone(zone)));
        putPair(ws, 4, "Top Pick", ranked.isEmpty() ? "N/A" : ranked.get(0).ticker);
        if (ranked.isEmpty()) {
            putPair(ws, 5, "Top Score", "N/A");
        } else {
            putPair(ws, 5, "Top Score", ranked.get(0).compositeScore);
        }
        putPair(ws, 6, "Num Signals", ranked.size());
        putPair(ws, 7, "Symbols Scanned", result.filterDecisions.size());
        putPair(ws, 8, "Passed Filters", result.eligibleTickers.size());

        ws.setColumnWidth(0, 20 * 256);
        ws.setColumnWidth(1, 30 * 256);
    }

    private void addSignalsSheet(Workbook wb, List<Signal> signals) {
        Sheet ws = wb.createSheet(SHEET_SIGNALS);
        writeHeader(ws, headerStyle(wb, IndexedColors.ROYAL_BLUE, true),
                "Rank", "Ticker", "Sector", "Price", "Score", "Momentum", "Volume Surge",
                "Rel Strength", "News Sentiment", "Catalyst", "Risk", "RSI", "ATR", "% Change", "Status");

        int r = 1;
        for (Signal s : signals) {
            Row row = ws.createRow(r);
            int c = 0;
            row.createCell(c++).setCellValue(r);
            row.createCell(c++).setCellValue(s.ticker);
            row.createCell(c++).setCellValue(s.sector);
            row.createCell(c++).setCellValue(s.price);
            row.createCell(c++).setCellValue(s.compositeScore);
            row.createCell(c++).setCellValue(s.momentumScore);
            row.createCell(c++).setCellValue(s.volumeSurgeScore);
            row.createCell(c++).setCellValue(s.relativeStrengthScore);
            row.createCell(c++).setCellValue(s.newsSentimentScore);
            row.createCell(c++).setCellValue(s.catalystScore);
            row.createCell(c++).setCellValue(s.riskScore);
            if (Double.isFinite(s.rsi)) {
                row.createCell(c).setCellValue(s.rsi);
            }
            c++;
            row.createCell(c++).setCellValue(s.atr);
            row.createCell(c++).setCellValue(s.percentChangeToday);
            row.createCell(c).setCellValue(status(s));
            r++;
        }
        for (int i = 0; i < 15; i++) {
            ws.setColumnWidth(i, 15 * 256);
        }
    }

    private void addNewsSheet(Workbook wb, List<Signal> signals, MarketSnapshot snapshot) {
        Sheet ws = wb.createSheet(SHEET_NEWS);
        writeHeader(ws, headerStyle(wb, IndexedColors.GREEN, true),
                "Ticker", "Headline", "Source", "Sentiment", "Time");

        int r = 1;
        for (Signal s : signals) {
            for (NewsItem item : snapshot.newsFor(s.ticker)) {
                Row row = ws.createRow(r++);
                row.createCell(0).setCellValue(s.ticker);
                row.createCell(1).setCellValue(item.headline);
                row.createCell(2).setCellValue(item.source);
                row.createCell(3).setCellValue(item.sentiment.name());
                row.createCell(4).setCellValue(item.publishedAt == null
                        ? ""
                        : DISPLAY_TS.format(item.publishedAt.atZone(zone)));
            }
        }
        ws.setColumnWidth(0, 10 * 256);
        ws.setColumnWidth(1, 60 * 256);
        ws.setColumnWidth(2, 15 * 256);
        ws.setColumnWidth(3, 12 * 256);
        ws.setColumnWidth(4, 20 * 256);
    }

    private void addParametersSheet(Workbook wb, PipelineSettings settings) {
        Sheet ws = wb.createSheet(SHEET_PARAMETERS);
        writeHeader(ws, headerStyle(wb, IndexedColors.GOLD, false), "Category", "Parameter", "Value");

        int r = 1;
        for (Map.Entry<String, Object> e : settings.describe().entrySet()) {
            String key = e.getKey();
            int dot = key.indexOf('.');
            Row row = ws.createRow(r++);
            row.createCell(0).setCellValue(dot < 0 ? "" : key.substring(0, dot));
            row.createCell(1).setCellValue(dot < 0 ? key : key.substring(dot + 1));
            Object value = e.getValue();
            if (value instanceof Number number) {
                row.createCell(2).setCellValue(number.doubleValue());
            } else {
                row.createCell(2).setCellValue(String.valueOf(value));
            }
        }
        ws.setColumnWidth(0, 20 * 256);
        ws.setColumnWidth(1, 35 * 256);
        ws.setColumnWidth(2, 50 * 256);
    }

    static String status(Signal signal) {
        return signal.compositeScore > BUY_SCORE_THRESHOLD ? "BUY" : "HOLD";
    }

    private static void putPair(Sheet ws, int rowIdx, String label, String value) {
        Row row = ws.createRow(rowIdx);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    private static void putPair(Sheet ws, int rowIdx, String label, double value) {
        Row row = ws.createRow(rowIdx);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    private static CellStyle headerStyle(Workbook wb, IndexedColors fill, boolean whiteText) {
        CellStyle style = wb.createCellStyle();
        style.setFillForegroundColor(fill.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        Font font = wb.createFont();
        font.setBold(true);
        if (whiteText) {
            font.setColor(IndexedColors.WHITE.getIndex());
        }
        style.setFont(font);
        return style;
    }

    private static void writeHeader(Sheet ws, CellStyle style, String... headers) {
        Row row = ws.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            row.createCell(i).setCellValue(headers[i]);
            row.getCell(i).setCellStyle(style);
        }
    }
}
