package com.orderflow.sim.tape;

import com.orderflow.sim.BalancesRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Appends one CSV row per session:
 *
 * <pre>
 * session,tick,type,balanceSum,count,average[,type,balanceSum,count,average...],bestBid,bestAsk
 * </pre>
 *
 * An empty side of the book is written as an empty cell.
 */
public class BalancesWriter implements AutoCloseable {

    private final Path file;
    private final BufferedWriter writer;

    public BalancesWriter(Path file) {
        this.file = file;
        try {
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TapeJournalException("Cannot open balances file " + file, e);
        }
    }

    public synchronized void write(BalancesRecord record) {
        try {
            writer.write(formatRow(record));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new TapeJournalException("Cannot append to " + file, e);
        }
    }

    static String formatRow(BalancesRecord record) {
        StringBuilder sb = new StringBuilder(128).append(record.sessionId()).append(',').append(record.tick());
        for (BalancesRecord.TypeBalance balance : record.balances()) {
            sb.append(',').append(balance.type().code())
                    .append(',').append(balance.balanceSum())
                    .append(',').append(balance.count())
                    .append(',').append(String.format(Locale.ROOT, "%.6f", balance.average()));
        }
        sb.append(',');
        if (!record.bestBid().isEmpty()) {
            sb.append(record.bestBid().price());
        }
        sb.append(',');
        if (!record.bestAsk().isEmpty()) {
            sb.append(record.bestAsk().price());
        }
        return sb.toString();
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new TapeJournalException("Cannot close " + file, e);
        }
    }
}
