package com.orderflow.sim.tape;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * <b>The Tape Journal: Sessions to CSV through a Ring Buffer.</b>
 * <p>
 * Finished sessions publish their tapes from whichever pool thread ran them;
 * a single journal thread drains the ring buffer and appends CSV rows:
 * </p>
 *
 * <pre>
 * session,sequence,tick,kind,price,quantity,buyTrader,sellTrader,buyOrder,sellOrder
 * </pre>
 *
 * <h3>Design:</h3>
 * <ol>
 * <li><b>Multi Producer:</b> several sessions may finish at once, so the ring
 * buffer is claimed with {@link ProducerType#MULTI}.</li>
 * <li><b>Single Writer:</b> only the handler thread touches the file. Rows of
 * one tape stay contiguous because a tape is published in one call under the
 * journal's lock.</li>
 * <li><b>Blocking Wait:</b> the journal is idle most of the run, so the
 * consumer parks instead of spinning.</li>
 * </ol>
 * <p>
 * Entries are immutable; nothing is copied into the slot beyond the
 * reference.
 * </p>
 */
public class TapeJournal implements AutoCloseable {

    public static final String HEADER =
            "session,sequence,tick,kind,price,quantity,buyTrader,sellTrader,buyOrder,sellOrder";

    private static final int DEFAULT_BUFFER_SIZE = 8192;

    private final Path file;
    private final BufferedWriter writer;
    private final Disruptor<TapeEvent> disruptor;
    private final RingBuffer<TapeEvent> ringBuffer;
    private final Logger logger;

    private volatile Throwable failure;
    private long written;
    private boolean closed;

    public TapeJournal(Path file) {
        this(file, DEFAULT_BUFFER_SIZE, new Slf4jLogger(TapeJournal.class));
    }

    public TapeJournal(Path file, int bufferSize, Logger logger) {
        this.file = file;
        this.logger = logger;
        try {
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
            writer.write(HEADER);
            writer.newLine();
        } catch (IOException e) {
            throw new TapeJournalException("Cannot open tape journal " + file, e);
        }

        this.disruptor = new Disruptor<>(
                TapeEvent.FACTORY,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.setDefaultExceptionHandler(new JournalExceptionHandler());
        this.disruptor.handleEventsWith(new CsvWriterHandler(writer));
        this.ringBuffer = disruptor.start();
    }

    public void publish(TapeEntry entry) {
        long sequence = ringBuffer.next();
        try {
            TapeEvent event = ringBuffer.get(sequence);
            event.entry = entry;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Publishes a whole tape so its rows stay together in the file. */
    public synchronized void publishAll(List<TapeEntry> entries) {
        for (TapeEntry entry : entries) {
            publish(entry);
        }
    }

    /**
     * Drains everything published so far, then closes the file.
     *
     * @throws TapeJournalException if any row failed to write
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        disruptor.shutdown();
        try {
            writer.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            }
        }
        logger.log("Tape journal closed, rows", written);
        if (failure != null) {
            throw new TapeJournalException("Tape journal " + file + " failed", failure);
        }
    }

    static String formatRow(TapeEntry entry) {
        return new StringBuilder(96)
                .append(entry.sessionId()).append(',')
                .append(entry.sequence()).append(',')
                .append(entry.tick()).append(',')
                .append(entry.kind()).append(',')
                .append(entry.price()).append(',')
                .append(entry.quantity()).append(',')
                .append(entry.buyTraderId() == null ? "" : entry.buyTraderId()).append(',')
                .append(entry.sellTraderId() == null ? "" : entry.sellTraderId()).append(',')
                .append(entry.buyOrderId() == 0 ? "" : Long.toString(entry.buyOrderId())).append(',')
                .append(entry.sellOrderId() == 0 ? "" : Long.toString(entry.sellOrderId()))
                .toString();
    }

    private final class CsvWriterHandler implements EventHandler<TapeEvent> {

        private final Writer out;

        CsvWriterHandler(Writer out) {
            this.out = out;
        }

        @Override
        public void onEvent(TapeEvent event, long sequence, boolean endOfBatch) {
            try {
                out.write(formatRow(event.entry));
                out.write(System.lineSeparator());
                written++;
                if (endOfBatch) {
                    out.flush();
                }
            } catch (IOException e) {
                throw new TapeJournalException("Cannot append to " + file, e);
            } finally {
                event.reset();
            }
        }
    }

    private final class JournalExceptionHandler implements ExceptionHandler<TapeEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, TapeEvent event) {
            if (failure == null) {
                failure = ex;
            }
            logger.error("Tape journal row " + sequence + " lost", ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            failure = ex;
            logger.error("Tape journal failed to start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            logger.error("Tape journal failed to stop", ex);
        }
    }
}
