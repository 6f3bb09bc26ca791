package org.broadinstitute.tensorcaller.engine.progressmeter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A basic progress meter to print out the number of batches and sites decoded during a run
 * at a configurable time interval.
 *
 * Clients set the update interval at construction, which controls how many seconds must elapse
 * before printing an update. Then call {@link #start} at run start, {@link #update} after each decoded batch,
 * and {@link #stop} at run end to print summary statistics.
 *
 * Note that {@link #start} must only be called once, before any {@link #update}.
 * Note no {@link #update} must be called after {@link #stop}.
 *
 * All output is made at INFO level via log4j.
 */
public class ProgressMeter {
    private static final Logger logger = LogManager.getLogger(ProgressMeter.class);

    /**
     * By default, we output a line to the logger after this many seconds have elapsed
     */
    public static final double DEFAULT_SECONDS_BETWEEN_UPDATES = 10.0;

    public static final long MILLISECONDS_PER_SECOND = 1000L;

    public static final long MILLISECONDS_PER_MINUTE = MILLISECONDS_PER_SECOND * 60L;

    /**
     * Default label for records in logger messages. For display purposes only.
     */
    public static final String DEFAULT_RECORD_LABEL = "sites";

    private final long millisecondsBetweenUpdates;

    private long numRecordsProcessed = 0L;

    private long numBatchesProcessed = 0L;

    private long startTimeMs = 0L;

    private long currentTimeMs = 0L;

    /**
     * Last site of the most recently decoded batch, or null if that batch was empty.
     */
    private Site currentSite = null;

    /**
     * The number of times we've outputted a status line to the logger via {@link #printProgress}.
     * We keep track of this only for unit-testing purposes.
     */
    private long numLoggerUpdates = 0L;

    private boolean started;

    private boolean stopped;

    private String recordLabel = DEFAULT_RECORD_LABEL;

    /**
     * Timer to run updates in the background
     */
    private final ScheduledExecutorService scheduler;

    public ProgressMeter() {
        this(DEFAULT_SECONDS_BETWEEN_UPDATES);
    }

    /**
     * @param secondsBetweenUpdates number of seconds that should elapse before outputting a line to the logger
     */
    public ProgressMeter(final double secondsBetweenUpdates) {
        Utils.validateArg(secondsBetweenUpdates > 0, "secondsBetweenUpdates must be > 0.0");
        this.started = false;
        this.stopped = false;

        this.millisecondsBetweenUpdates = (long)(secondsBetweenUpdates * (double)MILLISECONDS_PER_SECOND);
        Utils.validate(millisecondsBetweenUpdates > 0, "millisecondsBetweenUpdates must be > 0");

        this.scheduler = Executors.newScheduledThreadPool(1,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("Progress Meter").build());
    }

    public void setRecordLabel(final String label) {
        Utils.nonNull(label);
        this.recordLabel = label;
    }

    /**
     * Start the progress meter and produce preliminary output such as column headings.
     * @throws IllegalStateException if the meter has been started before or has been stopped already
     */
    public synchronized void start() {
        Utils.validate(!started, "the progress meter has been started already");
        Utils.validate(!stopped, "the progress meter has been stopped already");
        started = true;
        logger.info("Starting decoding");
        printHeader();

        startTimeMs = getTime();
        currentTimeMs = startTimeMs;
        numRecordsProcessed = 0L;
        numBatchesProcessed = 0L;
        numLoggerUpdates = 0L;
        currentSite = null;

        scheduler.scheduleAtFixedRate(this::printProgress, millisecondsBetweenUpdates, millisecondsBetweenUpdates, TimeUnit.MILLISECONDS);
    }

    private long getTime() {
        return System.currentTimeMillis();
    }

    /**
     * Signal to the progress meter that a batch of sites has been decoded.
     *
     * @param lastSite the last site of the batch, or null if the batch was empty
     * @param sitesInBatch number of sites in the batch
     * @throws IllegalStateException if the meter has not been started yet or has been stopped already
     */
    public synchronized void update(final Site lastSite, final long sitesInBatch) {
        Utils.validate(started, "the progress meter has not been started yet");
        Utils.validate(!stopped, "the progress meter has been stopped already");
        numRecordsProcessed += sitesInBatch;
        numBatchesProcessed++;
        if (lastSite != null) {
            currentSite = lastSite;
        }
    }

    /**
     * Stop the progress meter and output summary statistics to the logger
     * @throws IllegalStateException if the meter has not been started yet or has been stopped already
     */
    public synchronized void stop() {
        Utils.validate(started, "the progress meter has not been started yet");
        Utils.validate(!stopped, "the progress meter has been stopped already");
        this.stopped = true;
        currentTimeMs = getTime();
        // Output progress a final time at the end
        printProgress();
        scheduler.shutdown();
        logger.info(String.format("Decoding complete. Processed %d total %s in %d batches in %.1f minutes.",
                numRecordsProcessed, recordLabel, numBatchesProcessed, elapsedTimeInMinutes()));
    }

    private void printHeader() {
        logger.info(String.format("%20s  %15s  %15s  %20s  %15s",
                "Current Site", "Elapsed Minutes", "Batches Decoded",
                StringUtils.capitalize(recordLabel) + " Processed",
                StringUtils.capitalize(recordLabel) + "/Minute"));
    }

    private synchronized void printProgress() {
        currentTimeMs = getTime();
        ++numLoggerUpdates;
        logger.info(String.format("%20s  %15.1f  %15d  %20d  %15.1f",
                currentSite == null ? "unmapped" : currentSite.toString(),
                elapsedTimeInMinutes(), numBatchesProcessed, numRecordsProcessed, processingRate()));
    }

    /**
     * @return the total minutes elapsed since we called {@link #start}
     *
     * This is only accurate at set polling intervals and should not be
     * called directly except in tests.
     */
    @VisibleForTesting
    double elapsedTimeInMinutes() {
        return (currentTimeMs - startTimeMs) / (double)MILLISECONDS_PER_MINUTE;
    }

    private double processingRate() {
        final double minutes = elapsedTimeInMinutes();
        return minutes > 0.0 ? numRecordsProcessed / minutes : 0.0;
    }

    @VisibleForTesting
    long numLoggerUpdates() {
        return numLoggerUpdates;
    }

    public synchronized long getNumRecordsProcessed() {
        return numRecordsProcessed;
    }

    public synchronized long getNumBatchesProcessed() {
        return numBatchesProcessed;
    }

    public boolean started() {
        return started;
    }

    public boolean stopped() {
        return stopped;
    }
}
