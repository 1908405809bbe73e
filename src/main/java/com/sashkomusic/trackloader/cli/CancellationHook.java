package com.sashkomusic.trackloader.cli;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;

/**
 * Turns a JVM shutdown (Ctrl+C) into an interrupt of the thread running the download, then
 * holds the shutdown until that thread reports the run has drained.
 */
@Slf4j
public class CancellationHook implements AutoCloseable {

    private final Thread runThread;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    private CancellationHook(Thread runThread) {
        this.runThread = runThread;
        this.hook = new Thread(this::onShutdown, "shutdown-drain");
    }

    public static CancellationHook install() {
        CancellationHook cancellationHook = new CancellationHook(Thread.currentThread());
        Runtime.getRuntime().addShutdownHook(cancellationHook.hook);
        return cancellationHook;
    }

    private void onShutdown() {
        log.info("Received Ctrl+C! Gracefully shutting down...");
        runThread.interrupt();
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down, leaving cancellation hook in place");
        }
    }
}
