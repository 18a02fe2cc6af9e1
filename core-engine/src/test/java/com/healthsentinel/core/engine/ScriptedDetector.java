package com.healthsentinel.core.engine;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.detection.AnomalyDetector;
import com.healthsentinel.core.detection.DetectorFactory;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a real detector and adds a delay or failures, for the engine's
 * budget and retry paths.
 */
final class ScriptedDetector implements AnomalyDetector {

    private final DetectorKind kind;
    private final AnomalyDetector delegate;
    private final Duration delay;
    private final int failures;
    private final AtomicInteger calls = new AtomicInteger();
    private final CountDownLatch finished = new CountDownLatch(1);

    private ScriptedDetector(DetectorKind kind, AnomalyDetector delegate, Duration delay, int failures) {
        this.kind = kind;
        this.delegate = delegate;
        this.delay = delay;
        this.failures = failures;
    }

    /** Sleeps {@code delay} per window, ignoring interrupts, then delegates. */
    static ScriptedDetector slow(DetectorKind kind, Duration delay) {
        return new ScriptedDetector(kind, real(kind), delay, 0);
    }

    /** Throws on the first window it sees, then behaves like the real detector. */
    static ScriptedDetector failingOnce(DetectorKind kind) {
        return new ScriptedDetector(kind, real(kind), Duration.ZERO, 1);
    }

    static ScriptedDetector alwaysFailing(DetectorKind kind) {
        return new ScriptedDetector(kind, real(kind), Duration.ZERO, Integer.MAX_VALUE);
    }

    static AnomalyDetector real(DetectorKind kind) {
        return DetectorFactory.create(kind, new DetectorSettings());
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        int call = calls.incrementAndGet();
        try {
            pause();
            if (call <= failures) {
                throw new IllegalStateException(kind.getId() + " failed on call " + call);
            }
            return delegate.evaluate(window);
        } finally {
            finished.countDown();
        }
    }

    @Override
    public DetectorKind getKind() {
        return kind;
    }

    int calls() {
        return calls.get();
    }

    boolean awaitFirstCall(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        long deadline = System.nanoTime() + delay.toNanos();
        boolean interrupted = false;
        long left;
        while ((left = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(left);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
