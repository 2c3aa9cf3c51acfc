package com.errlens.core.plugin;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorMetadata;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an untrusted extractor plugin behind a time, input-size and result-shape boundary.
 *
 * <p>Every {@code detect} and {@code extract} call runs on the plugin's single daemon
 * worker thread and is abandoned (and interrupted) once the per-call timeout passes.
 * A plugin that ignores the interrupt keeps its one worker busy, so later calls
 * queue behind it and time out instead of spawning more threads. Input
 * longer than the configured limit is truncated first. Whatever the plugin
 * returns is copied into fresh records: errors are re-capped at
 * {@link ErrorExtractorResult#MAX_ERRORS} and {@code totalErrors} repaired.
 * Exceptions, timeouts and malformed results become an empty result with an
 * explanatory issue, so the wrapper is total like a built-in extractor.
 *
 * <p>The boundary is in-JVM: it does not limit memory, file system or network
 * access.
 */
public class SandboxedExtractor implements ExtractorPlugin {

    private static final Logger log = LoggerFactory.getLogger(SandboxedExtractor.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExtractorPlugin delegate;
    private final long timeoutMs;
    private final int maxInputChars;
    private final ExecutorService executor;

    private final ExtractorMetadata metadata;
    private final ExtractorHints hints;
    private final int priority;
    private final int threshold;
    private final List<ExtractorSample> samples;

    /**
     * Wraps a plugin. Static plugin properties are read once, here.
     *
     * @param delegate plugin to isolate
     * @param timeoutMs per-call budget in milliseconds
     * @param maxInputChars longest input handed to the plugin
     */
    public SandboxedExtractor(ExtractorPlugin delegate, long timeoutMs, int maxInputChars) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.timeoutMs = timeoutMs;
        this.maxInputChars = maxInputChars;
        this.metadata = delegate.getMetadata();
        this.hints = delegate.getHints() != null ? delegate.getHints() : ExtractorHints.none();
        this.priority = delegate.getPriority();
        this.threshold = Math.max(0, Math.min(100, delegate.getDetectionThreshold()));
        this.samples = delegate.getSamples() != null ? List.copyOf(delegate.getSamples()) : List.of();
        this.executor = Executors.newSingleThreadExecutor(daemonThreads(metadata.name()));
    }

    private static ThreadFactory daemonThreads(String pluginName) {
        return runnable -> {
            Thread thread = new Thread(runnable, "errlens-sandbox-" + pluginName + "-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public ExtractorMetadata getMetadata() {
        return metadata;
    }

    @Override
    public ExtractorHints getHints() {
        return hints;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public int getDetectionThreshold() {
        return threshold;
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return samples;
    }

    @Override
    public DetectionResult detect(String output) {
        String input = truncate(output);
        try {
            DetectionResult result = call(() -> delegate.detect(input));
            if (result == null) {
                log.warn("Plugin {} returned no detection result", metadata.name());
                return DetectionResult.none();
            }
            int confidence = Math.max(0, Math.min(100, result.confidence()));
            return DetectionResult.of(confidence, result.patterns(), result.reason());
        } catch (SandboxException e) {
            log.warn("Plugin {} detection failed: {}", metadata.name(), e.getMessage());
            return DetectionResult.none();
        }
    }

    @Override
    public ErrorExtractorResult extract(String output, String context) {
        String input = truncate(output);
        List<String> issues = new ArrayList<>();
        if (output != null && input.length() < output.length()) {
            issues.add("Input truncated to " + maxInputChars + " characters before reaching plugin " + metadata.name());
        }

        ErrorExtractorResult result;
        try {
            result = call(() -> delegate.extract(input, context));
        } catch (SandboxException e) {
            log.warn("Plugin {} extraction failed: {}", metadata.name(), e.getMessage());
            issues.add(e.getMessage());
            return failed(issues);
        }
        if (result == null) {
            issues.add("Sandbox returned invalid result structure");
            return failed(issues);
        }
        return copyOf(result, issues);
    }

    /**
     * Copies a plugin result into fresh records, re-capping errors and repairing the count.
     */
    private ErrorExtractorResult copyOf(ErrorExtractorResult result, List<String> sandboxIssues) {
        List<FormattedError> errors = result.errors().stream().filter(Objects::nonNull).toList();
        List<FormattedError> capped = ResultAssembler.cap(errors);
        int total = Math.max(result.totalErrors(), errors.size());

        ExtractionMetadata original = result.metadata();
        List<String> issues = new ArrayList<>(original.issues());
        issues.addAll(sandboxIssues);
        ExtractionMetadata metadata = new ExtractionMetadata(original.confidence(), original.completeness(), issues,
            original.detection());

        return new ErrorExtractorResult(capped, total, result.summary(), result.guidance(), result.errorSummary(),
            metadata);
    }

    private ErrorExtractorResult failed(List<String> issues) {
        return ResultAssembler.empty("Extraction failed in plugin " + metadata.name(), 0, issues);
    }

    private String truncate(String output) {
        if (output == null) {
            return "";
        }
        return output.length() > maxInputChars ? output.substring(0, maxInputChars) : output;
    }

    private <T> T call(Callable<T> task) throws SandboxException {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SandboxException("Sandbox execution timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SandboxException("Sandbox execution failed: " + cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : ""));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SandboxException("Sandbox execution interrupted");
        }
    }

    /**
     * Returns the wrapped plugin.
     *
     * @return delegate
     */
    public ExtractorPlugin getDelegate() {
        return delegate;
    }

    private static final class SandboxException extends Exception {
        SandboxException(String message) {
            super(message);
        }
    }
}
