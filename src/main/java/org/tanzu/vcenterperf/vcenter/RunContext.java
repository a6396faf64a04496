package org.tanzu.vcenterperf.vcenter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation scope shared by every remote call of a collection run.
 *
 * Calls are bound with {@link #bind(Mono)}: when {@link #cancel(String)} fires, the
 * in-flight exchange is disposed and the caller gets a {@link RunCancelledException}.
 * {@link #throwIfCancelled()} is checked before each call so that nothing new starts
 * after cancellation.
 */
@Component
public class RunContext {

    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    private final Sinks.Empty<Void> cancelSignal = Sinks.empty();

    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    /**
     * Cancels the run. Only the first call has an effect.
     * @param reason Why the run was cancelled, used in the resulting error
     */
    public void cancel(String reason) {
        if (cancelReason.compareAndSet(null, reason)) {
            logger.warn("Cancelling run: {}", reason);
            cancelSignal.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelReason.get() != null;
    }

    /**
     * @throws RunCancelledException if the run has been cancelled
     */
    public void throwIfCancelled() {
        String reason = cancelReason.get();
        if (reason != null) {
            throw new RunCancelledException(reason);
        }
    }

    /**
     * Races a remote call against the cancel signal.
     *
     * @param call The remote call
     * @return A Mono that mirrors the call, or fails with RunCancelledException on cancellation
     */
    public <T> Mono<T> bind(Mono<T> call) {
        Mono<T> cancelled = cancelSignal.asMono()
                .then(Mono.<T>error(() -> new RunCancelledException(cancelReason.get())));
        return Mono.firstWithSignal(call, cancelled);
    }
}
