package tech.identitycore.server.token;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.error.OAuthError;
import tech.identitycore.server.error.OAuthException;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds the time a token request may take.
 *
 * The work runs on a bounded pool of {@code identitycore.request-pool-size} threads with a
 * queue of {@code identitycore.request-queue-size}; a request that finds both full answers
 * server_error at once. The caller waits at most {@code identitycore.request-timeout} and then
 * answers server_error.
 *
 * <p>On timeout the task is interrupted, but whatever it already did stays done: an
 * authorization code redeemed before the deadline remains consumed and the client has to
 * start a new authorization.
 */
@ApplicationScoped
public class RequestTimeoutGuard {

    private static final Logger LOG = Logger.getLogger(RequestTimeoutGuard.class);

    @Inject
    IdentityConfig config;

    ThreadPoolExecutor executor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        int poolSize = config.requestPoolSize();
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(config.requestQueueSize()),
            r -> {
                Thread t = new Thread(r, "token-request-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
        LOG.infof("Token request pool: %d threads, queue %d", poolSize, config.requestQueueSize());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public <T> T call(Supplier<T> task) {
        return call(task, config.requestTimeout());
    }

    /**
     * Run the task, rethrowing its {@link RuntimeException}s unchanged.
     *
     * @throws OAuthException server_error when the pool is saturated, the timeout elapses or the task
     *                        fails unexpectedly
     */
    public <T> T call(Supplier<T> task, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(task::get);
        } catch (RejectedExecutionException e) {
            LOG.warnf("Token request rejected, pool saturated");
            throw new OAuthException(OAuthError.SERVER_ERROR, "Server busy", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.errorf("Token request exceeded %s", timeout);
            throw new OAuthException(OAuthError.SERVER_ERROR, "Request timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            LOG.errorf(cause, "Token request failed");
            throw new OAuthException(OAuthError.SERVER_ERROR, "Internal error", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OAuthException(OAuthError.SERVER_ERROR, "Request interrupted", e);
        }
    }
}
