package com.lingguard.core.sandbox;

import com.lingguard.api.sandbox.IsolatedEnvironment;
import com.lingguard.api.sandbox.OperationState;
import com.lingguard.api.sandbox.SandboxOperation;
import com.lingguard.api.sandbox.SandboxOptions;
import com.lingguard.api.sandbox.SecurityCheckResult;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.event.EventBus;
import com.lingguard.core.event.monitor.SecurityEvents.ExecutionCompletedEvent;
import com.lingguard.core.event.monitor.SecurityEvents.SandboxViolationEvent;
import com.lingguard.core.event.monitor.SecurityEvents.SlowOperationEvent;
import com.lingguard.core.exception.InvocationException;
import com.lingguard.core.exception.RateLimitExceededException;
import com.lingguard.core.exception.SandboxTimeoutException;
import com.lingguard.core.exception.SandboxViolationException;
import com.lingguard.core.resilience.FixedWindowRateLimiter;
import com.lingguard.core.resilience.RateLimiter;
import com.lingguard.core.spi.HttpTransport;
import com.lingguard.core.spi.MemoryProbe;
import com.lingguard.core.spi.SecurityErrorReporter;
import com.lingguard.core.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 沙箱执行器
 * 职责：按插件限流、超时与协作式取消、内存观测、请求内容检查、隔离环境构建
 * <p>
 * 单次执行状态：PENDING → RATE_LIMIT_CHECKED → RUNNING → {COMPLETED | FAILED | TIMED_OUT}。
 * 任何终态都会移除活动操作登记并记录执行指标。
 * </p>
 * <p>
 * 超时后会中断工作线程并触发取消信号，但无法抢占不检查中断的 CPU 密集代码，
 * 这类代码在超时后仍会在后台运行到结束。
 * </p>
 */
@Slf4j
public class SandboxExecutor {

    public static final String CATEGORY_EXECUTION_FAILED = "Plugin Execution Failed";
    public static final String CATEGORY_EXECUTION_ERROR = "Plugin Execution Error";
    public static final String CATEGORY_PERFORMANCE = "Plugin Performance Warning";
    public static final String CATEGORY_MEMORY = "Plugin Memory Violation";

    private final SecurityConfig config;
    private final RateLimiter rateLimiter;
    private final SecurityErrorReporter errorReporter;
    private final EventBus eventBus;
    private final MemoryProbe memoryProbe;
    private final HttpTransport transport;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final RequestInspector inspector;

    // Map<OperationId, ActiveOperation>
    private final Map<String, ActiveOperation> activeOperations = new ConcurrentHashMap<>();

    public SandboxExecutor(SecurityConfig config,
                           SecurityErrorReporter errorReporter,
                           EventBus eventBus,
                           HttpTransport transport) {
        this(config,
                new FixedWindowRateLimiter("sandbox", config.getRateLimitRequests(), config.getRateLimitWindowMs()),
                errorReporter,
                eventBus,
                MemoryProbe.runtime(),
                transport,
                Executors.newCachedThreadPool(daemonThreads("lingguard-sandbox-")),
                Executors.newSingleThreadScheduledExecutor(daemonThreads("lingguard-sandbox-scheduler-")));
    }

    public SandboxExecutor(SecurityConfig config,
                           RateLimiter rateLimiter,
                           SecurityErrorReporter errorReporter,
                           EventBus eventBus,
                           MemoryProbe memoryProbe,
                           HttpTransport transport,
                           ExecutorService executor,
                           ScheduledExecutorService scheduler) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.errorReporter = errorReporter;
        this.eventBus = eventBus;
        this.memoryProbe = memoryProbe;
        this.transport = transport;
        this.executor = executor;
        this.scheduler = scheduler;
        this.inspector = new RequestInspector(JsonSupport.mapper(), config.getMaxPayloadBytes());
    }

    /**
     * 使用守护线程，不阻止 JVM 退出
     */
    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public <T> T execute(String pluginId, SandboxOperation<T> operation) {
        return execute(pluginId, operation, SandboxOptions.defaults());
    }

    /**
     * 在沙箱中执行插件操作
     *
     * @throws RateLimitExceededException 超过限流，操作未运行
     * @throws SandboxTimeoutException    超时，取消信号已触发
     * @throws InvocationException        操作抛出受检异常
     */
    public <T> T execute(String pluginId, SandboxOperation<T> operation, SandboxOptions options) {
        long startTime = System.currentTimeMillis();
        String operationId = pluginId + "-" + startTime + "-" + UUID.randomUUID().toString().substring(0, 9);
        ActiveOperation active = new ActiveOperation(operationId, pluginId, startTime);
        long timeoutMs = resolveTimeout(options);
        long memoryLimit = resolveMemoryLimit(options);

        Throwable failure = null;
        try {
            // 1. 限流检查
            enforceRateLimit(pluginId, operationId);
            active.transition(OperationState.RATE_LIMIT_CHECKED);

            // 2. 登记并提交
            activeOperations.put(operationId, active);
            active.transition(OperationState.RUNNING);
            Future<T> future = executor.submit(() -> monitoredExecution(active, operation, memoryLimit));
            active.attach(future);

            // 3. 等待结果
            T result = waitForResult(active, future, timeoutMs);
            active.transition(OperationState.COMPLETED);
            return result;
        } catch (RuntimeException | Error e) {
            failure = e;
            active.transition(OperationState.FAILED);
            throw e;
        } finally {
            cleanupOperation(operationId);
            logExecution(active, System.currentTimeMillis() - startTime, failure);
        }
    }

    private long resolveTimeout(SandboxOptions options) {
        Long timeout = options != null ? options.getTimeoutMs() : null;
        return timeout != null && timeout > 0 ? timeout : config.getDefaultTimeoutMs();
    }

    private long resolveMemoryLimit(SandboxOptions options) {
        Long limit = options != null ? options.getMemoryLimitBytes() : null;
        return limit != null && limit > 0 ? limit : config.getMemoryLimitBytes();
    }

    private void enforceRateLimit(String pluginId, String operationId) {
        if (!rateLimiter.tryAcquire(pluginId)) {
            eventBus.publish(new SandboxViolationEvent(pluginId, operationId, "RATE_LIMIT",
                    config.getRateLimitRequests() + " requests per " + config.getRateLimitWindowMs() + "ms"));
            throw new RateLimitExceededException(pluginId, config.getRateLimitRequests(),
                    config.getRateLimitWindowMs());
        }
    }

    /**
     * 在工作线程中执行并观测内存
     */
    private <T> T monitoredExecution(ActiveOperation active, SandboxOperation<T> operation, long memoryLimit)
            throws Exception {
        long startMemory = memoryProbe.usedBytes();
        try {
            T result = operation.run(active.getSignal());

            long endMemory = memoryProbe.usedBytes();
            long memoryDelta = endMemory - startMemory;
            // 仅告警，操作已完成
            if (startMemory > 0 && memoryDelta > memoryLimit) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("operationId", active.getOperationId());
                context.put("memoryUsage", memoryDelta);
                errorReporter.report(
                        new IllegalStateException("Plugin operation exceeded memory limit: " + memoryDelta + " bytes"),
                        CATEGORY_MEMORY, context);
                eventBus.publish(new SandboxViolationEvent(active.getPluginId(), active.getOperationId(),
                        "MEMORY", memoryDelta + " bytes"));
            }
            return result;
        } catch (Exception e) {
            // 超时取消引发的异常由等待方处理
            if (!active.getSignal().isCancelled()) {
                errorReporter.report(e, CATEGORY_EXECUTION_ERROR, Map.of("operationId", active.getOperationId()));
            }
            throw e;
        }
    }

    private <T> T waitForResult(ActiveOperation active, Future<T> future, long timeoutMs) {
        String pluginId = active.getPluginId();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            active.transition(OperationState.TIMED_OUT);
            active.abort();
            log.error("[Sandbox] Execution timeout ({}ms). Plugin={}, Operation={}",
                    timeoutMs, pluginId, active.getOperationId());
            eventBus.publish(new SandboxViolationEvent(pluginId, active.getOperationId(), "TIMEOUT",
                    timeoutMs + "ms"));
            throw new SandboxTimeoutException(pluginId, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new InvocationException(pluginId, "Plugin operation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            active.abort();
            throw new InvocationException(pluginId, "Plugin operation interrupted", e);
        }
    }

    private void cleanupOperation(String operationId) {
        ActiveOperation operation = activeOperations.remove(operationId);
        if (operation != null && operation.getState() != OperationState.COMPLETED) {
            operation.abort();
        }
    }

    /**
     * 执行指标
     */
    private void logExecution(ActiveOperation active, long executionTime, Throwable failure) {
        String pluginId = active.getPluginId();
        boolean success = failure == null;
        log.debug("[Sandbox] Plugin {} operation {} finished in {}ms, state={}",
                pluginId, active.getOperationId(), executionTime, active.getState());

        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("pluginId", pluginId);
        logData.put("executionTime", executionTime);
        logData.put("success", success);
        logData.put("timestamp", Instant.now().toString());

        if (!success) {
            errorReporter.report(failure, CATEGORY_EXECUTION_FAILED, logData);
        } else if (executionTime > config.getSlowOperationThresholdMs()) {
            log.warn("[Sandbox] Slow operation: plugin {} took {}ms", pluginId, executionTime);
            errorReporter.report(
                    new IllegalStateException("Plugin operation took " + executionTime + "ms"),
                    CATEGORY_PERFORMANCE, logData);
            eventBus.publish(new SlowOperationEvent(pluginId, active.getOperationId(), executionTime));
        }
        eventBus.publish(new ExecutionCompletedEvent(pluginId, active.getOperationId(), executionTime, success));
    }

    /**
     * 检查请求内容，不安全时发布违规事件但不抛出
     */
    public SecurityCheckResult validateRequest(String pluginId, Object payload) {
        SecurityCheckResult result = inspector.inspect(payload);
        if (!result.secure()) {
            log.warn("[Sandbox] Insecure request from plugin {}: {} (risk={})",
                    pluginId, result.issues(), result.riskLevel());
            eventBus.publish(new SandboxViolationEvent(pluginId, null, "PAYLOAD",
                    String.join(", ", result.issues())));
        }
        return result;
    }

    /**
     * 检查请求内容，不安全时抛出 {@link SandboxViolationException}
     */
    public void requireSecureRequest(String pluginId, Object payload) {
        SecurityCheckResult result = validateRequest(pluginId, payload);
        if (!result.secure()) {
            throw new SandboxViolationException(pluginId,
                    "Request rejected for plugin " + pluginId + ": " + String.join(", ", result.issues()),
                    result.issues());
        }
    }

    public IsolatedEnvironment buildIsolatedEnvironment() {
        return buildIsolatedEnvironment("anonymous");
    }

    public IsolatedEnvironment buildIsolatedEnvironment(String pluginId) {
        return new DefaultIsolatedEnvironment(pluginId, transport, scheduler, JsonSupport.mapper(),
                Duration.ofMillis(config.getFetchTimeoutMs()), config.getMaxPayloadBytes());
    }

    public int getActiveOperationCount() {
        return activeOperations.size();
    }

    /**
     * 取消所有活动操作并终止线程池
     */
    public void shutdown() {
        activeOperations.values().forEach(ActiveOperation::abort);
        activeOperations.clear();
        if (!executor.isShutdown()) {
            executor.shutdownNow();
        }
        if (!scheduler.isShutdown()) {
            scheduler.shutdownNow();
        }
        log.debug("[Sandbox] Executor shutdown, thread pools terminated");
    }
}
