package com.eatsense.cache.aggregate;

import com.eatsense.cache.config.CacheProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 容错并行聚合器
 * 同时发起所有分支，等待全部完成或各自超时后再组装结果（join-all）
 *
 * <p>特性：
 * 1. 分支隔离：任一分支的异常或超时只降级该分支
 * 2. 分支私有超时：超时返回兜底值，底层调用不取消，迟到的结果只写缓存不回给调用方
 * 3. 冷却跳过：超时后写入跳过标记，冷却期内直接返回缓存结果或兜底值
 * 4. 整体兜底：聚合流程本身出错时返回全量默认结果，从不抛异常</p>
 */
@Service
public class FanOutAggregator {

    private static final Logger log = LoggerFactory.getLogger(FanOutAggregator.class);

    // 整体截止时间之外的额外等待，覆盖跳过标记检查等存储调用
    private static final Duration JOIN_GRACE = Duration.ofSeconds(1);

    private final SkipFlagGate skipFlagGate;
    private final ExecutorService branchExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final MeterRegistry meterRegistry;
    private final CacheProperties.AggregatorConfig config;

    private final Timer aggregateTimer;

    public FanOutAggregator(SkipFlagGate skipFlagGate,
                            @Qualifier("branchExecutor") ExecutorService branchExecutor,
                            @Qualifier("branchTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                            MeterRegistry meterRegistry,
                            CacheProperties properties) {
        this.skipFlagGate = skipFlagGate;
        this.branchExecutor = branchExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.meterRegistry = meterRegistry;
        this.config = properties.getAggregator();

        this.aggregateTimer = Timer.builder("cache.aggregate.latency")
            .description("Fan-out aggregate latency")
            .register(meterRegistry);
    }

    /**
     * 执行聚合
     *
     * @param callerId        调用方标识（跳过标记和缓存结果的作用域）
     * @param branches        分支定义
     * @param overallDeadline 整体截止时间
     * @return 聚合结果，永不抛异常
     */
    public CompositeResult aggregate(String callerId, List<BranchSpec<?>> branches, Duration overallDeadline) {
        long start = System.nanoTime();
        try {
            CompositeResult composite = doAggregate(callerId, branches, overallDeadline, start);
            aggregateTimer.record(composite.totalMs(), TimeUnit.MILLISECONDS);
            return composite;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Aggregation interrupted for caller {}", callerId);
            return CompositeResult.allDefaults(branches, elapsedMs(start), "interrupted");
        } catch (RuntimeException | ExecutionException e) {
            log.error("Error aggregating data for caller {}: {}", callerId, e.getMessage(), e);
            return CompositeResult.allDefaults(branches, elapsedMs(start), e.getMessage());
        }
    }

    private CompositeResult doAggregate(String callerId, List<BranchSpec<?>> branches,
                                        Duration overallDeadline, long start)
            throws InterruptedException, ExecutionException {
        Instant deadline = Instant.now().plus(overallDeadline);

        List<CompletableFuture<? extends BranchResult<?>>> futures = new ArrayList<>(branches.size());
        for (BranchSpec<?> spec : branches) {
            futures.add(runBranch(callerId, spec, overallDeadline, deadline));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(overallDeadline.plus(JOIN_GRACE).toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Aggregation join exceeded deadline for caller {}, degrading unfinished branches", callerId);
        }

        Map<String, BranchResult<?>> results = new LinkedHashMap<>();
        for (int i = 0; i < branches.size(); i++) {
            BranchSpec<?> spec = branches.get(i);
            BranchResult<?> result = futures.get(i).getNow(null);
            if (result == null) {
                result = BranchResult.degraded(spec.getName(), BranchOutcome.TIMEOUT,
                    spec.fallbackValue(), elapsedMs(start), "join deadline exceeded");
            }
            results.put(spec.getName(), result);
            meterRegistry.counter("cache.aggregate.branch",
                "branch", spec.getName(),
                "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();
        }

        long totalMs = elapsedMs(start);
        if (totalMs > config.getSlowThresholdMs()) {
            log.warn("Slow aggregate: {}ms for caller {} - {}", totalMs, callerId, timings(results));
        }
        return new CompositeResult(results, totalMs, false);
    }

    private <T> CompletableFuture<BranchResult<T>> runBranch(String callerId, BranchSpec<T> spec,
                                                             Duration overallDeadline, Instant deadline) {
        long branchStart = System.nanoTime();
        return CompletableFuture
            .supplyAsync(() -> spec.isCoolDown() && skipFlagGate.isCoolingDown(spec, callerId), branchExecutor)
            .thenCompose(coolingDown -> coolingDown
                ? CompletableFuture.supplyAsync(() -> serveSkipped(callerId, spec, branchStart), branchExecutor)
                : invoke(callerId, spec, overallDeadline, deadline, branchStart))
            .exceptionally(ex -> {
                Throwable cause = unwrap(ex);
                log.warn("Branch {} failed for caller {}: {}", spec.getName(), callerId, cause.getMessage());
                return BranchResult.degraded(spec.getName(), BranchOutcome.ERROR,
                    spec.fallbackValue(), elapsedMs(branchStart), cause.getMessage());
            });
    }

    private <T> BranchResult<T> serveSkipped(String callerId, BranchSpec<T> spec, long branchStart) {
        T cached = skipFlagGate.lastResult(spec, callerId);
        if (cached != null) {
            log.debug("Branch {} cooling down for caller {}, serving cached result", spec.getName(), callerId);
            return BranchResult.degraded(spec.getName(), BranchOutcome.PARTIAL, cached,
                elapsedMs(branchStart), "cooling down");
        }
        log.debug("Branch {} cooling down for caller {}, serving fallback", spec.getName(), callerId);
        return BranchResult.degraded(spec.getName(), BranchOutcome.SKIPPED, spec.fallbackValue(),
            elapsedMs(branchStart), "cooling down");
    }

    private <T> CompletableFuture<BranchResult<T>> invoke(String callerId, BranchSpec<T> spec,
                                                          Duration overallDeadline, Instant deadline,
                                                          long branchStart) {
        Duration timeout = spec.effectiveTimeout(overallDeadline);
        CompletableFuture<T> call = start(spec, deadline);

        if (spec.isCoolDown()) {
            // 迟到的成功结果也会写缓存，但不会交给已经拿到兜底值的调用方
            call.thenAcceptAsync(value -> {
                if (spec.getCacheable().test(value)) {
                    skipFlagGate.rememberResult(spec, callerId, value, resultTtl(spec));
                }
            }, branchExecutor);
        }

        TimeLimiter timeLimiter = TimeLimiter.of("branch-" + spec.getName(), TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(false)
            .build());

        // 结果处理（含跳过标记写入）回到分支线程池，计时线程只负责触发超时
        return timeLimiter.executeCompletionStage(timeoutScheduler, () -> call)
            .toCompletableFuture()
            .handleAsync((value, ex) -> {
                long elapsed = elapsedMs(branchStart);
                if (ex == null) {
                    return BranchResult.success(spec.getName(), value, elapsed);
                }
                Throwable cause = unwrap(ex);
                if (cause instanceof TimeoutException) {
                    log.warn("Branch {} timeout for caller {} after {}ms", spec.getName(), callerId, timeout.toMillis());
                    if (spec.isCoolDown()) {
                        skipFlagGate.startCoolDown(spec, callerId, skipTtl(spec));
                    }
                    return BranchResult.degraded(spec.getName(), BranchOutcome.TIMEOUT,
                        spec.fallbackValue(), elapsed, "timeout after " + timeout.toMillis() + "ms");
                }
                log.warn("Branch {} failed for caller {}: {}", spec.getName(), callerId, cause.getMessage());
                return BranchResult.degraded(spec.getName(), BranchOutcome.ERROR,
                    spec.fallbackValue(), elapsed, cause.getMessage());
            }, branchExecutor);
    }

    /**
     * 同步抛出的异常也转成失败的 Future，避免影响其他分支
     */
    private <T> CompletableFuture<T> start(BranchSpec<T> spec, Instant deadline) {
        try {
            return spec.getCall().call(deadline).toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private int skipTtl(BranchSpec<?> spec) {
        return spec.getSkipTtlSeconds() != null ? spec.getSkipTtlSeconds() : config.getSkipTtlSeconds();
    }

    private int resultTtl(BranchSpec<?> spec) {
        return spec.getResultTtlSeconds() != null ? spec.getResultTtlSeconds() : config.getResultTtlSeconds();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String timings(Map<String, BranchResult<?>> results) {
        return results.values().stream()
            .map(r -> r.name() + "=" + r.elapsedMs() + "ms")
            .collect(Collectors.joining(" "));
    }
}
