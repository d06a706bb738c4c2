package com.eatsense.cache.aggregate;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * 外部协作方调用
 * 只要求"带截止时间调用，返回结果或抛出异常"
 */
@FunctionalInterface
public interface BranchCall<T> {

    CompletionStage<T> call(Instant deadline) throws Exception;

    /**
     * 把阻塞调用适配到指定线程池上执行
     */
    static <T> BranchCall<T> blocking(BlockingCall<T> call, Executor executor) {
        return deadline -> CompletableFuture.supplyAsync(() -> {
            try {
                return call.call(deadline);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @FunctionalInterface
    interface BlockingCall<T> {
        T call(Instant deadline) throws Exception;
    }
}
