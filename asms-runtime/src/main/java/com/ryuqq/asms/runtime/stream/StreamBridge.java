package com.ryuqq.asms.runtime.stream;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider 스트림을 호출자 소유 outbound 큐로 전달하는 브리지.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>워커 하나가 provider를 실행하며 bounded 내부 버퍼에 항목을 넣음</li>
 *   <li>워커 종료 결과는 용량 1의 결과 큐로 전달</li>
 *   <li>호출 스레드는 내부 버퍼를 생산 순서대로 outbound로 전달</li>
 *   <li>워커가 끝나면 남은 항목을 모두 전달한 뒤 반환 (또는 provider 에러를 던짐)</li>
 *   <li>컨텍스트가 종료되면 {@code ctx.err()}를 그대로 던지고 남은 항목은 버림</li>
 * </ol>
 *
 * <p>반환 시 워커 컨텍스트를 취소하므로 워커는 다음 send에서 종료됩니다.
 * outbound는 닫지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StreamBridge {

    private static final Logger log = LoggerFactory.getLogger(StreamBridge.class);

    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final StreamConfig config;
    private final ExecutorService workers;

    public StreamBridge() {
        this(new StreamConfig());
    }

    public StreamBridge(StreamConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "asms-stream-worker-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Provider 스트림을 outbound로 전달.
     *
     * @param ctx 호출 컨텍스트
     * @param producer provider 스트림
     * @param mapper provider 항목을 StreamChunk로 변환
     * @param outbound 호출자 소유 큐
     * @param <T> provider 항목 타입
     * @throws com.ryuqq.asms.core.context.ContextCancelledException 컨텍스트 종료 시 (ctx.err() 그대로)
     * @throws RuntimeException provider가 던진 예외
     */
    public <T> void bridge(
        CallContext ctx,
        StreamProducer<T> producer,
        Function<? super T, StreamChunk> mapper,
        BlockingQueue<StreamChunk> outbound
    ) {
        if (producer == null || mapper == null || outbound == null) {
            throw new IllegalArgumentException("producer, mapper and outbound cannot be null");
        }
        ctx.throwIfDone();

        CallContext workerCtx = ctx.withCancel();
        BlockingQueue<T> providerQueue = new ArrayBlockingQueue<>(config.providerBufferCapacity());
        BlockingQueue<WorkerResult> resultQueue = new ArrayBlockingQueue<>(1);

        workers.execute(() -> {
            WorkerResult result;
            try {
                producer.produce(workerCtx, item -> enqueue(workerCtx, providerQueue, item));
                result = WorkerResult.COMPLETED;
            } catch (RuntimeException | Error e) {
                result = new WorkerResult(e);
            }
            resultQueue.offer(result);
        });

        int forwarded = 0;
        try {
            while (true) {
                ctx.throwIfDone();
                T item = providerQueue.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
                if (item != null) {
                    forward(ctx, outbound, mapper.apply(item));
                    forwarded++;
                    continue;
                }
                WorkerResult result = resultQueue.poll();
                if (result == null) {
                    continue;
                }
                T rest;
                while ((rest = providerQueue.poll()) != null) {
                    forward(ctx, outbound, mapper.apply(rest));
                    forwarded++;
                }
                if (result.error() != null) {
                    log.debug("Stream ended with error after {} chunks: {}", forwarded, result.error().getMessage());
                    throwUnchecked(result.error());
                }
                log.debug("Stream completed with {} chunks", forwarded);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnitException(ErrorCode.INTERNAL_ERROR, null, "stream interrupted", null, e);
        } finally {
            workerCtx.cancel();
        }
    }

    /**
     * 워커 풀 종료.
     */
    public void shutdown() {
        workers.shutdownNow();
    }

    private <T> void enqueue(CallContext ctx, BlockingQueue<T> queue, T item) {
        try {
            while (!queue.offer(item, config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                ctx.throwIfDone();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnitException(ErrorCode.INTERNAL_ERROR, null, "stream worker interrupted", null, e);
        }
    }

    private void forward(CallContext ctx, BlockingQueue<StreamChunk> outbound, StreamChunk chunk)
        throws InterruptedException {
        while (!outbound.offer(chunk, config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
            ctx.throwIfDone();
        }
    }

    private static void throwUnchecked(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        throw UnitException.wrap("stream", error);
    }

    private record WorkerResult(Throwable error) {
        static final WorkerResult COMPLETED = new WorkerResult(null);
    }
}
