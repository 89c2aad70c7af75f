package com.example.docextract.service.polling;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Сигнал отмены одной задачи. Отмена необратима.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * Токен, который никогда не отменяется.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Ждёт отмены не дольше указанного времени.
     *
     * @return true, если токен был отменён
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
