package com.example.docextract.service.polling;

import java.time.Duration;

/**
 * Пауза между попытками опроса. Пауза прерывается отменой токена.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration, CancellationToken token) throws InterruptedException;

    static Sleeper cancellable() {
        return (duration, token) -> token.await(duration);
    }
}
