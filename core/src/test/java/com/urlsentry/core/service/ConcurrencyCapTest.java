package com.urlsentry.core.service;

import com.urlsentry.core.api.IUrlProbe;
import com.urlsentry.core.http.ProbeResult;
import com.urlsentry.core.model.CheckConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyCapTest {

    /** 동시에 몇 개가 probe 안에 있는지 직접 센다 */
    static final class SlowProbe implements IUrlProbe {
        final AtomicInteger current = new AtomicInteger();
        final AtomicInteger max = new AtomicInteger();

        @Override
        public ProbeResult probe(String url) throws InterruptedException {
            int now = current.incrementAndGet();
            max.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
                return ProbeResult.status(200, 30);
            } finally {
                current.decrementAndGet();
            }
        }
    }

    @Test
    void in_flight_requests_never_exceed_concurrency() {
        SlowProbe probe = new SlowProbe();
        CheckConfig cfg = new CheckConfig().setConcurrency(4).setTimeout(Duration.ofSeconds(5));
        ValidationService svc = new ValidationService(cfg, probe, new RecordingSleeper());

        ValidationRun run = svc.run(TestUrls.numbered(40));

        assertEquals(40, run.outcomes().size());
        assertTrue(probe.max.get() <= 4, "observed in-flight " + probe.max.get());
        assertTrue(run.stats().maxObservedInFlight() <= 4);
        assertTrue(run.stats().maxObservedInFlight() >= 1);
    }

    @Test
    void single_worker_is_sequential() {
        SlowProbe probe = new SlowProbe();
        ValidationService svc = new ValidationService(new CheckConfig().setConcurrency(1), probe, new RecordingSleeper());

        svc.run(TestUrls.numbered(8));

        assertEquals(1, probe.max.get());
    }
}
