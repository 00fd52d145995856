package com.questrail.bamboo.internal.exec;

import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class EventLoopOwnerThreadTest {

    private RecordingObservabilitySink sink;
    private EventLoopOwnerThread loop;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        loop = new EventLoopOwnerThread("test-ui", sink);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void dedicatedLoopRunsTasksInOrderOnItsThread() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        loop.post(() -> order.add("queued before start"));
        loop.start();
        loop.post(() -> {
            threadName.set(Thread.currentThread().getName());
            order.add("second");
        });
        loop.post(done::countDown);

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("queued before start", "second"), order);
        assertEquals("test-ui", threadName.get());
        assertFalse(loop.isOwnerThread());
    }

    @Test
    void executeRunsInlineOnOwner() throws InterruptedException {
        AtomicBoolean inline = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        loop.start();

        loop.post(() -> {
            boolean[] ran = new boolean[1];
            loop.execute(() -> ran[0] = true);
            inline.set(ran[0] && loop.isOwnerThread());
            done.countDown();
        });

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(inline.get());
    }

    @Test
    void failingTaskIsReportedAndLoopContinues() throws InterruptedException {
        CountDownLatch after = new CountDownLatch(1);
        loop.start();

        loop.post(() -> {
            throw new IllegalStateException("bad task");
        });
        loop.post(after::countDown);

        assertTrue(after.await(1, TimeUnit.SECONDS));
        List<BridgeErrorEvent> errors = sink.eventsOfType(BridgeErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals("UI task failed", errors.get(0).message());
    }

    @Test
    void runOnCurrentThreadAdoptsCallerUntilStop() throws InterruptedException {
        AtomicBoolean ownerInside = new AtomicBoolean(false);
        Thread runner = new Thread(() -> {
            loop.post(() -> {
                ownerInside.set(loop.isOwnerThread());
                loop.stop();
            });
            loop.runOnCurrentThread();
        });

        runner.start();
        runner.join(2000);

        assertFalse(runner.isAlive());
        assertTrue(ownerInside.get());
        assertFalse(loop.isRunning());
    }

    @Test
    void postAfterStopIsDropped() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);
        loop.start();
        loop.stop();

        loop.post(() -> ran.set(true));
        Thread.sleep(50);

        assertFalse(ran.get());
    }

    @Test
    void runAsOwnerMakesExecuteInlineWhenLoopIsIdle() {
        boolean[] inline = new boolean[1];

        loop.runAsOwner(() -> loop.execute(() -> inline[0] = loop.isOwnerThread()));

        assertTrue(inline[0]);
        assertFalse(loop.isOwnerThread());
    }

    @Test
    void runAsOwnerRefusesWhileRunning() {
        loop.start();
        assertThrows(IllegalStateException.class, () -> loop.runAsOwner(() -> { }));
    }

    @Test
    void secondRunIsRejected() {
        loop.start();
        assertThrows(IllegalStateException.class, loop::runOnCurrentThread);
    }
}
