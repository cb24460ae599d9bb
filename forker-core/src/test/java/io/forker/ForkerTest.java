package io.forker;

import org.junit.jupiter.api.Test;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForkerTest {

    @Test
    void runningCountNeverExceedsCapacity() throws Exception {
        Forker forker = new Forker(2);
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Object> completed = new CopyOnWriteArrayList<>();
        AtomicInteger allCompleteCalls = new AtomicInteger();
        CountDownLatch allDone = new CountDownLatch(1);
        forker.onItemComplete((state, error) -> completed.add(state))
                .onAllComplete(() -> {
                    allCompleteCalls.incrementAndGet();
                    allDone.countDown();
                });

        for (int i = 0; i < 5; i++) {
            forker.submit(() -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                maxRunning.accumulateAndGet(forker.countRunning(), Math::max);
                await(gate);
                sleep(20);
                active.decrementAndGet();
            }, i);
        }

        assertEquals(2, forker.countRunning());
        assertEquals(3, forker.countPending());

        gate.countDown();

        assertTrue(forker.join(5_000));
        assertTrue(allDone.await(5, TimeUnit.SECONDS));
        assertEquals(1, allCompleteCalls.get());
        assertTrue(maxActive.get() <= 2, "max active was " + maxActive.get());
        assertTrue(maxRunning.get() <= 2, "max running was " + maxRunning.get());
        assertEquals(5, completed.size());
        assertTrue(completed.containsAll(List.of(0, 1, 2, 3, 4)));
    }

    @Test
    void unboundedForkerNeverQueues() throws Exception {
        Forker forker = new Forker(0);
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger items = new AtomicInteger();
        AtomicInteger allCompleteCalls = new AtomicInteger();
        AtomicInteger runningAtAllComplete = new AtomicInteger(-1);
        AtomicInteger pendingAtAllComplete = new AtomicInteger(-1);
        CountDownLatch allDone = new CountDownLatch(1);
        forker.onItemComplete((state, error) -> items.incrementAndGet())
                .onAllComplete(() -> {
                    allCompleteCalls.incrementAndGet();
                    runningAtAllComplete.set(forker.countRunning());
                    pendingAtAllComplete.set(forker.countPending());
                    allDone.countDown();
                });

        for (int i = 0; i < 100; i++) {
            forker.submit(() -> await(gate));
        }

        assertEquals(0, forker.countPending());
        assertEquals(100, forker.countRunning());

        gate.countDown();

        assertTrue(allDone.await(5, TimeUnit.SECONDS));
        assertTrue(forker.join(5_000));
        assertEquals(100, items.get());
        assertEquals(1, allCompleteCalls.get());
        assertEquals(0, runningAtAllComplete.get());
        assertEquals(0, pendingAtAllComplete.get());
    }

    @Test
    void failedTaskStillReachesAllComplete() throws Exception {
        Forker forker = new Forker(2);
        Map<Object, Throwable> errors = new ConcurrentHashMap<>();
        List<Object> succeeded = new CopyOnWriteArrayList<>();
        CountDownLatch allDone = new CountDownLatch(1);
        IllegalStateException boom = new IllegalStateException("boom");
        forker.onItemComplete((state, error) -> {
                    if (error != null) {
                        errors.put(state, error);
                    } else {
                        succeeded.add(state);
                    }
                })
                .onAllComplete(allDone::countDown);

        forker.submit(() -> sleep(10), "ok-1")
                .submit(() -> { throw boom; }, "bad")
                .submit(() -> sleep(10), "ok-2");

        assertTrue(forker.join(5_000));
        assertTrue(allDone.await(5, TimeUnit.SECONDS));
        assertEquals(1, errors.size());
        assertSame(boom, errors.get("bad"));
        assertEquals(2, succeeded.size());
        assertTrue(succeeded.containsAll(List.of("ok-1", "ok-2")));
    }

    @Test
    void queuedTaskWaitsForRunningTaskWithCapacityOne() throws Exception {
        Forker forker = new Forker(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicBoolean secondStarted = new AtomicBoolean();
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger allCompleteCalls = new AtomicInteger();
        AtomicInteger itemsAtAllComplete = new AtomicInteger(-1);
        CountDownLatch allDone = new CountDownLatch(1);
        forker.onItemComplete((state, error) -> order.add("done:" + state))
                .onAllComplete(() -> {
                    allCompleteCalls.incrementAndGet();
                    itemsAtAllComplete.set(order.size());
                    allDone.countDown();
                });

        forker.submit(() -> {
            order.add("start:T1");
            await(releaseFirst);
        }, "T1");
        forker.submit(() -> {
            secondStarted.set(true);
            order.add("start:T2");
        }, "T2");

        assertEquals(1, forker.countRunning());
        assertEquals(1, forker.countPending());
        sleep(50);
        assertFalse(secondStarted.get());
        assertEquals(1, forker.countRunning());

        releaseFirst.countDown();

        assertTrue(forker.join(5_000));
        assertTrue(allDone.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("start:T1", "done:T1", "start:T2", "done:T2"), order);
        assertEquals(1, allCompleteCalls.get());
        assertEquals(4, itemsAtAllComplete.get());
    }

    @Test
    void joinBlocksUntilWorkFinishes() throws Exception {
        Forker forker = new Forker(1);
        CountDownLatch release = new CountDownLatch(1);
        forker.submit(() -> await(release));

        AtomicBoolean joined = new AtomicBoolean();
        AtomicReference<Throwable> joinError = new AtomicReference<>();
        Thread joiner = new Thread(() -> {
            try {
                forker.join();
                joined.set(true);
            } catch (Throwable t) {
                joinError.set(t);
            }
        });
        joiner.start();

        assertFalse(forker.join(50));
        assertFalse(joined.get());

        release.countDown();
        joiner.join(5_000);

        assertNull(joinError.get());
        assertTrue(joined.get());
        assertEquals(0, forker.countRunning());
    }

    @Test
    void severalJoinersAreAllReleased() throws Exception {
        Forker forker = new Forker(2);
        CountDownLatch release = new CountDownLatch(1);
        forker.submit(() -> await(release)).submit(() -> await(release)).submit(() -> await(release));

        List<Thread> joiners = new ArrayList<>();
        AtomicInteger released = new AtomicInteger();
        for (int i = 0; i < 4; i++) {
            Thread joiner = new Thread(() -> {
                try {
                    if (forker.join(5_000)) {
                        released.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            joiners.add(joiner);
            joiner.start();
        }

        release.countDown();
        for (Thread joiner : joiners) {
            joiner.join(5_000);
        }

        assertEquals(4, released.get());
    }

    @Test
    void interruptedJoinThrows() throws Exception {
        Forker forker = new Forker(1);
        CountDownLatch release = new CountDownLatch(1);
        forker.submit(() -> await(release));

        AtomicReference<Throwable> joinError = new AtomicReference<>();
        Thread joiner = new Thread(() -> {
            try {
                forker.join();
            } catch (Throwable t) {
                joinError.set(t);
            }
        });
        joiner.start();
        sleep(20);
        joiner.interrupt();
        joiner.join(5_000);

        assertInstanceOf(InterruptedException.class, joinError.get());
        assertEquals(1, forker.countRunning());

        release.countDown();
        assertTrue(forker.join(5_000));
    }

    @Test
    void capacityHoldsUnderConcurrentSubmitters() throws Exception {
        Forker forker = new Forker(3);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        forker.onItemComplete((state, error) -> completed.incrementAndGet());

        CountDownLatch ready = new CountDownLatch(1);
        List<Thread> submitters = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            Thread submitter = new Thread(() -> {
                await(ready);
                for (int i = 0; i < 50; i++) {
                    forker.submit(() -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        LockSupport.parkNanos(TimeUnit.MICROSECONDS.toNanos(200));
                        active.decrementAndGet();
                    });
                }
            });
            submitters.add(submitter);
            submitter.start();
        }

        ready.countDown();
        for (Thread submitter : submitters) {
            submitter.join(10_000);
        }

        assertTrue(forker.join(10_000));
        assertEquals(400, completed.get());
        assertTrue(maxActive.get() <= 3, "max active was " + maxActive.get());
        assertEquals(0, forker.countPending());
    }

    @Test
    void backlogLeftOnShutDownPoolIsFailedAndJoinReturns() throws Exception {
        int backlog = 50_000;
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Forker forker = Forker.builder().maxAllowed(1).executor(pool).build();
            CountDownLatch gate = new CountDownLatch(1);
            CountDownLatch allDone = new CountDownLatch(1);
            AtomicInteger callbacks = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            forker.onItemComplete((state, error) -> {
                        callbacks.incrementAndGet();
                        if (error instanceof RejectedExecutionException) {
                            rejected.incrementAndGet();
                        }
                    })
                    .onAllComplete(allDone::countDown);

            forker.submit(() -> await(gate), "gate");
            for (int i = 0; i < backlog; i++) {
                forker.submit(() -> { }, i);
            }
            assertEquals(backlog, forker.countPending());

            pool.shutdown();
            gate.countDown();

            assertTrue(forker.join(10_000));
            assertTrue(allDone.await(5, TimeUnit.SECONDS));
            assertEquals(backlog + 1, callbacks.get());
            assertEquals(backlog, rejected.get());
            assertEquals(0, forker.countRunning());
            assertEquals(0, forker.countPending());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void joinWithUnboundedDurationWaitsForWork() throws Exception {
        Forker forker = new Forker(1);
        CountDownLatch release = new CountDownLatch(1);
        forker.submit(() -> await(release));
        Thread releaser = new Thread(() -> {
            sleep(50);
            release.countDown();
        });
        releaser.start();

        assertTrue(forker.join(ChronoUnit.FOREVER.getDuration()));
        assertEquals(0, forker.countRunning());
        releaser.join(5_000);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
