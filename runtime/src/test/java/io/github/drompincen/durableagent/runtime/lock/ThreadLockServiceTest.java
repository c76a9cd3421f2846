package io.github.drompincen.durableagent.runtime.lock;

import io.github.drompincen.durableagent.runtime.checkpoint.StateStoreException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ThreadLockServiceTest {

    @Test
    void acquireAndReleaseCleansUpEntry() {
        ThreadLockService service = new ThreadLockService(1000);

        try (ThreadLockService.Lease lease = service.acquire("t1")) {
            assertThat(lease.threadId()).isEqualTo("t1");
            assertThat(service.isLocked("t1")).isTrue();
        }

        assertThat(service.isLocked("t1")).isFalse();
        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void closingTwiceIsHarmless() {
        ThreadLockService service = new ThreadLockService(1000);
        ThreadLockService.Lease lease = service.acquire("t1");

        lease.close();
        lease.close();

        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void differentThreadsDoNotBlockEachOther() throws Exception {
        ThreadLockService service = new ThreadLockService(100);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try (ThreadLockService.Lease ignored = service.acquire("t1")) {
            Future<Boolean> other = pool.submit(() -> {
                try (ThreadLockService.Lease lease = service.acquire("t2")) {
                    return service.isLocked("t2");
                }
            });
            assertThat(other.get(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waiterTimesOutWithThreadBusy() throws Exception {
        ThreadLockService service = new ThreadLockService(50);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try (ThreadLockService.Lease ignored = service.acquire("t1")) {
            Future<?> waiter = pool.submit(() -> service.acquire("t1"));
            assertThatThrownBy(() -> waiter.get(2, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ThreadBusyException.class);
        } finally {
            pool.shutdownNow();
        }
        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void sameThreadTurnsAreSerialized() throws Exception {
        ThreadLockService service = new ThreadLockService(5000);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 4; i++) {
                pool.submit(() -> {
                    start.await();
                    try (ThreadLockService.Lease lease = service.acquire("t1")) {
                        int now = active.incrementAndGet();
                        maxActive.accumulateAndGet(now, Math::max);
                        Thread.sleep(20);
                        active.decrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxActive).hasValue(1);
        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void waitsForLeaseHeldByAnotherInstance() {
        ThreadLeaseStore leases = mock(ThreadLeaseStore.class);
        when(leases.tryAcquire(eq("t1"), anyString())).thenReturn(false, false, true);
        ThreadLockService service = new ThreadLockService(leases, 2000);

        try (ThreadLockService.Lease lease = service.acquire("t1")) {
            assertThat(service.isLocked("t1")).isTrue();
        }

        ArgumentCaptor<String> owner = ArgumentCaptor.forClass(String.class);
        verify(leases, times(3)).tryAcquire(eq("t1"), owner.capture());
        assertThat(owner.getAllValues()).containsOnly(owner.getValue());
        verify(leases).release("t1", owner.getValue());
        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void leaseNeverGrantedFailsWithThreadBusy() {
        ThreadLeaseStore leases = mock(ThreadLeaseStore.class);
        when(leases.tryAcquire(eq("t1"), anyString())).thenReturn(false);
        ThreadLockService service = new ThreadLockService(leases, 100);

        assertThatThrownBy(() -> service.acquire("t1")).isInstanceOf(ThreadBusyException.class);

        assertThat(service.isLocked("t1")).isFalse();
        assertThat(service.trackedThreads()).isZero();
        verify(leases, never()).release(anyString(), anyString());
    }

    @Test
    void leaseStoreOutageReleasesLocalLock() {
        ThreadLeaseStore leases = mock(ThreadLeaseStore.class);
        when(leases.tryAcquire(eq("t1"), anyString())).thenThrow(new StateStoreException("mongo down"));
        ThreadLockService service = new ThreadLockService(leases, 1000);

        assertThatThrownBy(() -> service.acquire("t1")).isInstanceOf(StateStoreException.class);

        assertThat(service.trackedThreads()).isZero();
    }

    @Test
    void failedLeaseReleaseStillFreesThreadLocally() {
        ThreadLeaseStore leases = mock(ThreadLeaseStore.class);
        when(leases.tryAcquire(eq("t1"), anyString())).thenReturn(true);
        doThrow(new StateStoreException("mongo down")).when(leases).release(eq("t1"), anyString());
        ThreadLockService service = new ThreadLockService(leases, 1000);

        service.acquire("t1").close();

        assertThat(service.isLocked("t1")).isFalse();
        assertThat(service.trackedThreads()).isZero();
    }
}
