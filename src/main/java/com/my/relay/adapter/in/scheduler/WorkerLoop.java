package com.my.relay.adapter.in.scheduler;

import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 왜: 폴러와 처리기가 같은 수명 주기(단일 스레드, 협조적 취소, 사이클 후 대기)를 공유하도록 하기 위함.
 * <p>
 * 종료는 running 플래그를 내리고 작업 스레드를 interrupt 하는 것으로만 이뤄진다. 대기와 HTTP 호출은 interrupt에 반응한다.
 */
abstract class WorkerLoop {

    private static final Logger log = Logger.getLogger(WorkerLoop.class);

    private static final long STOP = -1L;

    private final String name;
    private final int shutdownTimeoutSeconds;
    private final long errorBackoffMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService executor;

    protected WorkerLoop(String name, int shutdownTimeoutSeconds, long errorBackoffMillis) {
        this.name = name;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.errorBackoffMillis = errorBackoffMillis;
    }

    /**
     * 한 사이클을 수행하고 다음 사이클까지 대기할 밀리초를 돌려준다.
     */
    abstract long runCycle();

    /**
     * runCycle에서 빠져나온 예외와 Error는 로그 후 errorBackoffMillis만큼 쉰다. 종료 중 중단이면 음수를 돌려준다.
     */
    long cycle() {
        try {
            return runCycle();
        } catch (RuntimeException | Error e) {
            if (Thread.currentThread().isInterrupted()) {
                log.infof("%s 루프가 종료 요청으로 진행 중인 작업을 중단했습니다: %s", name, e);
                return STOP;
            }
            log.errorf(e, "%s 루프 사이클에서 처리되지 않은 오류", name);
            return errorBackoffMillis;
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException(name + " 루프가 이미 실행 중입니다.");
        }
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(this::loop);
        log.infof("%s 루프를 시작했습니다.", name);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warnf("%s 루프가 %d초 안에 종료되지 않았습니다.", name, shutdownTimeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.infof("%s 루프를 중지했습니다.", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void loop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            long delayMillis = cycle();
            if (delayMillis == STOP || !pause(delayMillis)) {
                break;
            }
        }
        log.debugf("%s 루프 스레드를 종료합니다.", name);
    }

    private boolean pause(long delayMillis) {
        if (delayMillis <= 0) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
