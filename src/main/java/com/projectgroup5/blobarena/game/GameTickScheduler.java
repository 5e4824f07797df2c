package com.projectgroup5.blobarena.game;

import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 游戏主循环调度器 - 单线程定时任务，固定频率
 *
 * 数据流:
 * Client Input → ClientSession → 意图 → Tick(持锁) → 快照 → 广播(不持锁) → Clients
 *
 * 由 NetworkManager 在端口绑定后启动和停止
 */
@Component
public class GameTickScheduler {
    private static final Logger logger = LoggerFactory.getLogger(GameTickScheduler.class);

    private final GameManager gameManager;
    private final Duration period;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> tickFuture;

    public GameTickScheduler(GameManager gameManager) {
        this.gameManager = gameManager;
        this.period = Duration.ofNanos(TimeUnit.SECONDS.toNanos(1) / gameManager.getTickRate());
    }

    /**
     * 启动主循环，每帧的快照交给 listener（在锁外调用）
     */
    public synchronized void start(Consumer<GameStateSnapshot> listener) {
        if (tickFuture != null) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("game-tick-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        // shutdown() 等正在执行的那一帧结束
        scheduler.setAwaitTerminationSeconds(1);
        scheduler.initialize();

        tickFuture = scheduler.scheduleAtFixedRate(() -> tick(listener), period);
        logger.info("Tick loop started at {} Hz", gameManager.getTickRate());
    }

    public synchronized void stop() {
        if (tickFuture == null) {
            return;
        }
        tickFuture.cancel(false);
        tickFuture = null;
        scheduler.shutdown();
        scheduler = null;
        logger.info("Tick loop stopped");
    }

    public synchronized boolean isRunning() {
        return tickFuture != null;
    }

    public Duration getPeriod() {
        return period;
    }

    // 异常不能逃出任务，否则 ScheduledExecutorService 会取消后续执行
    private void tick(Consumer<GameStateSnapshot> listener) {
        try {
            GameStateSnapshot snapshot = gameManager.tick();
            listener.accept(snapshot);
        } catch (Exception e) {
            logger.error("Error processing tick", e);
        }
    }
}
