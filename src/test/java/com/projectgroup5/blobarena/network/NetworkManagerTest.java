package com.projectgroup5.blobarena.network;

import com.projectgroup5.blobarena.GameFixtures;
import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.GameTickScheduler;
import com.projectgroup5.blobarena.service.AuthService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class NetworkManagerTest {

    private NetworkManager networkManager;
    private GameTickScheduler tickScheduler;

    @BeforeEach
    void setUp() {
        GameProperties props = GameFixtures.properties();
        props.getNetwork().setHost("127.0.0.1");
        props.getNetwork().setPort(0);
        // 每个连接都会被限流拒绝
        props.getNetwork().getConnectRate().setMaxAttempts(0);
        GameManager gameManager = GameFixtures.gameManager(props);
        tickScheduler = mock(GameTickScheduler.class);
        networkManager = new NetworkManager(props, gameManager, tickScheduler,
                new AuthService(gameManager, props), GameFixtures.fixedClock());
        networkManager.start();
    }

    @AfterEach
    void tearDown() {
        networkManager.stop();
    }

    @Test
    @DisplayName("Lifecycle binds a port and drives the tick scheduler")
    void start_bindsPortAndStartsTicking() {
        assertThat(networkManager.isRunning()).isTrue();
        assertThat(networkManager.getLocalPort()).isPositive();
        verify(tickScheduler).start(any());

        networkManager.stop();

        assertThat(networkManager.isRunning()).isFalse();
        verify(tickScheduler).stop();
    }

    @Test
    @DisplayName("A refused client that never reads does not block the accept path")
    void refusal_isWrittenOffTheAcceptThread() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> writerThread = new AtomicReference<>();
        OutputStream stalled = new OutputStream() {
            @Override
            public void write(int b) {
                write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                writerThread.set(Thread.currentThread().getName());
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        Socket socket = mock(Socket.class);
        when(socket.getInetAddress()).thenReturn(InetAddress.getLoopbackAddress());
        when(socket.getOutputStream()).thenReturn(stalled);

        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> networkManager.handleAccepted(socket));

        await().atMost(Duration.ofSeconds(3)).until(() -> writerThread.get() != null);
        assertThat(writerThread.get()).startsWith("session-reader-");
        release.countDown();
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> verify(socket).close());
        assertThat(networkManager.getSessionCount()).isZero();
    }
}
