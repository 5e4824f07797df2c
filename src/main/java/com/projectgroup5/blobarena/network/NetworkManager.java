package com.projectgroup5.blobarena.network;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.GameTickScheduler;
import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import com.projectgroup5.blobarena.protocol.GameStatePacket;
import com.projectgroup5.blobarena.protocol.Packet;
import com.projectgroup5.blobarena.protocol.PacketCodec;
import com.projectgroup5.blobarena.protocol.ServerFullPacket;
import com.projectgroup5.blobarena.service.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP 接入层：监听端口、限流、会话注册表、快照广播
 *
 * 随 Spring 容器启动/停止；端口绑定失败会让容器启动失败
 */
@Component
public class NetworkManager implements SmartLifecycle, ClientSession.Listener {
    private static final Logger logger = LoggerFactory.getLogger(NetworkManager.class);

    private static final int REFUSE_WRITE_TIMEOUT_MS = 1000;

    private final GameProperties properties;
    private final GameManager gameManager;
    private final GameTickScheduler tickScheduler;
    private final AuthService authService;
    private final Clock clock;
    private final PacketCodec codec;
    private final ConnectionRateLimiter rateLimiter;

    // sessionId -> session
    private final Map<Integer, ClientSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);

    private volatile boolean running = false;
    private ServerSocket serverSocket;
    private Thread acceptThread;
    private ExecutorService sessionPool;

    public NetworkManager(GameProperties properties,
                          GameManager gameManager,
                          GameTickScheduler tickScheduler,
                          AuthService authService,
                          Clock clock) {
        this.properties = properties;
        this.gameManager = gameManager;
        this.tickScheduler = tickScheduler;
        this.authService = authService;
        this.clock = clock;
        this.codec = new PacketCodec(properties.getNetwork().getMaxMessageSize());
        GameProperties.ConnectRate rate = properties.getNetwork().getConnectRate();
        this.rateLimiter = new ConnectionRateLimiter(rate.getMaxAttempts(), rate.getWindow().toMillis());
    }

    // ==================== 生命周期 ====================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        GameProperties.Network net = properties.getNetwork();
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(net.getHost(), net.getPort()),
                    properties.getServer().getMaxPlayers() * 2);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot bind " + net.getHost() + ":" + net.getPort(), e);
        }

        AtomicInteger threadIds = new AtomicInteger(1);
        sessionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "session-reader-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        running = true;

        acceptThread = new Thread(this::acceptLoop, "net-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        tickScheduler.start(this::broadcastSnapshot);
        logger.info("Server listening on {}:{}", net.getHost(), getLocalPort());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        tickScheduler.stop();

        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing server socket: {}", e.getMessage());
        }

        List<ClientSession> open = new ArrayList<>(sessions.values());
        for (ClientSession session : open) {
            session.close("server shutdown");
        }
        sessions.clear();

        sessionPool.shutdownNow();
        try {
            if (!sessionPool.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.warn("Session threads did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (acceptThread != null) {
            acceptThread.interrupt();
        }
        logger.info("Server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ==================== 接入 ====================

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    logger.error("Accept failed", e);
                }
                break;
            } catch (IOException e) {
                logger.error("Accept failed", e);
                continue;
            }
            handleAccepted(socket);
        }
    }

    void handleAccepted(Socket socket) {
        String address = socket.getInetAddress().getHostAddress();
        if (!rateLimiter.tryAcquire(address, clock.millis())) {
            logger.warn("Connection from {} rate limited", address);
            refuseAsync(socket, "Too many connection attempts, try again later");
            return;
        }
        int maxPlayers = properties.getServer().getMaxPlayers();
        if (sessions.size() >= maxPlayers) {
            logger.info("Connection from {} refused: {} sessions open", address, sessions.size());
            refuseAsync(socket, properties.getNetwork().getServerFullMessage());
            return;
        }

        int id = nextId.getAndIncrement();
        try {
            ClientSession session = new ClientSession(id, socket, codec, authService, gameManager,
                    properties, clock, this);
            // 先注册再启动读线程，广播能看到刚建立的会话
            sessions.put(id, session);
            sessionPool.execute(session);
        } catch (IOException e) {
            logger.warn("Failed to set up session for {}: {}", address, e.getMessage());
            sessions.remove(id);
            closeQuietly(socket);
        }
    }

    /**
     * 拒绝应答交给会话线程池写出，接入线程不会被不读数据的客户端卡住
     */
    private void refuseAsync(Socket socket, String message) {
        try {
            sessionPool.execute(() -> refuse(socket, message));
        } catch (RejectedExecutionException e) {
            logger.debug("Refusal dropped, server stopping");
            closeQuietly(socket);
        }
    }

    void refuse(Socket socket, String message) {
        try {
            socket.setSoTimeout(REFUSE_WRITE_TIMEOUT_MS);
            OutputStream out = socket.getOutputStream();
            PacketCodec.writeFrame(out, codec.frame(
                    new ServerFullPacket(message, properties.getServer().getMaxPlayers(), null)));
        } catch (IOException e) {
            logger.debug("Refusal not delivered: {}", e.getMessage());
        } finally {
            closeQuietly(socket);
        }
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Socket close failed: {}", e.getMessage());
        }
    }

    // ==================== 广播 / 移除 ====================

    /**
     * 每帧由 tick 线程调用（世界锁之外）
     */
    void broadcastSnapshot(GameStateSnapshot snapshot) {
        if (sessions.isEmpty()) {
            return;
        }
        broadcast(GameStatePacket.from(snapshot));
    }

    /**
     * 只编码一次，发给所有 ACTIVE 会话；单个会话写失败只影响它自己
     */
    public void broadcast(Packet packet) {
        byte[] frame = codec.frame(packet);
        for (ClientSession session : sessions.values()) {
            session.deliver(packet, frame);
        }
    }

    /**
     * 注销会话并移除玩家，重复调用无副作用
     */
    public void removeClient(int id) {
        ClientSession session = sessions.remove(id);
        if (session == null) {
            return;
        }
        gameManager.removePlayer(id);
        session.close("removed");
    }

    @Override
    public void onSessionClosed(ClientSession session, String reason) {
        removeClient(session.getId());
    }

    // ==================== 查询 ====================

    public int getLocalPort() {
        ServerSocket s = serverSocket;
        return s == null ? -1 : s.getLocalPort();
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public int getActiveSessionCount() {
        return (int) sessions.values().stream().filter(ClientSession::isActive).count();
    }
}
