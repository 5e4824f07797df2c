package com.projectgroup5.blobarena.network;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.Point;
import com.projectgroup5.blobarena.protocol.ConnectPacket;
import com.projectgroup5.blobarena.protocol.GameStatePacket;
import com.projectgroup5.blobarena.protocol.MovePacket;
import com.projectgroup5.blobarena.protocol.Packet;
import com.projectgroup5.blobarena.protocol.PacketCodec;
import com.projectgroup5.blobarena.protocol.PacketType;
import com.projectgroup5.blobarena.protocol.PingPacket;
import com.projectgroup5.blobarena.protocol.PlayerIdPacket;
import com.projectgroup5.blobarena.protocol.PongPacket;
import com.projectgroup5.blobarena.protocol.Position;
import com.projectgroup5.blobarena.protocol.ProtocolException;
import com.projectgroup5.blobarena.protocol.ServerFullPacket;
import com.projectgroup5.blobarena.protocol.SkillPacket;
import com.projectgroup5.blobarena.protocol.UsernameTakenPacket;
import com.projectgroup5.blobarena.service.AuthService;
import com.projectgroup5.blobarena.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个 TCP 连接：读线程解析帧并分发，写入交给 {@link OutboundChannel}
 *
 * 握手：connect → player_id；重名时回 username_taken 并允许重试一次，
 * 第二次仍重名或服务器已满则回包后关闭
 */
public class ClientSession implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientSession.class);

    private static final int MAX_NAME_ATTEMPTS = 2;

    /**
     * 会话关闭回调（由 NetworkManager 注册，会话不持有管理器本身）
     */
    public interface Listener {
        void onSessionClosed(ClientSession session, String reason);
    }

    @FunctionalInterface
    private interface PacketHandler {
        void handle(Packet packet) throws IOException;
    }

    private final int id;
    private final Socket socket;
    private final PacketCodec codec;
    private final AuthService authService;
    private final GameManager gameManager;
    private final GameProperties properties;
    private final Clock clock;
    private final Listener listener;
    private final OutboundChannel outbound;
    private final Map<PacketType, PacketHandler> handlers = new EnumMap<>(PacketType.class);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile String playerName;
    private int nameAttempts;

    public ClientSession(int id,
                         Socket socket,
                         PacketCodec codec,
                         AuthService authService,
                         GameManager gameManager,
                         GameProperties properties,
                         Clock clock,
                         Listener listener) throws IOException {
        this.id = id;
        this.socket = socket;
        this.codec = codec;
        this.authService = authService;
        this.gameManager = gameManager;
        this.properties = properties;
        this.clock = clock;
        this.listener = listener;
        this.outbound = new OutboundChannel(new BufferedOutputStream(socket.getOutputStream()),
                properties.getNetwork().getOutboundQueueSize(),
                e -> close("write failed: " + e.getMessage()));

        handlers.put(PacketType.CONNECT, p -> handleConnect((ConnectPacket) p));
        handlers.put(PacketType.MOVE, p -> handleMove((MovePacket) p));
        handlers.put(PacketType.SKILL, p -> handleSkill((SkillPacket) p));
        handlers.put(PacketType.GET_GAME_STATE, p -> handleGetGameState());
        handlers.put(PacketType.PING, p -> handlePing((PingPacket) p));
        handlers.put(PacketType.PONG, p -> logger.trace("Session {} pong", id));
    }

    // ==================== 读循环 ====================

    @Override
    public void run() {
        String reason = "connection closed";
        try {
            socket.setSoTimeout((int) properties.getNetwork().getKeepaliveTimeout().toMillis());
            socket.setTcpNoDelay(true);
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            outbound.start("session-writer-" + id);
            logger.info("Session {} opened from {}", id, socket.getRemoteSocketAddress());

            while (!closed.get()) {
                Packet packet = codec.readPacket(in);
                dispatch(packet);
            }
        } catch (SocketTimeoutException e) {
            reason = "keepalive timeout";
            logger.warn("Session {} timed out after {}", id, properties.getNetwork().getKeepaliveTimeout());
        } catch (EOFException e) {
            reason = "client disconnected";
        } catch (ProtocolException e) {
            reason = "protocol error";
            logger.warn("Session {} protocol error: {}", id, e.getMessage());
        } catch (IOException e) {
            if (!closed.get()) {
                reason = "connection error";
                logger.info("Session {} connection error: {}", id, e.getMessage());
            }
        } catch (RuntimeException e) {
            reason = "internal error";
            logger.error("Session {} failed", id, e);
        } finally {
            close(reason);
        }
    }

    void dispatch(Packet packet) throws IOException {
        PacketHandler handler = handlers.get(packet.packetType());
        if (handler == null || !packet.packetType().acceptedByServer()) {
            throw new ProtocolException("unexpected packet type " + packet.packetType().wireName());
        }
        handler.handle(packet);
    }

    // ==================== 握手 ====================

    private void handleConnect(ConnectPacket packet) throws IOException {
        if (state != SessionState.CONNECTING && state != SessionState.AUTHENTICATING) {
            throw new ProtocolException("connect received in state " + state);
        }
        state = SessionState.AUTHENTICATING;
        nameAttempts++;

        Point spawn;
        try {
            spawn = authService.join(id, packet.name());
        } catch (ValidationException e) {
            rejectHandshake(packet, e);
            return;
        }

        if (closed.get()) {
            // 握手期间连接已被关闭
            gameManager.removePlayer(id);
            return;
        }
        playerName = packet.name() == null ? null : packet.name().strip();
        // player_id 必须先入队，ACTIVE 之后广播的快照才会排在它后面
        outbound.offer(codec.frame(new PlayerIdPacket(id, new Position(spawn.x(), spawn.y()),
                gameManager.getTickRate())));
        state = SessionState.ACTIVE;
        logger.info("Session {} joined as {}", id, playerName);
    }

    private void rejectHandshake(ConnectPacket packet, ValidationException e) throws IOException {
        GameProperties.Network net = properties.getNetwork();
        switch (e.getReason()) {
            case NAME_TAKEN -> {
                UsernameTakenPacket reply = new UsernameTakenPacket(net.getUsernameTakenMessage(),
                        authService.suggestNames(packet.name()));
                if (nameAttempts >= MAX_NAME_ATTEMPTS) {
                    logger.info("Session {} name '{}' taken again, closing", id, packet.name());
                    finalReply(reply, "username taken");
                } else {
                    logger.info("Session {} name '{}' taken, waiting for retry", id, packet.name());
                    outbound.offer(codec.frame(reply));
                }
            }
            case SERVER_FULL -> {
                logger.info("Session {} rejected: server full", id);
                finalReply(new ServerFullPacket(net.getServerFullMessage(),
                        properties.getServer().getMaxPlayers(), null), "server full");
            }
            case INVALID_NAME -> {
                logger.warn("Session {} invalid name '{}': {}", id, packet.name(), e.getMessage());
                close("invalid name");
            }
        }
    }

    /**
     * 同步写出最后一个应答后关闭
     */
    private void finalReply(Packet packet, String reason) {
        try {
            outbound.writeNow(codec.frame(packet));
        } catch (IOException e) {
            logger.debug("Session {} final reply not delivered: {}", id, e.getMessage());
        }
        close(reason);
    }

    // ==================== 游戏内消息 ====================

    private void handleMove(MovePacket packet) throws IOException {
        requireActive(packet);
        if (!gameManager.recordMove(id, packet.dx(), packet.dy(), packet.sequence())) {
            logger.debug("Session {} dropped move seq={}", id, packet.sequence());
        }
    }

    private void handleSkill(SkillPacket packet) throws IOException {
        requireActive(packet);
        gameManager.activateSkill(id, packet.skillName());
    }

    private void handleGetGameState() throws IOException {
        if (state != SessionState.ACTIVE) {
            throw new ProtocolException("get_game_state received in state " + state);
        }
        outbound.offer(codec.frame(GameStatePacket.from(gameManager.latestSnapshot())));
    }

    private void handlePing(PingPacket packet) {
        outbound.offer(codec.frame(new PongPacket(packet.timestamp(), packet.sequence(), clock.millis())));
    }

    private void requireActive(Packet packet) throws ProtocolException {
        if (state != SessionState.ACTIVE) {
            throw new ProtocolException(packet.packetType().wireName() + " received in state " + state);
        }
    }

    // ==================== 发送 / 关闭 ====================

    /**
     * 广播入口：快照只保留最新一帧，其它包进入队列
     */
    public void deliver(Packet packet, byte[] frame) {
        if (state != SessionState.ACTIVE) {
            return;
        }
        if (packet.packetType() == PacketType.GAME_STATE) {
            outbound.offerSnapshot(frame);
        } else {
            outbound.offer(frame);
        }
    }

    /**
     * 关闭连接并通知监听者，重复调用无副作用
     */
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        state = SessionState.DISCONNECTING;
        outbound.stop();
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Session {} socket close failed: {}", id, e.getMessage());
        }
        state = SessionState.CLOSED;
        logger.info("Session {} closed ({})", id, reason);
        listener.onSessionClosed(this, reason);
    }

    public int getId() {
        return id;
    }

    public SessionState getState() {
        return state;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    public String getPlayerName() {
        return playerName;
    }
}
