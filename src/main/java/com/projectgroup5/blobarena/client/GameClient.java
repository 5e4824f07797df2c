package com.projectgroup5.blobarena.client;

import com.projectgroup5.blobarena.protocol.ConnectPacket;
import com.projectgroup5.blobarena.protocol.MovePacket;
import com.projectgroup5.blobarena.protocol.Packet;
import com.projectgroup5.blobarena.protocol.PacketCodec;
import com.projectgroup5.blobarena.protocol.PacketType;
import com.projectgroup5.blobarena.protocol.PingPacket;
import com.projectgroup5.blobarena.protocol.SkillPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 阻塞式协议客户端：连接、握手、收发包（测试和机器人用）
 * 读线程把收到的包放进队列，调用方按超时取
 */
public class GameClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(GameClient.class);

    private static final int CONNECT_TIMEOUT_MS = 3000;
    private static final Set<PacketType> HANDSHAKE_REPLIES =
            EnumSet.of(PacketType.PLAYER_ID, PacketType.USERNAME_TAKEN, PacketType.SERVER_FULL);

    private final String host;
    private final int port;
    private final PacketCodec codec;
    private final BlockingQueue<Packet> inbox = new LinkedBlockingQueue<>();
    private final AtomicLong moveSequence = new AtomicLong();
    private final AtomicLong pingSequence = new AtomicLong();

    private volatile boolean closing = false;
    private volatile boolean disconnected = false;
    private Socket socket;
    private OutputStream out;
    private Thread reader;

    public GameClient(String host, int port) {
        this(host, port, 65536);
    }

    public GameClient(String host, int port, int maxMessageSize) {
        this.host = host;
        this.port = port;
        this.codec = new PacketCodec(maxMessageSize);
    }

    public synchronized void open() throws IOException {
        if (socket != null && !socket.isClosed()) {
            return;
        }
        closing = false;
        disconnected = false;
        socket = new Socket();
        socket.setTcpNoDelay(true);
        socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
        out = new BufferedOutputStream(socket.getOutputStream());
        DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));

        reader = new Thread(() -> readLoop(in), "client-read-" + port);
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop(DataInputStream in) {
        try {
            while (!closing) {
                inbox.add(codec.readPacket(in));
            }
        } catch (EOFException e) {
            logger.debug("Server closed the connection");
        } catch (IOException e) {
            if (!closing) {
                logger.debug("Client read failed: {}", e.getMessage());
            }
        } finally {
            disconnected = true;
        }
    }

    /**
     * 打开连接并发送 connect，返回服务器的握手应答（player_id / username_taken / server_full）
     */
    public Packet connect(String name, Duration timeout) throws IOException, InterruptedException {
        open();
        return retryName(name, timeout);
    }

    /**
     * 在同一连接上重新发送 connect（重名后重试）
     */
    public Packet retryName(String name, Duration timeout) throws IOException, InterruptedException {
        send(new ConnectPacket(name, "1.0", null));
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            Packet p = remaining > 0 ? inbox.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (p == null) {
                throw new IOException("no handshake reply within " + timeout);
            }
            if (HANDSHAKE_REPLIES.contains(p.packetType())) {
                return p;
            }
        }
    }

    public synchronized void send(Packet packet) throws IOException {
        if (out == null) {
            throw new IOException("not connected");
        }
        out.write(codec.frame(packet));
        out.flush();
    }

    /**
     * 直接写原始字节（测试非法帧用）
     */
    public synchronized void sendRaw(byte[] bytes) throws IOException {
        if (out == null) {
            throw new IOException("not connected");
        }
        out.write(bytes);
        out.flush();
    }

    public void move(double dx, double dy) throws IOException {
        send(new MovePacket(dx, dy, moveSequence.incrementAndGet(), System.currentTimeMillis()));
    }

    public void useSkill(String skillName) throws IOException {
        send(new SkillPacket(skillName, null, null, null));
    }

    public void ping() throws IOException {
        send(new PingPacket(System.currentTimeMillis(), pingSequence.incrementAndGet()));
    }

    /**
     * 取下一个包，超时返回 null
     */
    public Packet receive(Duration timeout) throws InterruptedException {
        return inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 丢弃其它类型，直到收到指定类型的包；超时返回 null
     */
    @SuppressWarnings("unchecked")
    public <T extends Packet> T receive(PacketType type, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            Packet p = inbox.poll(remaining, TimeUnit.NANOSECONDS);
            if (p == null) {
                return null;
            }
            if (p.packetType() == type) {
                return (T) p;
            }
        }
    }

    /**
     * 服务器是否已关闭连接（读线程已退出且没有未读包）
     */
    public boolean isDisconnected() {
        return disconnected && inbox.isEmpty();
    }

    @Override
    public synchronized void close() {
        closing = true;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Client socket close failed: {}", e.getMessage());
            }
        }
        if (reader != null) {
            reader.interrupt();
        }
        socket = null;
        out = null;
    }
}
