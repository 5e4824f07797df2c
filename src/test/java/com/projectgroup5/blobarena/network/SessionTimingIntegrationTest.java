package com.projectgroup5.blobarena.network;

import com.projectgroup5.blobarena.client.GameClient;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.protocol.GameStatePacket;
import com.projectgroup5.blobarena.protocol.GetGameStatePacket;
import com.projectgroup5.blobarena.protocol.PacketType;
import com.projectgroup5.blobarena.protocol.PlayerIdPacket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 1 Hz 的 tick 和很短的 keepalive：广播间隔足够长，能区分直接应答和广播
 */
@Tag("integration")
@SpringBootTest(properties = {
        "game.server.tick-rate=1",
        "game.network.keepalive-timeout=2500ms"
})
@ActiveProfiles("test")
class SessionTimingIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(3);

    @Autowired
    private NetworkManager networkManager;

    @Autowired
    private GameManager gameManager;

    private final List<GameClient> clients = new ArrayList<>();

    private GameClient newClient() {
        GameClient client = new GameClient("127.0.0.1", networkManager.getLocalPort());
        clients.add(client);
        return client;
    }

    @AfterEach
    void tearDown() {
        clients.forEach(GameClient::close);
        await().atMost(TIMEOUT).until(() -> networkManager.getSessionCount() == 0);
        await().atMost(TIMEOUT).until(() -> gameManager.getPlayerCount() == 0);
    }

    @Test
    @DisplayName("An idle session is closed and deregistered after the keepalive timeout")
    void idleSession_isClosedAfterKeepalive() throws Exception {
        GameClient client = newClient();
        PlayerIdPacket id = (PlayerIdPacket) client.connect("idle", TIMEOUT);
        assertThat(id.serverTickRate()).isEqualTo(1);
        assertThat(networkManager.getSessionCount()).isEqualTo(1);

        await().atMost(Duration.ofSeconds(6)).until(() -> networkManager.getSessionCount() == 0);
        assertThat(gameManager.isNameTaken("idle")).isFalse();
        await().atMost(TIMEOUT).until(() -> drainedAndDisconnected(client));
    }

    @Test
    @DisplayName("Traffic from the client keeps the session alive past the keepalive timeout")
    void activeSession_staysOpenWhilePinging() throws Exception {
        GameClient client = newClient();
        client.connect("chatty", TIMEOUT);

        for (int i = 0; i < 8; i++) {
            Thread.sleep(500);
            client.ping();
        }

        assertThat(client.isDisconnected()).isFalse();
        assertThat(networkManager.getSessionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("get_game_state is answered right away instead of waiting for the next broadcast")
    void getGameState_isAnsweredBetweenBroadcasts() throws Exception {
        GameClient client = newClient();
        PlayerIdPacket id = (PlayerIdPacket) client.connect("eager", TIMEOUT);
        // 等到包含自己的广播，下一次广播在约 1 秒之后
        await().atMost(TIMEOUT).until(() -> {
            GameStatePacket s = client.receive(PacketType.GAME_STATE, TIMEOUT);
            return s != null && s.players().containsKey(id.playerId());
        });

        client.send(new GetGameStatePacket(true, 0));
        GameStatePacket reply = client.receive(PacketType.GAME_STATE, Duration.ofMillis(300));

        assertThat(reply).isNotNull();
        assertThat(reply.players()).containsKey(id.playerId());
    }

    private static boolean drainedAndDisconnected(GameClient client) throws InterruptedException {
        while (client.receive(Duration.ofMillis(10)) != null) {
            // 丢弃断开前收到的快照
        }
        return client.isDisconnected();
    }
}
