package com.projectgroup5.blobarena.protocol;

import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PacketCodecTest {

    private final PacketCodec codec = new PacketCodec(1024);

    private static DataInputStream stream(byte[] bytes) {
        return new DataInputStream(new ByteArrayInputStream(bytes));
    }

    private static byte[] rawFrame(String json) {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(4 + payload.length).putInt(payload.length).put(payload).array();
    }

    @Test
    @DisplayName("Frames carry a big-endian length prefix and a JSON payload with a type field")
    void frame_writesLengthPrefixAndTypedJson() {
        byte[] frame = codec.frame(new PingPacket(123L, 7L));

        int length = ByteBuffer.wrap(frame, 0, 4).getInt();
        String json = new String(frame, 4, frame.length - 4, StandardCharsets.UTF_8);

        assertThat(length).isEqualTo(frame.length - 4);
        assertThat(json).contains("\"type\":\"ping\"").contains("\"timestamp\":123").contains("\"sequence\":7");
    }

    @Test
    void decode_readsClientPacketsWithWireFieldNames() throws Exception {
        Packet connect = codec.readPacket(stream(rawFrame(
                "{\"type\":\"connect\",\"name\":\"alice\",\"version\":\"1.0\",\"client_id\":\"abc\"}")));
        assertThat(connect).isEqualTo(new ConnectPacket("alice", "1.0", "abc"));

        Packet skill = codec.readPacket(stream(rawFrame("{\"type\":\"skill\",\"skill_name\":\"pull\"}")));
        assertThat(skill).isInstanceOf(SkillPacket.class);
        assertThat(((SkillPacket) skill).skillName()).isEqualTo("pull");
        assertThat(((SkillPacket) skill).targetX()).isNull();

        Packet state = codec.readPacket(stream(rawFrame(
                "{\"type\":\"get_game_state\",\"full_update\":true,\"last_ack\":5}")));
        assertThat(state).isEqualTo(new GetGameStatePacket(true, 5));
    }

    @Test
    void decode_ignoresUnknownFields() throws Exception {
        Packet move = codec.readPacket(stream(rawFrame(
                "{\"type\":\"move\",\"dx\":1.0,\"dy\":-1.0,\"sequence\":4,\"timestamp\":99,\"extra\":\"x\"}")));
        assertThat(move).isEqualTo(new MovePacket(1.0, -1.0, 4, 99));
        assertThat(move.packetType()).isEqualTo(PacketType.MOVE);
    }

    @Test
    void decode_rejectsUnknownTypeAndMalformedJson() {
        assertThatThrownBy(() -> codec.readPacket(stream(rawFrame("{\"type\":\"teleport\"}"))))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.readPacket(stream(rawFrame("{\"type\":"))))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.readPacket(stream(rawFrame("{\"name\":\"no type\"}"))))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    @DisplayName("An oversized length is rejected before any payload is read")
    void readFrame_rejectsOversizedLengthWithoutReadingPayload() {
        byte[] header = ByteBuffer.allocate(4).putInt(1025).array();
        assertThatThrownBy(() -> codec.readFrame(stream(header)))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("1025");

        byte[] zero = ByteBuffer.allocate(4).putInt(0).array();
        assertThatThrownBy(() -> codec.readFrame(stream(zero))).isInstanceOf(ProtocolException.class);
    }

    @Test
    void readFrame_truncatedPayloadIsEof() {
        byte[] truncated = ByteBuffer.allocate(6).putInt(10).put((byte) '{').put((byte) '"').array();
        assertThatThrownBy(() -> codec.readFrame(stream(truncated))).isInstanceOf(EOFException.class);
    }

    @Test
    void readPacket_readsConsecutiveFrames() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PacketCodec.writeFrame(out, codec.frame(new PongPacket(1, 2, 3)));
        PacketCodec.writeFrame(out, codec.frame(new UsernameTakenPacket("taken", List.of("alice1"))));

        DataInputStream in = stream(out.toByteArray());
        assertThat(codec.readPacket(in)).isEqualTo(new PongPacket(1, 2, 3));
        assertThat(codec.readPacket(in)).isEqualTo(new UsernameTakenPacket("taken", List.of("alice1")));
    }

    @Test
    @DisplayName("Server replies decode back to the same packet through the frame reader")
    void serverReplies_surviveFraming() throws Exception {
        List<Packet> replies = List.of(
                new PlayerIdPacket(7, new Position(120.5, 80.25), 60),
                new PongPacket(1000L, 3L, 1005L),
                new UsernameTakenPacket("Username already taken", List.of("bob1", "bob2", "bob3")),
                new ServerFullPacket("Server is full", 20, 2));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Packet reply : replies) {
            PacketCodec.writeFrame(out, codec.frame(reply));
        }

        DataInputStream in = stream(out.toByteArray());
        for (Packet reply : replies) {
            assertThat(codec.readPacket(in)).isEqualTo(reply);
        }
        assertThatThrownBy(() -> codec.readPacket(in)).isInstanceOf(EOFException.class);
    }

    @Test
    void serverReplies_useSnakeCaseWireNames() {
        String playerId = new String(codec.encode(new PlayerIdPacket(7, new Position(1, 2), 60)), StandardCharsets.UTF_8);
        assertThat(playerId).contains("\"type\":\"player_id\"", "\"player_id\":7",
                "\"spawn_position\":{\"x\":1.0,\"y\":2.0}", "\"server_tick_rate\":60");

        String pong = new String(codec.encode(new PongPacket(1, 2, 3)), StandardCharsets.UTF_8);
        assertThat(pong).contains("\"type\":\"pong\"", "\"server_time\":3");

        String taken = new String(codec.encode(new UsernameTakenPacket("taken", List.of("a1"))), StandardCharsets.UTF_8);
        assertThat(taken).contains("\"type\":\"username_taken\"", "\"suggestions\":[\"a1\"]");

        String full = new String(codec.encode(new ServerFullPacket("full", 4, 1)), StandardCharsets.UTF_8);
        assertThat(full).contains("\"type\":\"server_full\"", "\"max_players\":4", "\"queue_position\":1");
    }

    @Test
    void encode_omitsNullFields() {
        String json = new String(codec.encode(new ServerFullPacket("full", 20, null)), StandardCharsets.UTF_8);
        assertThat(json).contains("\"max_players\":20").doesNotContain("queue_position");
    }

    @Test
    @DisplayName("Game state packets expose positions, skills and server tick")
    void gameState_fromSnapshot() throws Exception {
        GameStateSnapshot snapshot = new GameStateSnapshot(42, 1000,
                Map.of(7, new GameStateSnapshot.PlayerView(7, "alice", 10, 20, 25, 5, List.of(1, 2, 3), null,
                        Map.of("push", new GameStateSnapshot.SkillView(true, 145)))),
                List.of(new GameStateSnapshot.FoodView(3, 50, 60, 6, "normal", 1, List.of(4, 5, 6))));

        GameStatePacket packet = GameStatePacket.from(snapshot);
        String json = new String(codec.encode(packet), StandardCharsets.UTF_8);
        assertThat(json).contains("\"type\":\"game_state\"").contains("\"server_tick\":42")
                .contains("\"position\":{\"x\":10.0,\"y\":20.0}").doesNotContain("health");

        GameStatePacket decoded = (GameStatePacket) codec.decode(codec.encode(packet));
        assertThat(decoded.players()).containsKey(7);
        assertThat(decoded.players().get(7).skills().get("push").active()).isTrue();
        assertThat(decoded.food()).hasSize(1);
        assertThat(decoded.food().get(0).type()).isEqualTo("normal");
    }

    @Test
    void packetType_tableMatchesWireNames() {
        for (PacketType type : PacketType.values()) {
            assertThat(PacketType.fromWireName(type.wireName())).isSameAs(type);
        }
        assertThat(PacketType.PLAYER_ID.acceptedByServer()).isFalse();
        assertThat(PacketType.PING.acceptedByServer()).isTrue();
        assertThat(PacketType.fromWireName("nope")).isNull();
    }
}
