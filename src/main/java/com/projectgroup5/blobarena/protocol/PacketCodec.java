package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * 帧编解码：4 字节大端长度前缀 + JSON 负载
 * 长度在读取负载之前检查，超长直接抛 ProtocolException
 */
public class PacketCodec {
    public static final int HEADER_SIZE = 4;

    // 协议专用 mapper，不与 Spring 的 ObjectMapper 共享配置
    private final ObjectMapper mapper = JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    private final ObjectWriter packetWriter = mapper.writerFor(Packet.class);
    private final int maxMessageSize;

    public PacketCodec(int maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * 编码为 JSON 负载（不含长度前缀）
     */
    public byte[] encode(Packet packet) {
        try {
            return packetWriter.writeValueAsBytes(packet);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("encode failed for " + packet.packetType().wireName(), e);
        }
    }

    public Packet decode(byte[] payload) throws ProtocolException {
        try {
            Packet packet = mapper.readValue(payload, Packet.class);
            if (packet == null) {
                throw new ProtocolException("empty payload");
            }
            return packet;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("malformed packet: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProtocolException("unreadable packet", e);
        }
    }

    /**
     * 编码为完整的帧（长度前缀 + 负载）
     */
    public byte[] frame(Packet packet) {
        byte[] payload = encode(packet);
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    /**
     * 读取一个完整的帧负载；连接关闭时抛出 EOFException
     */
    public byte[] readFrame(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length <= 0 || length > maxMessageSize) {
            throw new ProtocolException("invalid frame length " + length + " (max " + maxMessageSize + ")");
        }
        byte[] payload = new byte[length];
        in.readFully(payload);
        return payload;
    }

    public Packet readPacket(DataInputStream in) throws IOException {
        return decode(readFrame(in));
    }

    public static void writeFrame(OutputStream out, byte[] frame) throws IOException {
        out.write(frame);
        out.flush();
    }

    public int getMaxMessageSize() {
        return maxMessageSize;
    }
}
