package com.projectgroup5.blobarena.network;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("unit")
class OutboundChannelTest {

    private OutboundChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.stop();
        }
    }

    @Test
    void queuedFramesAreWrittenInOrder() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        channel = new OutboundChannel(out, 8, e -> { });
        channel.start("test-writer");

        channel.offer(new byte[]{1});
        channel.offer(new byte[]{2, 3});

        await().atMost(Duration.ofSeconds(2)).until(() -> out.size() == 3);
        assertThat(out.toByteArray()).containsExactly(1, 2, 3);
    }

    @Test
    void onlyLatestSnapshotIsSentWhileWriterIsBusy() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        OutputStream slow = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    throw new IOException(e);
                }
                synchronized (sink) {
                    sink.write(b);
                }
            }
        };
        channel = new OutboundChannel(slow, 8, e -> { });
        channel.start("test-writer");

        channel.offer(new byte[]{9});
        // 写线程阻塞在第一个字节上，期间到达的快照只保留最后一帧
        Thread.sleep(100);
        channel.offerSnapshot(new byte[]{1});
        channel.offerSnapshot(new byte[]{2});
        channel.offerSnapshot(new byte[]{3});
        release.countDown();

        await().atMost(Duration.ofSeconds(2)).until(() -> {
            synchronized (sink) {
                return sink.size() == 2;
            }
        });
        synchronized (sink) {
            assertThat(sink.toByteArray()).containsExactly(9, 3);
        }
    }

    @Test
    void fullQueueDropsOldestFrame() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        channel = new OutboundChannel(out, 2, e -> { });

        channel.offer(new byte[]{1});
        channel.offer(new byte[]{2});
        channel.offer(new byte[]{3});
        assertThat(channel.getDropped()).isEqualTo(1);

        channel.start("test-writer");
        await().atMost(Duration.ofSeconds(2)).until(() -> out.size() == 2);
        assertThat(out.toByteArray()).containsExactly(2, 3);
    }

    @Test
    void writeFailureIsReported() {
        AtomicReference<IOException> failure = new AtomicReference<>();
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        };
        channel = new OutboundChannel(broken, 4, failure::set);
        channel.start("test-writer");

        channel.offer(new byte[]{1});

        await().atMost(Duration.ofSeconds(2)).until(() -> failure.get() != null);
        assertThat(failure.get()).hasMessage("broken pipe");
    }
}
