package io.github.respkv.server;

import java.net.InetSocketAddress;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig config = ServerConfig.from(new Properties());

        assertEquals(new InetSocketAddress(5001), config.getListenAddress());
        assertEquals(1000, config.getSweepIntervalMs());
        assertFalse(config.isReplyNullOnMiss());
        assertEquals(1024, config.getInboxCapacity());
        assertEquals(64L * 1024 * 1024, config.getMaxOutputBytes());
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(ServerConfig.LISTEN_PROP, "127.0.0.1:6380");
        props.setProperty(ServerConfig.SWEEP_INTERVAL_PROP, "250");
        props.setProperty(ServerConfig.REPLY_NULL_ON_MISS_PROP, "true");
        props.setProperty(ServerConfig.INBOX_CAPACITY_PROP, "8");
        props.setProperty(ServerConfig.MAX_OUTPUT_BYTES_PROP, "4096");

        ServerConfig config = ServerConfig.from(props);

        assertEquals(new InetSocketAddress("127.0.0.1", 6380), config.getListenAddress());
        assertEquals(250, config.getSweepIntervalMs());
        assertTrue(config.isReplyNullOnMiss());
        assertEquals(8, config.getInboxCapacity());
        assertEquals(4096, config.getMaxOutputBytes());
    }

    @Test
    void invalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parseAddress("localhost"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parseAddress("localhost:http"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parseAddress(":70000"));

        Properties props = new Properties();
        props.setProperty(ServerConfig.SWEEP_INTERVAL_PROP, "0");
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.from(props));

        Properties output = new Properties();
        output.setProperty(ServerConfig.MAX_OUTPUT_BYTES_PROP, "-1");
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.from(output));
    }
}
