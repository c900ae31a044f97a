package io.github.respkv.server;

import java.net.InetSocketAddress;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务配置，从system properties读取：
 * <ul>
 * <li>respkv.listen 监听地址，host:port，只写:port时监听所有网卡，默认:5001</li>
 * <li>respkv.sweep-interval-ms 过期key扫描间隔，默认1000</li>
 * <li>respkv.reply-null-on-miss GET未命中时是否返回null bulk string，默认false（不返回）</li>
 * <li>respkv.inbox-capacity 命令队列容量，默认1024</li>
 * <li>respkv.max-output-bytes 单个连接未写出的回复字节数上限，超过后断开该连接，默认64MB</li>
 * </ul>
 * @author zy
 */
@Getter
@ToString
@Builder
public class ServerConfig {
    public static final String LISTEN_PROP            = "respkv.listen";
    public static final String SWEEP_INTERVAL_PROP    = "respkv.sweep-interval-ms";
    public static final String REPLY_NULL_ON_MISS_PROP = "respkv.reply-null-on-miss";
    public static final String INBOX_CAPACITY_PROP    = "respkv.inbox-capacity";
    public static final String MAX_OUTPUT_BYTES_PROP  = "respkv.max-output-bytes";

    public static final String DEFAULT_LISTEN           = ":5001";
    public static final long   DEFAULT_MAX_OUTPUT_BYTES = 64L * 1024 * 1024;

    @Builder.Default
    private final InetSocketAddress listenAddress   = parseAddress(DEFAULT_LISTEN);
    @Builder.Default
    private final long              sweepIntervalMs = 1000;
    @Builder.Default
    private final boolean           replyNullOnMiss = false;
    @Builder.Default
    private final int               inboxCapacity   = 1024;
    @Builder.Default
    private final long              maxOutputBytes  = DEFAULT_MAX_OUTPUT_BYTES;

    public static ServerConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    static ServerConfig from(Properties props) {
        long interval = Long.parseLong(props.getProperty(SWEEP_INTERVAL_PROP, "1000"));
        Preconditions.checkArgument(interval > 0, "%s must be positive: %s", SWEEP_INTERVAL_PROP, interval);
        int capacity = Integer.parseInt(props.getProperty(INBOX_CAPACITY_PROP, "1024"));
        Preconditions.checkArgument(capacity > 0, "%s must be positive: %s", INBOX_CAPACITY_PROP, capacity);
        long maxOutput = Long.parseLong(props.getProperty(MAX_OUTPUT_BYTES_PROP, String.valueOf(DEFAULT_MAX_OUTPUT_BYTES)));
        Preconditions.checkArgument(maxOutput > 0, "%s must be positive: %s", MAX_OUTPUT_BYTES_PROP, maxOutput);

        return ServerConfig.builder()
                .listenAddress(parseAddress(props.getProperty(LISTEN_PROP, DEFAULT_LISTEN)))
                .sweepIntervalMs(interval)
                .replyNullOnMiss(Boolean.parseBoolean(props.getProperty(REPLY_NULL_ON_MISS_PROP, "false")))
                .inboxCapacity(capacity)
                .maxOutputBytes(maxOutput)
                .build();
    }

    /**
     * @param address host:port或者:port
     */
    public static InetSocketAddress parseAddress(String address) {
        int i = address.lastIndexOf(':');
        Preconditions.checkArgument(i >= 0, "address must be host:port: %s", address);
        String host = address.substring(0, i);
        int port;
        try {
            port = Integer.parseInt(address.substring(i + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address: " + address, e);
        }
        Preconditions.checkArgument(port >= 0 && port <= 65535, "invalid port in address: %s", address);
        return Strings.isNullOrEmpty(host) ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }
}
