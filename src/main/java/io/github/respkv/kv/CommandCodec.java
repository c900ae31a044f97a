package io.github.respkv.kv;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableMap;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespMap;
import io.github.respkv.resp.RespSimpleString;

/**
 * 命令和RESP数据之间的转换。
 * 请求格式：array，第一个元素是命令名（不区分大小写），其余是参数。
 * <ul>
 * <li>SET key value [EX seconds | PX milliseconds]</li>
 * <li>GET key</li>
 * <li>HELLO value [...]</li>
 * <li>CLIENT value [...]</li>
 * </ul>
 * @author zy
 */
public class CommandCodec {
    public static final String SERVER_NAME    = "redis";
    public static final String SERVER_VERSION = "7.0.0";

    static final String SET_CMD    = "SET";
    static final String GET_CMD    = "GET";
    static final String HELLO_CMD  = "HELLO";
    static final String CLIENT_CMD = "CLIENT";

    private static final RespMap HELLO_REPLY = RespMap.ofStrings(ImmutableMap.of(
            "server", SERVER_NAME,
            "version", SERVER_VERSION,
            "proto", "3",
            "mode", "standalone",
            "role", "master"));

    /**
     * @throws MalformedCommandException 不是命令帧或者参数不合法，调用方应关闭连接
     * @throws UnknownCommandException   不支持的命令，可以继续处理后续请求
     */
    public Command decode(RespData frame) throws MalformedCommandException, UnknownCommandException {
        if (!(frame instanceof RespArray)) {
            throw new MalformedCommandException("request is not an array: " + frame);
        }
        List<byte[]> args = arguments((RespArray) frame);
        if (args.isEmpty()) {
            throw new MalformedCommandException("empty command");
        }

        String cmd = new String(args.get(0), StandardCharsets.UTF_8);
        switch (cmd.toUpperCase(Locale.ROOT)) {
            case SET_CMD:
                return decodeSet(args);
            case GET_CMD:
                checkArity(cmd, args.size() == 2);
                return new GetCommand(args.get(1));
            case HELLO_CMD:
                checkArity(cmd, args.size() >= 2);
                return new HelloCommand(new String(args.get(1), StandardCharsets.UTF_8));
            case CLIENT_CMD:
                checkArity(cmd, args.size() >= 2);
                return new ClientCommand(new String(args.get(1), StandardCharsets.UTF_8));
            default:
                throw new UnknownCommandException(cmd);
        }
    }

    public RespData encodeOk() {
        return RespSimpleString.OK;
    }

    public RespData encodeValue(byte[] value) {
        return RespBulkString.with(value);
    }

    public RespData encodeNil() {
        return RespBulkString.nullBulkString();
    }

    public RespData encodeHello() {
        return HELLO_REPLY;
    }

    private SetCommand decodeSet(List<byte[]> args) throws MalformedCommandException {
        checkArity(SET_CMD, args.size() == 3 || args.size() == 5);
        SetCommand.SetCommandBuilder builder = SetCommand.builder().key(args.get(1)).value(args.get(2));
        if (args.size() == 5) {
            String option = new String(args.get(3), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
            long amount = parsePositive(args.get(4));
            switch (option) {
                case "EX":
                    builder.ttl(checkTtl(Duration.ofSeconds(amount)));
                    break;
                case "PX":
                    builder.ttl(checkTtl(Duration.ofMillis(amount)));
                    break;
                default:
                    throw new MalformedCommandException("unsupported SET option: " + option);
            }
        }
        return builder.build();
    }

    // 过期时间按纳秒保存，超过long范围的ttl不接受
    private Duration checkTtl(Duration ttl) throws MalformedCommandException {
        if (ttl.compareTo(KeyValueStore.MAX_TTL) > 0) {
            throw new MalformedCommandException("invalid expire time in 'set' command: " + ttl);
        }
        return ttl;
    }

    private long parsePositive(byte[] bytes) throws MalformedCommandException {
        String s = new String(bytes, StandardCharsets.UTF_8);
        long n;
        try {
            n = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new MalformedCommandException("ttl is not an integer: " + s);
        }
        if (n <= 0) {
            throw new MalformedCommandException("invalid expire time: " + s);
        }
        return n;
    }

    private List<byte[]> arguments(RespArray array) throws MalformedCommandException {
        List<byte[]> args = new ArrayList<>(array.size());
        for (RespData data : array.getDatas()) {
            if (data instanceof RespBulkString && !((RespBulkString) data).isNull()) {
                args.add(((RespBulkString) data).getContent());
            } else if (data instanceof RespSimpleString) {
                args.add(((RespSimpleString) data).getContent().getBytes(StandardCharsets.UTF_8));
            } else {
                throw new MalformedCommandException("command argument is not a string: " + data);
            }
        }
        return args;
    }

    private void checkArity(String cmd, boolean valid) throws MalformedCommandException {
        if (!valid) {
            throw new MalformedCommandException("wrong number of arguments for '" + cmd + "' command");
        }
    }
}
