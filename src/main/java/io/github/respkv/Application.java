package io.github.respkv;

import java.io.IOException;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.server.KeyValueServer;
import io.github.respkv.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 启动参数通过system properties传入，见{@link ServerConfig}。
 * <pre>java -Drespkv.listen=:5001 -jar respkv.jar</pre>
 */
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.fromSystemProperties();
        logger.info("starting respkv server with {}", config);

        KeyValueServer server = KeyValueServer.builder()
                .config(config)
                .store(new KeyValueStore())
                .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("respkv process exit.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("shutdown failed.", e);
            }
        }));
    }
}
