package dev.newsroom.config;

import dev.newsroom.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Id generator bean. The node id comes from {@code app.snowflake.node-id}, or
 * is derived from the host name when unset.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = configuredNodeId != null ? configuredNodeId : nodeIdFromHost();
        log.info("Snowflake id generator using node {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long nodeIdFromHost() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return (host.hashCode() & Integer.MAX_VALUE) & 0x3FF;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve host name, using node 0: {}", e.getMessage());
            return 0;
        }
    }
}
