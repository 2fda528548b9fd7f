package io.github.yok.rethinkdblink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

/**
 * Unit tests for {@link RethinkProperties}.
 */
class RethinkPropertiesTest {

    @Test
    void toSessionConfig_正常ケース_未設定のとき既定値の設定が返ること() {
        SessionConfig config = new RethinkProperties().toSessionConfig();

        assertEquals(SessionConfig.defaults(), config);
    }

    @Test
    void toSessionConfig_正常ケース_urlを指定する_host_portより優先されること() {
        RethinkProperties properties = new RethinkProperties();
        properties.setHost("ignored");
        properties.setPort(1);
        properties.setUrl("rethink://rethink.internal:29015");

        SessionConfig config = properties.toSessionConfig();

        assertEquals(new ServerAddress("rethink.internal", 29015), config.getServer());
    }

    @Test
    void toSessionConfig_正常ケース_host_portを指定する_その値が使われること() {
        RethinkProperties properties = new RethinkProperties();
        properties.setHost("10.0.0.5");
        properties.setPort(28016);
        properties.setDb("app");
        properties.setTable("sessions");
        properties.setTimeout(Duration.ofSeconds(2));
        properties.setTableProvisioning(TableProvisioningPolicy.ALWAYS);

        SessionConfig config = properties.toSessionConfig();

        assertEquals(new ServerAddress("10.0.0.5", 28016), config.getServer());
        assertEquals("app", config.getDatabaseName());
        assertEquals("sessions", config.getTableName());
        assertEquals(Duration.ofSeconds(2), config.getConnectTimeout());
        assertEquals(TableProvisioningPolicy.ALWAYS, config.getTableProvisioning());
    }

    @Test
    void toSessionConfig_異常ケース_不正なポートを指定する_IllegalArgumentExceptionが送出されること() {
        RethinkProperties properties = new RethinkProperties();
        properties.setPort(70000);

        assertThrows(IllegalArgumentException.class, properties::toSessionConfig);
    }

    @Test
    void bind_正常ケース_YAML相当のプロパティを指定する_数値のタイムアウトが秒として読まれること() {
        Map<String, String> source = new HashMap<>();
        source.put("rethink.url", "rethink://localhost:28015");
        source.put("rethink.db", "default");
        source.put("rethink.table", "users");
        source.put("rethink.timeout", "7");
        source.put("rethink.table-provisioning", "always");

        RethinkProperties properties = new Binder(new MapConfigurationPropertySource(source))
                .bind("rethink", RethinkProperties.class).get();

        assertEquals(Duration.ofSeconds(7), properties.getTimeout());
        assertEquals(TableProvisioningPolicy.ALWAYS, properties.getTableProvisioning());
        assertEquals("rethink://localhost:28015", properties.getUrl());
    }
}
