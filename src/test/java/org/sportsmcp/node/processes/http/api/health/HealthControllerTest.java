package org.sportsmcp.node.processes.http.api.health;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sportsmcp.node.spi.ServiceRegistry;

import com.google.gson.Gson;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;

@Tag("unit")
class HealthControllerTest {

    @Test
    void health_answersOkWithEmptyRegistry() {
        Javalin app = Javalin.create();
        new HealthController(new ServiceRegistry(), ConfigFactory.empty()).registerRoutes(app, "/healthz");

        JavalinTest.test(app, (server, client) -> {
            var response = client.get("/healthz");
            assertThat(response.code()).isEqualTo(200);
            assertThat(new Gson().fromJson(response.body().string(), Map.class)).isEqualTo(Map.of("status", "ok"));
        });
    }
}
