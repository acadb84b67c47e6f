package org.empiresim.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.empiresim.junit.extensions.logging.AllowLog;
import org.empiresim.junit.extensions.logging.ExpectLog;
import org.empiresim.junit.extensions.logging.LogLevel;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.empiresim.node.processes.http.HttpServerProcess;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

@Tag("integration")
@DisplayName("Node End-to-End Tick API Integration Test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@ExtendWith(LogWatchExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class NodeIntegrationTest {

    private static final String BASE_PATH = "/api/tick";

    private Node testNode;

    @BeforeAll
    void startNode() {
        final Config overrides = ConfigFactory.parseString("""
            empiresim.engine.trigger.enabled = false
            node.processes.http.options.network.host = "127.0.0.1"
            node.processes.http.options.network.port = 0
            """);
        final Config config = overrides.withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
        testNode = new Node(config);
        testNode.start();

        final HttpServerProcess http = (HttpServerProcess) testNode.getProcess("http").orElseThrow();
        RestAssured.baseURI = "http://127.0.0.1";
        RestAssured.port = http.getPort();
    }

    @AfterAll
    void stopNode() {
        if (testNode != null) {
            testNode.stop();
        }
        RestAssured.reset();
    }

    @Test
    @Order(1)
    @DisplayName("GET /status - reports the initial game month and configured processors")
    void getStatus_initially_reportsFirstMonth() {
        given()
            .when()
                .get(BASE_PATH + "/status")
            .then()
                .statusCode(200)
                .body("totalMonths", equalTo(1))
                .body("processing", equalTo(false))
                .body("ticksProcessed", equalTo(0))
                .body("processors", hasItem("clock"));
    }

    @Test
    @Order(2)
    @DisplayName("POST /trigger - runs manual ticks and records them in the history")
    void postTrigger_advancesClock() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"count\": 2, \"userId\": \"ops\"}")
            .when()
                .post(BASE_PATH + "/trigger")
            .then()
                .statusCode(200)
                .body("", hasSize(2))
                .body("[0].totalMonths", equalTo(2))
                .body("[1].totalMonths", equalTo(3))
                .body("[1].status", equalTo("COMPLETED"))
                .body("[1].triggeredBy", equalTo("MANUAL"))
                .body("[1].triggeredByUserId", equalTo("ops"));

        given()
            .when()
                .get(BASE_PATH + "/history?limit=5")
            .then()
                .statusCode(200)
                .body("", hasSize(2));

        given()
            .when()
                .get(BASE_PATH + "/status")
            .then()
                .statusCode(200)
                .body("totalMonths", equalTo(3))
                .body("ticksProcessed", equalTo(2))
                .body("lastTickId", startsWith("tick-3-"));
    }

    @Test
    @Order(3)
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Bad request /api/tick/trigger: count must not exceed 120 but was 500")
    @DisplayName("POST /trigger - rejects oversized batches with 400")
    void postTrigger_tooManyTicks_returns400() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"count\": 500}")
            .when()
                .post(BASE_PATH + "/trigger")
            .then()
                .statusCode(400)
                .body("status", equalTo(400))
                .body("error", equalTo("Bad Request"));
    }

    @Test
    @Order(4)
    @AllowLog(level = LogLevel.WARN, messagePattern = "Bad request /api/tick/.*")
    @DisplayName("Malformed input is answered with 400")
    void malformedInput_returns400() {
        given()
            .contentType(ContentType.JSON)
            .body("{oops")
            .when()
                .post(BASE_PATH + "/trigger")
            .then()
                .statusCode(400)
                .body("message", startsWith("Malformed request body"));

        given()
            .when()
                .get(BASE_PATH + "/history?limit=0")
            .then()
                .statusCode(400);
    }

    @Test
    @Order(5)
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Tick not found for request /api/tick/no-such-tick/fail: .*")
    @DisplayName("POST /{tickId}/fail - returns 404 for an unknown tick")
    void postFail_unknownTick_returns404() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"reason\": \"stuck\"}")
            .when()
                .post(BASE_PATH + "/no-such-tick/fail")
            .then()
                .statusCode(404)
                .body("error", equalTo("Not Found"));
    }

    @Test
    @Order(6)
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Conflict for request /api/tick/.*/fail: .*already finished.*")
    @DisplayName("POST /{tickId}/fail - returns 409 for a finished tick")
    void postFail_finishedTick_returns409() {
        final String tickId = given()
            .when()
                .get(BASE_PATH + "/history?limit=1")
            .then()
                .statusCode(200)
                .extract().path("[0].tickId");

        given()
            .contentType(ContentType.JSON)
            .body("{\"reason\": \"too late\"}")
            .when()
                .post(BASE_PATH + "/" + tickId + "/fail")
            .then()
                .statusCode(409)
                .body("error", equalTo("Conflict"));
    }
}
