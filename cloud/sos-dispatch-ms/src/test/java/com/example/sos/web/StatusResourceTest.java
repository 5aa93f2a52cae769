package com.example.sos.web;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

@QuarkusTest
class StatusResourceTest {

    @Test
    void ping() {
        given()
            .when()
            .get("/status/ping")
            .then()
            .statusCode(200)
            .body(is("SOS dispatch is up"));
    }

    @Test
    void statusReportsConnectivityQueueAndTrigger() {
        given()
            .when()
            .get("/status")
            .then()
            .statusCode(200)
            .body("online", is(true))
            .body("queuedAlerts", greaterThanOrEqualTo(0))
            .body("trigger", is("IDLE"));
    }
}
