package com.example.sos.web;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.sos.model.ConnectivityEvent;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.smallrye.reactive.messaging.memory.InMemoryConnector;
import jakarta.enterprise.inject.Any;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

@QuarkusTest
class DeviceResourceTest {

    @Inject
    @Any
    InMemoryConnector connector;

    @Test
    void locationReportsAreRangeChecked() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"latitude\": 91.0, \"longitude\": 2.35}")
            .when()
            .post("/device/location")
            .then()
            .statusCode(400);
        given()
            .contentType(ContentType.JSON)
            .body("{\"latitude\": 48.8566, \"longitude\": 2.3522, \"accuracyMeters\": 8.0}")
            .when()
            .post("/device/location")
            .then()
            .statusCode(204);
    }

    @Test
    void connectivityReportedOverRest() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"connected\": true, \"type\": \"cellular\", \"cellularGeneration\": \"4g\"}")
            .when()
            .post("/device/connectivity")
            .then()
            .statusCode(200)
            .body("online", is(true))
            .body("type", is("cellular"))
            .body("quality", is("GOOD"));
    }

    @Test
    void connectivityReportedOverKafka() throws InterruptedException {
        ConnectivityEvent event = new ConnectivityEvent();
        event.connected = true;
        event.reachable = true;
        event.type = "wifi";
        connector.<ConnectivityEvent>source("connectivity-events").send(event);

        String type = null;
        for (int i = 0; i < 50 && !"wifi".equals(type); i++) {
            Thread.sleep(100);
            type = given().when().get("/device/connectivity").then().extract().path("type");
        }
        assertEquals("wifi", type);
        given()
            .when()
            .get("/device/connectivity")
            .then()
            .body("quality", is("EXCELLENT"));
    }
}
