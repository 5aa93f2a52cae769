package com.example.sos.web;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.greaterThan;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

@QuarkusTest
class CheckInResourceTest {

    private static String start(String json) {
        return given()
            .contentType(ContentType.JSON)
            .body(json)
            .when()
            .post("/checkins")
            .then()
            .statusCode(201)
            .body("status", is("ACTIVE"))
            .extract()
            .path("id");
    }

    @Test
    void checkingInCompletesTheTimer() {
        String id = start("{\"duration\": \"PT30M\", \"destination\": \"Library\"}");

        given()
            .when()
            .get("/checkins/" + id)
            .then()
            .statusCode(200)
            .body("destination", is("Library"))
            .body("remainingSeconds", greaterThan(1700));

        given()
            .when()
            .post("/checkins/" + id + "/check-in")
            .then()
            .statusCode(200)
            .body("accepted", is(true))
            .body("status", is("COMPLETED"));
        given()
            .when()
            .post("/checkins/" + id + "/check-in")
            .then()
            .statusCode(200)
            .body("accepted", is(false))
            .body("status", is("COMPLETED"));
        given()
            .when()
            .get("/checkins/" + id)
            .then()
            .body("remainingSeconds", is(0));
    }

    @Test
    void cancelledTimer() {
        String id = start("{\"duration\": \"PT1H\"}");

        given()
            .when()
            .delete("/checkins/" + id)
            .then()
            .statusCode(200)
            .body("accepted", is(true))
            .body("status", is("CANCELLED"));
    }

    @Test
    void durationMustBePositive() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"duration\": \"PT0S\"}")
            .when()
            .post("/checkins")
            .then()
            .statusCode(400)
            .body("category", is("VALIDATION"));
        given()
            .contentType(ContentType.JSON)
            .body("{}")
            .when()
            .post("/checkins")
            .then()
            .statusCode(400);
    }

    @Test
    void unknownTimer() {
        given().when().get("/checkins/nope").then().statusCode(404);
        given().when().post("/checkins/nope/check-in").then().statusCode(404);
        given().when().delete("/checkins/nope").then().statusCode(404);
    }
}
