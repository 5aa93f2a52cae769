package com.example.sos.web;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.junit.jupiter.api.Assertions.fail;

import com.example.sos.model.OutboundMessage;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.ValidatableResponse;
import io.smallrye.reactive.messaging.memory.InMemoryConnector;
import io.smallrye.reactive.messaging.memory.InMemorySink;
import jakarta.enterprise.inject.Any;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.Test;

@QuarkusTest
class OtpResourceTest {

    @Inject
    @Any
    InMemoryConnector connector;

    private static void send(String path, String phone, int status) {
        given()
            .contentType(ContentType.JSON)
            .body("{\"phoneNumber\": \"%s\"}".formatted(phone))
            .when()
            .post(path)
            .then()
            .statusCode(status);
    }

    private static ValidatableResponse verify(
        String phone,
        String code
    ) {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"phoneNumber\": \"%s\", \"code\": \"%s\"}".formatted(phone, code))
            .when()
            .post("/otp/verify")
            .then();
    }

    /** The code travels on the outbound topic, addressed to the number being verified. */
    private String codeSentTo(String phone) throws InterruptedException {
        InMemorySink<OutboundMessage> sink = connector.sink("sos-outbound");
        for (int i = 0; i < 50; i++) {
            List<? extends Message<OutboundMessage>> received = List.copyOf(sink.received());
            for (Message<OutboundMessage> m : received) {
                OutboundMessage out = m.getPayload();
                if (phone.equals(out.to) && "otp".equals(out.template)) {
                    return out.params.get("code");
                }
            }
            Thread.sleep(100);
        }
        fail("No OTP published for " + phone);
        return null;
    }

    private static String wrong(String code) {
        char first = code.charAt(0) == '9' ? '0' : (char) (code.charAt(0) + 1);
        return first + code.substring(1);
    }

    @Test
    void sendThenVerify() throws InterruptedException {
        String phone = "+14155550201";
        given()
            .contentType(ContentType.JSON)
            .body("{\"phoneNumber\": \"%s\", \"purpose\": \"REGISTRATION\"}".formatted(phone))
            .when()
            .post("/otp/send")
            .then()
            .statusCode(200)
            .body("status", is("SENT"))
            .body("message", is("OTP sent to ********0201"))
            .body("expiresAt", notNullValue());

        String code = codeSentTo(phone);

        verify(phone, wrong(code))
            .statusCode(422)
            .body("status", is("INVALID_CODE"))
            .body("remainingAttempts", is(2));
        verify(phone, code).statusCode(200).body("status", is("VERIFIED"));
        verify(phone, code).statusCode(200).body("status", is("VERIFIED"));

        given()
            .when()
            .get("/otp/verified/" + phone)
            .then()
            .statusCode(200)
            .body("verified", is(true));
        given().when().delete("/otp/verified/" + phone).then().statusCode(204);
        given()
            .when()
            .get("/otp/verified/" + phone)
            .then()
            .body("verified", is(false));
    }

    @Test
    void secondRequestInsideCooldownIsRateLimited() {
        String phone = "+14155550202";
        send("/otp/send", phone, 200);

        given()
            .contentType(ContentType.JSON)
            .body("{\"phoneNumber\": \"%s\"}".formatted(phone))
            .when()
            .post("/otp/resend")
            .then()
            .statusCode(429)
            .body("status", is("RATE_LIMITED"))
            .body("retryAfter", notNullValue());
    }

    @Test
    void malformedNumber() {
        send("/otp/send", "12345", 400);
    }

    @Test
    void verifyWithoutPendingCode() {
        verify("+14155550203", "123456").statusCode(404).body("status", is("NOT_FOUND"));
    }

    @Test
    void missingCodeIsAValidationError() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"phoneNumber\": \"+14155550204\"}")
            .when()
            .post("/otp/verify")
            .then()
            .statusCode(400)
            .body("category", is("VALIDATION"));
    }
}
