package com.ownding.protect;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ApiSmokeTests {

    private static final String BASE = "/proxy/protect/integration/v1";
    private static final String API_KEY = "smoke-key";

    private static final AtomicInteger CAMERA_REQUESTS = new AtomicInteger();
    private static final AtomicReference<String> PATCH_BODY = new AtomicReference<>();
    private static final AtomicReference<String> PATCH_KEY = new AtomicReference<>();
    private static final DisposableServer UPSTREAM = startUpstream();

    @LocalServerPort
    private int port;

    @DynamicPropertySource
    static void protectProperties(DynamicPropertyRegistry registry) {
        registry.add("app.protect.host", () -> "127.0.0.1:" + UPSTREAM.port());
        registry.add("app.protect.api-key", () -> API_KEY);
    }

    @AfterAll
    static void stopUpstream() {
        UPSTREAM.disposeNow();
    }

    @Test
    void camerasAreFetchedOnceAndLookedUp() {
        WebTestClient client = createClient();

        client.get()
                .uri("/api/protect/cameras")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.length()").isEqualTo(2);

        client.get()
                .uri("/api/protect/cameras/lookup?name=FRONT DOOR")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data").isEqualTo("cam1");

        client.get()
                .uri("/api/protect/cameras/Front Door/snapshot")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_JPEG);

        assertEquals(1, CAMERA_REQUESTS.get());
    }

    @Test
    void unknownCameraIsNotFound() {
        createClient().get()
                .uri("/api/protect/cameras/lookup?name=Garage")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo(404);
        assertTrue(CAMERA_REQUESTS.get() <= 1);
    }

    @Test
    void viewportSwitchReachesController() {
        createClient().patch()
                .uri("/api/protect/viewports/vp1/liveview")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"liveviewId": "lv2"}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0);

        assertEquals("{\"liveview\":\"lv2\"}", PATCH_BODY.get());
        assertEquals(API_KEY, PATCH_KEY.get());
    }

    @Test
    void controllerErrorsAreReportedAsBadGateway() {
        createClient().get()
                .uri("/api/protect/liveviews")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.code").isEqualTo(403);
    }

    private WebTestClient createClient() {
        return WebTestClient.bindToServer()
                .baseUrl("http://127.0.0.1:" + port)
                .build();
    }

    private static DisposableServer startUpstream() {
        return HttpServer.create()
                .host("127.0.0.1")
                .port(0)
                .route(routes -> routes
                        .get(BASE + "/cameras", (request, response) -> {
                            CAMERA_REQUESTS.incrementAndGet();
                            return response.header("Content-Type", "application/json")
                                    .sendString(Mono.just("""
                                            [
                                              {"id": "cam1", "name": "Front Door", "state": "CONNECTED",
                                               "isMicEnabled": true, "micVolume": 80, "videoMode": "default",
                                               "hdrType": "auto"},
                                              {"id": "cam2", "name": "Back Yard", "state": "CONNECTED",
                                               "isMicEnabled": false, "micVolume": 0, "videoMode": "default",
                                               "hdrType": "off"}
                                            ]
                                            """));
                        })
                        .get(BASE + "/cameras/cam1/snapshot", (request, response) ->
                                response.header("Content-Type", "image/jpeg")
                                        .sendByteArray(Mono.just(new byte[]{(byte) 0xFF, (byte) 0xD8})))
                        .get(BASE + "/liveviews", (request, response) -> response.status(403).send())
                        .route(request -> request.uri().startsWith(BASE + "/viewers/"),
                                (request, response) -> request.receive().aggregate().asString()
                                        .defaultIfEmpty("")
                                        .flatMap(body -> {
                                            PATCH_BODY.set(body);
                                            PATCH_KEY.set(request.requestHeaders().get("X-API-KEY"));
                                            return response.status(200).send().then();
                                        })))
                .bindNow();
    }
}
