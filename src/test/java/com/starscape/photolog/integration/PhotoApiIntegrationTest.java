package com.starscape.photolog.integration;

import com.starscape.photolog.support.TestUtils;
import io.restassured.RestAssured;
import io.restassured.response.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of the HTTP API on the local backend: filesystem blobs and an in-memory H2 table.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PhotoApiIntegrationTest {

    private static final String BASE_URL = "http://localhost/storage";
    private static final Path STORAGE_DIR = createStorageDir();

    @LocalServerPort
    private int port;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("app.storage.type", () -> "local");
        registry.add("app.storage.local.base-path", STORAGE_DIR::toString);
        registry.add("app.storage.local.base-url", () -> BASE_URL);
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:apitest;DB_CLOSE_DELAY=-1");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("app.reconciler.enabled", () -> "false");
    }

    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }

    @Test
    void uploadReadServeAndDelete() throws IOException {
        byte[] jpeg = TestUtils.createTestImage(320, 240);

        Response upload = given()
                .multiPart("file", "holiday.jpg", jpeg, "image/jpeg")
                .multiPart("description", "harbour at dusk")
                .multiPart("tags", "sea")
                .multiPart("tags", "busan")
                .multiPart("latitude", "35.1796")
                .multiPart("longitude", "129.0756")
                .multiPart("city", "Busan")
                .post("/api/photos")
                .then()
                .statusCode(201)
                .body("success", equalTo(true))
                .body("stage", equalTo("completed"))
                .body("storage_type", equalTo("local"))
                .body("thumbnail_urls", hasKey("small"))
                .body("thumbnail_urls", hasKey("medium"))
                .body("thumbnail_urls", hasKey("large"))
                .extract()
                .response();

        String photoId = upload.path("photo_id");
        String fileUrl = upload.path("file_url");
        assertTrue(fileUrl.startsWith(BASE_URL + "/photos/" + photoId));

        given()
                .get("/api/photos/{id}", photoId)
                .then()
                .statusCode(200)
                .body("id", equalTo(photoId))
                .body("upload_status", equalTo("completed"))
                .body("description", equalTo("harbour at dusk"))
                .body("tags", hasItem("busan"))
                .body("location.city", equalTo("Busan"))
                .body("file_url", equalTo(fileUrl));

        byte[] served = given()
                .get("/storage/" + fileUrl.substring(BASE_URL.length() + 1))
                .then()
                .statusCode(200)
                .contentType(containsString("image/jpeg"))
                .extract()
                .asByteArray();
        assertArrayEquals(jpeg, served);

        given()
                .get("/api/photos/search/location?lat=35.18&lon=129.07&radiusKm=5")
                .then()
                .statusCode(200)
                .body("id", hasItem(photoId));

        given()
                .get("/api/storage/objects?prefix=thumbnails/" + photoId)
                .then()
                .statusCode(200)
                .body("size()", equalTo(3));

        given()
                .delete("/api/photos/{id}", photoId)
                .then()
                .statusCode(204);

        given()
                .get("/api/photos/{id}", photoId)
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));

        assertTrue(Files.notExists(STORAGE_DIR.resolve("photos").resolve(photoId + ".jpg")));
    }

    @Test
    void corruptUploadIsRejectedWithoutARecord() {
        given()
                .multiPart("file", "broken.jpg", "definitely not a jpeg".getBytes(StandardCharsets.UTF_8), "image/jpeg")
                .post("/api/photos")
                .then()
                .statusCode(400)
                .body("success", equalTo(false))
                .body("stage", equalTo("validation"))
                .body("photo_id", nullValue());
    }

    @Test
    void listReturnsPagesAndRejectsBadTokens() throws IOException {
        for (int i = 0; i < 3; i++) {
            given()
                    .multiPart("file", "list-" + i + ".png", TestUtils.createTestPngImage(20, 20), "image/png")
                    .post("/api/photos")
                    .then()
                    .statusCode(201);
        }

        given()
                .get("/api/photos?limit=2&orderBy=filename&direction=asc")
                .then()
                .statusCode(200)
                .body("records.size()", equalTo(2))
                .body("next_page_token", notNullValue());

        given()
                .get("/api/photos?page=abc")
                .then()
                .statusCode(400)
                .body("code", equalTo("BAD_REQUEST"));
    }

    @Test
    void searchRejectsOutOfRangeCoordinates() {
        given()
                .get("/api/photos/search/location?lat=120&lon=0")
                .then()
                .statusCode(400);
    }

    @Test
    void reconcileAndStorageInfoAreExposed() {
        given()
                .post("/api/admin/reconcile?hoursOld=1")
                .then()
                .statusCode(200)
                .body("count", equalTo(0));

        given()
                .get("/api/storage/info")
                .then()
                .statusCode(200)
                .body("storage_type", equalTo("local"))
                .body("blob_store", equalTo("FilesystemBlobStore"))
                .body("metadata_store", equalTo("JpaPhotoMetadataStore"))
                .body("thumbnail_sizes.name", hasItem("medium"));
    }

    private static Path createStorageDir() {
        try {
            return Files.createTempDirectory("photolog-api-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
