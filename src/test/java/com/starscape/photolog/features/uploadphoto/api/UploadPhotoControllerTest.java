package com.starscape.photolog.features.uploadphoto.api;

import com.starscape.photolog.common.config.StorageType;
import com.starscape.photolog.features.uploadphoto.app.PhotoIngestionService;
import com.starscape.photolog.features.uploadphoto.app.UploadCommand;
import com.starscape.photolog.features.uploadphoto.app.UploadResult;
import com.starscape.photolog.features.uploadphoto.app.UploadStage;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UploadPhotoController.class)
class UploadPhotoControllerTest {

    private static final MockMultipartFile FILE =
            new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[] {1, 2, 3});

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PhotoIngestionService ingestionService;

    @Test
    void storedUploadIsCreated() throws Exception {
        when(ingestionService.upload(any())).thenReturn(new UploadResult(true, "p1", "http://x/photos/p1.jpg",
                Map.of(), 3, StorageType.LOCAL, null, UploadStage.COMPLETED, false));

        mockMvc.perform(multipart("/api/photos").file(FILE)
                        .param("tags", "a", "b")
                        .param("latitude", "37.5")
                        .param("longitude", "127.0")
                        .param("policy", "smart-crop"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.photo_id").value("p1"))
                .andExpect(jsonPath("$.stage").value("completed"));

        ArgumentCaptor<UploadCommand> command = ArgumentCaptor.forClass(UploadCommand.class);
        verify(ingestionService).upload(command.capture());
        assertEquals("a.jpg", command.getValue().filename());
        assertEquals(List.of("a", "b"), command.getValue().tags());
        assertEquals(37.5, command.getValue().location().latitude());
        assertEquals(ThumbnailPolicy.SMART_CROP, command.getValue().thumbnailPolicy());
    }

    @Test
    void backendFailureIsBadGateway() throws Exception {
        when(ingestionService.upload(any())).thenReturn(new UploadResult(false, "p1", null,
                Map.of(), 3, StorageType.LOCAL, "down", UploadStage.FILE_UPLOAD, false));

        mockMvc.perform(multipart("/api/photos").file(FILE))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.stage").value("file_upload"));
    }

    @Test
    void latitudeWithoutLongitudeIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/photos").file(FILE).param("latitude", "37.5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verify(ingestionService, never()).upload(any());
    }

    @Test
    void coordinatesOutOfRangeAreRejected() throws Exception {
        mockMvc.perform(multipart("/api/photos").file(FILE)
                        .param("latitude", "500")
                        .param("longitude", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verify(ingestionService, never()).upload(any());
    }

    @Test
    void nonNumericCoordinatesAreRejected() throws Exception {
        mockMvc.perform(multipart("/api/photos").file(FILE)
                        .param("latitude", "NaN")
                        .param("longitude", "127.0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(multipart("/api/photos").file(FILE)
                        .param("latitude", "37.5")
                        .param("longitude", "Infinity"))
                .andExpect(status().isBadRequest());

        verify(ingestionService, never()).upload(any());
    }

    @Test
    void unknownPolicyIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/photos").file(FILE).param("policy", "stretch"))
                .andExpect(status().isBadRequest());
    }
}
