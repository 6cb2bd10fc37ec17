package pixel.tracking.app;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class TrackingFlowTest {
    private static final String DESKTOP_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) Chrome/126.0";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void injectThenOpen_ShouldTrackTheIssuedPixel() throws Exception {
        // Given
        String response = mockMvc.perform(post("/api/tracking/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"<html><body>Hi</body></html>\",\"campaignId\":\"flow-1\",\"emailId\":\"e1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pixelId", startsWith("pixel_")))
            .andExpect(jsonPath("$.content", containsString("https://track.example.com/track/open?pixelId=")))
            .andReturn().getResponse().getContentAsString();
        String pixelId = JsonPath.read(response, "$.pixelId");

        // When
        mockMvc.perform(get("/track/open")
                .param("pixelId", pixelId)
                .param("campaignId", "flow-1")
                .param("emailId", "e1")
                .header("User-Agent", DESKTOP_UA))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG));

        // Then
        mockMvc.perform(get("/api/tracking/pixels/" + pixelId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.opens").value(1))
            .andExpect(jsonPath("$.device").value("DESKTOP"))
            .andExpect(jsonPath("$.campaignId").value("flow-1"))
            .andExpect(jsonPath("$.location").value("Local"));

        mockMvc.perform(get("/api/campaigns/flow-1/open-rate").param("sent", "4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.opened").value(1))
            .andExpect(jsonPath("$.rate").value(25.0));
    }

    @Test
    void open_UnknownPixel_ShouldStillServeImage() throws Exception {
        mockMvc.perform(get("/track/pixel/pixel_never_issued"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG));

        mockMvc.perform(get("/api/tracking/pixels/pixel_never_issued"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.opens").value(1));
    }

    @Test
    void inject_BadBaseUrl_ShouldBeRejected() throws Exception {
        mockMvc.perform(post("/api/tracking/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"<body></body>\",\"pixelUrl\":\"ftp://example.com/x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", containsString("http or https")));
    }
}
