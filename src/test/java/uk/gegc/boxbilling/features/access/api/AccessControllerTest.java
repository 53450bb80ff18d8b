package uk.gegc.boxbilling.features.access.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.boxbilling.features.access.application.AccessControlService;
import uk.gegc.boxbilling.features.access.application.AccessDecision;

import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccessControllerTest {

    private static final UUID BOX_ID = UUID.fromString("6a3c5d20-1b7e-4f0a-9e2d-8c4b1a7f3e55");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccessControlService accessControlService;

    @Test
    @DisplayName("Granted access returns 200 with hasAccess=true")
    void granted() throws Exception {
        when(accessControlService.checkAccess(BOX_ID)).thenReturn(AccessDecision.allow());

        mockMvc.perform(get("/api/v1/boxes/{boxId}/access", BOX_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasAccess").value(true));
    }

    @Test
    @DisplayName("Denial is still a 200 and carries the reason")
    void denied() throws Exception {
        when(accessControlService.checkAccess(BOX_ID)).thenReturn(AccessDecision.deny("Subscription payment failed"));

        mockMvc.perform(get("/api/v1/boxes/{boxId}/access", BOX_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasAccess").value(false))
                .andExpect(jsonPath("$.reason").value("Subscription payment failed"));
    }

    @Test
    @DisplayName("Feature checks are routed by feature name")
    void featureCheck() throws Exception {
        when(accessControlService.checkFeatureAccess(BOX_ID, "api_access"))
                .thenReturn(AccessDecision.deny("Feature api_access requires a higher tier"));

        mockMvc.perform(get("/api/v1/boxes/{boxId}/access/{feature}", BOX_ID, "api_access"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasAccess").value(false));
    }

    @Test
    @DisplayName("Malformed box id returns 400")
    void malformedBoxId() throws Exception {
        mockMvc.perform(get("/api/v1/boxes/{boxId}/access", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }
}
